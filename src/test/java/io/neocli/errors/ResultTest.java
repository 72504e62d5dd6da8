package io.neocli.errors;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResultTest {
    @Test
    void successCarriesData() {
        Result<String> result = Result.success("main");
        assertTrue(result.isSuccess());
        assertFalse(result.isFailure());
        assertEquals("main", result.data());
        assertNull(result.error());
        assertEquals(4, result.map(String::length).data());
    }

    @Test
    void failureCarriesError() {
        PluginError error = new PluginError("broken", "p");
        Result<String> result = Result.failure(error);
        assertTrue(result.isFailure());
        assertSame(error, result.error());
        assertSame(error, result.map(String::length).error());
        assertSame(error, assertThrows(PluginError.class, result::orElseThrow));
    }

    @Test
    void failureRequiresAnError() {
        assertThrows(NullPointerException.class, () -> Result.failure(null));
    }
}
