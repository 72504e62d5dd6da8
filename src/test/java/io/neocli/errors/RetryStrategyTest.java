package io.neocli.errors;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryStrategyTest {
    @Test
    void recoversOnlyNetworkAndFileSystemErrors() {
        RetryStrategy strategy = new RetryStrategy();

        assertTrue(strategy.canRecover(new NetworkError("down")));
        assertTrue(strategy.canRecover(new FileSystemError("locked", "/x", FileSystemError.Operation.ACCESS)));

        assertFalse(strategy.canRecover(new CommandError("x", "push")));
        assertFalse(strategy.canRecover(new ValidationError("x")));
        assertFalse(strategy.canRecover(new ConfigurationError("x")));
        assertFalse(strategy.canRecover(new PluginError("x", "p")));
        assertFalse(strategy.canRecover(new AuthenticationError()));
        assertFalse(strategy.canRecover(new PermissionError("x", "repo")));
        assertFalse(strategy.canRecover(new ErrorHandler(System.err, status -> { }).normalize("raw")));
    }

    @Test
    void waitsWithLinearBackoff() throws Exception {
        List<Long> delays = new ArrayList<>();
        new RetryStrategy(3, 100L, true, delays::add).recover(new NetworkError("down"));
        assertEquals(List.of(100L, 200L, 300L), delays);
    }

    @Test
    void waitsWithFixedDelayWhenBackoffDisabled() throws Exception {
        List<Long> delays = new ArrayList<>();
        new RetryStrategy(2, 50L, false, delays::add).recover(new NetworkError("down"));
        assertEquals(List.of(50L, 50L), delays);
    }

    @Test
    void defaultsToThreeAttempts() {
        assertEquals(3, new RetryStrategy().maxRetries());
    }

    @Test
    void rejectsNegativeSettings() {
        assertThrows(IllegalArgumentException.class, () -> new RetryStrategy(-1, 10L, true));
        assertThrows(IllegalArgumentException.class, () -> new RetryStrategy(1, -10L, true));
    }
}
