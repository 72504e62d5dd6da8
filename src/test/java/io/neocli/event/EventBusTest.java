package io.neocli.event;

import ch.qos.logback.classic.Level;
import io.neocli.testing.LogCapture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventBusTest {
    private EventBus bus;
    private LogCapture logs;

    @BeforeEach
    void setUp() {
        bus = new EventBus(Runnable::run);
        logs = LogCapture.of(EventBus.class);
    }

    @AfterEach
    void tearDown() {
        logs.close();
    }

    @Test
    void deliversPayloadToHandlersInRegistrationOrder() {
        List<String> seen = new ArrayList<>();
        bus.on("commit", data -> seen.add("first:" + data));
        bus.on("commit", data -> seen.add("second:" + data));

        bus.emit("commit", "abc123");

        assertEquals(List.of("first:abc123", "second:abc123"), seen);
    }

    @Test
    void removedHandlerMissesLaterEmits() {
        List<String> seen = new ArrayList<>();
        EventHandler<Object> h1 = data -> seen.add("h1:" + data);
        EventHandler<Object> h2 = data -> seen.add("h2:" + data);
        bus.on("x", h1);
        bus.on("x", h2);

        bus.emit("x", "payload");
        bus.off("x", h1);
        bus.emit("x", "payload2");

        assertEquals(List.of("h1:payload", "h2:payload", "h2:payload2"), seen);
    }

    @Test
    void emitWithoutHandlersIsNoOp() {
        bus.emit("nobody-listens", 1);
        bus.emit("nobody-listens");
        assertTrue(logs.events().isEmpty());
    }

    @Test
    void failingHandlerDoesNotStopOthers() {
        List<Object> seen = new ArrayList<>();
        bus.on("e", data -> {
            throw new IllegalStateException("boom");
        });
        bus.on("e", seen::add);

        bus.emit("e", 1);

        assertEquals(List.of(1), seen);
        List<String> errors = logs.messages(Level.ERROR);
        assertEquals(1, errors.size());
        assertEquals("Event handler error for \"e\": boom", errors.get(0));
    }

    @Test
    void failedAsyncHandlerIsLogged() {
        bus.onAsync("sync", data -> CompletableFuture.failedFuture(new IllegalStateException("remote down")));

        bus.emit("sync", "payload");

        assertEquals(List.of("Event handler error for \"sync\": remote down"), logs.messages(Level.ERROR));
    }

    @Test
    void emitDoesNotWaitForAsyncHandlers() {
        CompletableFuture<Void> pending = new CompletableFuture<>();
        List<Object> seen = new ArrayList<>();
        bus.onAsync("later", data -> pending);
        bus.on("later", seen::add);

        bus.emit("later", "x");
        assertEquals(List.of("x"), seen);

        pending.complete(null);
        assertTrue(logs.messages(Level.ERROR).isEmpty());
    }

    @Test
    void onceHandlerRunsOnlyOnce() {
        List<Object> seen = new ArrayList<>();
        bus.once("init", seen::add);

        bus.emit("init", 1);
        bus.emit("init", 2);

        assertEquals(List.of(1), seen);
        assertEquals(0, bus.listenerCount("init"));
    }

    @Test
    void sameHandlerIsRegisteredOnce() {
        List<Object> seen = new ArrayList<>();
        EventHandler<Object> handler = seen::add;
        bus.on("e", handler);
        bus.on("e", handler);

        bus.emit("e", "x");

        assertEquals(List.of("x"), seen);
        assertEquals(1, bus.listenerCount("e"));
    }

    @Test
    void offRemovesHandlerAndEmptyEvent() {
        List<Object> seen = new ArrayList<>();
        EventHandler<Object> handler = seen::add;
        bus.on("e", handler);

        bus.off("e", handler);
        bus.emit("e", "x");

        assertTrue(seen.isEmpty());
        assertTrue(bus.eventNames().isEmpty());
        bus.off("unknown", handler);
    }

    @Test
    void handlerRemovedDuringEmitIsSkipped() {
        List<String> seen = new ArrayList<>();
        EventHandler<Object> second = data -> seen.add("second");
        bus.on("e", data -> {
            seen.add("first");
            bus.off("e", second);
        });
        bus.on("e", second);

        bus.emit("e");
        bus.emit("e");

        assertEquals(List.of("first", "first"), seen);
    }

    @Test
    void clearDuringEmitSkipsRemainingHandlers() {
        List<String> seen = new ArrayList<>();
        bus.on("e", data -> {
            seen.add("first");
            bus.clear("e");
        });
        bus.on("e", data -> seen.add("second"));

        bus.emit("e");

        assertEquals(List.of("first"), seen);
    }

    @Test
    void handlerLinkageErrorDoesNotStopOthers() {
        List<Object> seen = new ArrayList<>();
        bus.on("e", data -> {
            throw new NoClassDefFoundError("com/acme/Missing");
        });
        bus.on("e", seen::add);

        bus.emit("e", 1);

        assertEquals(List.of(1), seen);
        assertEquals(List.of("Event handler error for \"e\": com/acme/Missing"), logs.messages(Level.ERROR));
    }

    @Test
    void asyncFailureIsLoggedOnExecutorAfterEmitReturns() {
        List<Runnable> queued = new ArrayList<>();
        EventBus queuedBus = new EventBus(queued::add);
        queuedBus.onAsync("sync", data -> CompletableFuture.failedFuture(new IllegalStateException("remote down")));

        queuedBus.emit("sync", "payload");
        assertTrue(logs.messages(Level.ERROR).isEmpty());

        queued.forEach(Runnable::run);
        assertEquals(List.of("Event handler error for \"sync\": remote down"), logs.messages(Level.ERROR));
    }

    @Test
    void clearSingleEventOrEverything() {
        bus.on("a", data -> { });
        bus.on("b", data -> { });

        bus.clear("a");
        assertEquals(Set.of("b"), bus.eventNames());

        bus.clear();
        assertEquals(0, bus.listenerCount("b"));
        assertTrue(bus.eventNames().isEmpty());
    }
}
