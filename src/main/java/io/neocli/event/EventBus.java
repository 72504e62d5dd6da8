package io.neocli.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * In-process publish/subscribe. Handlers come from independently authored plugins, so a failing
 * handler is logged and never stops the remaining handlers of the same emit.
 */
public final class EventBus {
    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    @FunctionalInterface
    private interface Dispatch {
        CompletionStage<?> invoke(Object data) throws Exception;
    }

    // event -> (handler reference -> dispatch), insertion ordered
    private final Map<String, LinkedHashMap<Object, Dispatch>> handlers = new LinkedHashMap<>();
    private final Executor asyncLogExecutor;

    public EventBus() {
        this(ForkJoinPool.commonPool());
    }

    /**
     * @param asyncLogExecutor runs the failure logging of asynchronous handlers, after {@code emit} returns
     */
    public EventBus(Executor asyncLogExecutor) {
        this.asyncLogExecutor = asyncLogExecutor;
    }

    public void emit(String event) {
        emit(event, null);
    }

    public void emit(String event, Object data) {
        LinkedHashMap<Object, Dispatch> eventHandlers = handlers.get(event);
        if (eventHandlers == null) {
            return;
        }
        List<Object> snapshot = new ArrayList<>(eventHandlers.keySet());
        for (Object handler : snapshot) {
            // a handler removed by an earlier one in this emit is skipped
            LinkedHashMap<Object, Dispatch> live = handlers.get(event);
            Dispatch dispatch = live == null ? null : live.get(handler);
            if (dispatch == null) {
                continue;
            }
            try {
                CompletionStage<?> pending = dispatch.invoke(data);
                if (pending != null) {
                    pending.whenCompleteAsync((ignored, failure) -> {
                        if (failure != null) {
                            logHandlerError(event, failure);
                        }
                    }, asyncLogExecutor);
                }
            } catch (Exception | LinkageError | AssertionError e) {
                logHandlerError(event, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    public <T> void on(String event, EventHandler<T> handler) {
        EventHandler<Object> typed = (EventHandler<Object>) handler;
        subscribe(event, handler, data -> {
            typed.handle(data);
            return null;
        });
    }

    @SuppressWarnings("unchecked")
    public <T> void onAsync(String event, AsyncEventHandler<T> handler) {
        AsyncEventHandler<Object> typed = (AsyncEventHandler<Object>) handler;
        subscribe(event, handler, typed::handle);
    }

    public void off(String event, Object handler) {
        LinkedHashMap<Object, Dispatch> eventHandlers = handlers.get(event);
        if (eventHandlers == null) {
            return;
        }
        eventHandlers.remove(handler);
        if (eventHandlers.isEmpty()) {
            handlers.remove(event);
        }
    }

    public <T> void once(String event, EventHandler<T> handler) {
        EventHandler<T> wrapper = new EventHandler<>() {
            @Override
            public void handle(T data) throws Exception {
                off(event, this);
                handler.handle(data);
            }
        };
        on(event, wrapper);
    }

    public void clear() {
        handlers.clear();
    }

    public void clear(String event) {
        if (event == null) {
            clear();
            return;
        }
        handlers.remove(event);
    }

    public int listenerCount(String event) {
        LinkedHashMap<Object, Dispatch> eventHandlers = handlers.get(event);
        return eventHandlers == null ? 0 : eventHandlers.size();
    }

    public Set<String> eventNames() {
        return Set.copyOf(handlers.keySet());
    }

    private static void logHandlerError(String event, Throwable failure) {
        log.error("Event handler error for \"{}\": {}", event, failure.getMessage(), failure);
    }

    private void subscribe(String event, Object handler, Dispatch dispatch) {
        if (event == null || handler == null) {
            throw new IllegalArgumentException("event and handler are required");
        }
        handlers.computeIfAbsent(event, k -> new LinkedHashMap<>()).putIfAbsent(handler, dispatch);
    }
}
