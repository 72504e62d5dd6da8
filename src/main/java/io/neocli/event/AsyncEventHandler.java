package io.neocli.event;

import java.util.concurrent.CompletionStage;

/**
 * Handler whose work completes later. {@link EventBus#emit(String, Object)} never waits for the
 * returned stage; a failed stage is only logged.
 */
@FunctionalInterface
public interface AsyncEventHandler<T> {
    CompletionStage<?> handle(T data) throws Exception;
}
