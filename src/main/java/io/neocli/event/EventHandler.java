package io.neocli.event;

@FunctionalInterface
public interface EventHandler<T> {
    void handle(T data) throws Exception;
}
