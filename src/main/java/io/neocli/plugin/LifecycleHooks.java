package io.neocli.plugin;

import io.neocli.errors.Result;

/**
 * Optional callbacks a plugin receives around command execution. Failures are logged by the
 * registry and never reach the command.
 */
public interface LifecycleHooks {
    default void beforeCommand(String commandName, Object options) throws Exception {
    }

    default void afterCommand(String commandName, Result<Void> result) throws Exception {
    }

    default void onError(Throwable error) throws Exception {
    }

    default void onExit(int code) throws Exception {
    }
}
