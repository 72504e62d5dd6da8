package io.neocli.logging;

import java.util.Map;

/**
 * Console logger handed to plugins through their context.
 */
public interface CliLogger {
    void debug(String message, Map<String, Object> context);

    void info(String message, Map<String, Object> context);

    void warn(String message, Map<String, Object> context);

    void error(String message, Map<String, Object> context);

    void success(String message, Map<String, Object> context);

    void log(String message);

    void setLevel(LogLevel level);

    LogLevel getLevel();

    default void debug(String message) {
        debug(message, null);
    }

    default void info(String message) {
        info(message, null);
    }

    default void warn(String message) {
        warn(message, null);
    }

    default void error(String message) {
        error(message, null);
    }

    default void success(String message) {
        success(message, null);
    }
}
