package io.neocli.logging;

import io.neocli.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

public final class Slf4jCliLogger implements CliLogger {
    public static final String LOGGER_NAME = "neo";

    private final Logger delegate;
    private volatile LogLevel level;

    public Slf4jCliLogger() {
        this(LoggerFactory.getLogger(LOGGER_NAME), LogLevel.INFO);
    }

    public Slf4jCliLogger(Logger delegate, LogLevel level) {
        this.delegate = delegate;
        this.level = level == null ? LogLevel.INFO : level;
    }

    @Override
    public void debug(String message, Map<String, Object> context) {
        if (enabled(LogLevel.DEBUG)) {
            delegate.debug("[DEBUG] {}", render(message, context));
        }
    }

    @Override
    public void info(String message, Map<String, Object> context) {
        if (enabled(LogLevel.INFO)) {
            delegate.info("ℹ {}", render(message, context));
        }
    }

    @Override
    public void warn(String message, Map<String, Object> context) {
        if (enabled(LogLevel.WARN)) {
            delegate.warn("⚠ {}", render(message, context));
        }
    }

    @Override
    public void error(String message, Map<String, Object> context) {
        if (enabled(LogLevel.ERROR)) {
            delegate.error("✖ {}", render(message, context));
        }
    }

    @Override
    public void success(String message, Map<String, Object> context) {
        if (enabled(LogLevel.INFO)) {
            delegate.info("✓ {}", render(message, context));
        }
    }

    @Override
    public void log(String message) {
        if (level != LogLevel.NONE) {
            delegate.info(message);
        }
    }

    @Override
    public void setLevel(LogLevel level) {
        this.level = level == null ? LogLevel.INFO : level;
        if (this.level == LogLevel.DEBUG) {
            LogbackLevels.enableDebug(delegate.getName());
        }
    }

    @Override
    public LogLevel getLevel() {
        return level;
    }

    private boolean enabled(LogLevel candidate) {
        return level != LogLevel.NONE && candidate.ordinal() >= level.ordinal();
    }

    private static String render(String message, Map<String, Object> context) {
        if (context == null || context.isEmpty()) {
            return message;
        }
        return message + " " + Jsons.describeCompact(context);
    }
}
