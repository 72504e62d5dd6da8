package io.neocli.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adjusts logback levels at runtime for {@code --verbose}.
 */
public final class LogbackLevels {
    private static final Logger log = LoggerFactory.getLogger(LogbackLevels.class);

    private LogbackLevels() {
    }

    public static void enableDebug(String... loggerNames) {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext)) {
            log.debug("logback backend not detected; leaving logging at defaults");
            return;
        }
        LoggerContext context = (LoggerContext) factory;
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.DEBUG);
        for (String name : loggerNames) {
            context.getLogger(name).setLevel(Level.DEBUG);
        }
    }
}
