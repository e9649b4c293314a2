package io.fixorder.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

final class LoggingConfigurator {
    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String CLIENT_LOGGER = "io.fixorder";

    private LoggingConfigurator() {
    }

    static void enableVerboseLogging() {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext context) {
            Logger clientLogger = context.getLogger(CLIENT_LOGGER);
            clientLogger.setLevel(Level.DEBUG);
            return;
        }
        LOGGER.warn(
            "Verbose logging requested but backend {} does not support dynamic level updates",
            factory.getClass().getName()
        );
    }
}
