package com.assetpack.exporter.cli;

import org.slf4j.LoggerFactory;

import com.assetpack.exporter.cli.model.LogLevel;

/**
 * Applies the {@code --verbose} level to the application's loggers.
 */
public final class LoggingConfigurer {

    static final String APPLICATION_LOGGER = "com.assetpack.exporter";

    private LoggingConfigurer() {
        // Utility class
    }

    public static void apply(LogLevel level) {
        if (level == null) {
            return;
        }
        org.slf4j.Logger logger = LoggerFactory.getLogger(APPLICATION_LOGGER);
        if (logger instanceof ch.qos.logback.classic.Logger logbackLogger) {
            logbackLogger.setLevel(level.toLogbackLevel());
        }
    }
}
