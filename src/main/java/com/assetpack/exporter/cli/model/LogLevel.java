package com.assetpack.exporter.cli.model;

import ch.qos.logback.classic.Level;

/**
 * Verbosity accepted by {@code --verbose}.
 */
public enum LogLevel {
    TRACE(Level.TRACE),
    DEBUG(Level.DEBUG),
    INFO(Level.INFO),
    WARN(Level.WARN),
    ERROR(Level.ERROR);

    private final Level level;

    LogLevel(Level level) {
        this.level = level;
    }

    public Level toLogbackLevel() {
        return level;
    }
}
