package com.botsession.common.logging;

import java.util.Locale;
import java.util.Map;

/**
 * Minimum level accepted by {@link SubsystemLogger}, ordered from quietest to
 * most verbose.
 */
public enum LogLevel {
    SILENT(0),
    ERROR(1),
    WARN(2),
    INFO(3),
    DEBUG(4),
    TRACE(5);

    private static final Map<String, LogLevel> ALIASES = Map.of(
            "silent", SILENT,
            "off", SILENT,
            "error", ERROR,
            "warn", WARN,
            "warning", WARN,
            "info", INFO,
            "debug", DEBUG,
            "trace", TRACE);

    private final int verbosity;

    LogLevel(int verbosity) {
        this.verbosity = verbosity;
    }

    /**
     * Resolve a level name from configuration; blank or unknown names give
     * {@code fallback}.
     */
    public static LogLevel normalize(String level, LogLevel fallback) {
        if (level == null || level.isBlank()) {
            return fallback;
        }
        return ALIASES.getOrDefault(level.trim().toLowerCase(Locale.ROOT), fallback);
    }

    public static LogLevel normalize(String level) {
        return normalize(level, INFO);
    }

    /**
     * Whether a message at this level passes a logger configured with
     * {@code minLevel}. Nothing passes {@link #SILENT}.
     */
    public boolean isEnabledFor(LogLevel minLevel) {
        return this != SILENT && minLevel != SILENT && verbosity <= minLevel.verbosity;
    }
}
