package com.botsession.common.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * SLF4J logger for one bot session subsystem such as {@code "dispatch"}.
 * <p>
 * Messages are prefixed with {@code [subsystem]}, carry the subsystem in the
 * {@code subsystem} MDC key and end with their metadata as {@code {k=v, ...}}.
 * Level floor and subsystem filters are process-wide and set from the
 * logging config section.
 *
 * <pre>
 * SubsystemLogger log = SubsystemLogger.create("dispatch");
 * log.debug("Dispatching command", Map.of("trigger", "echo"));
 * </pre>
 */
public class SubsystemLogger {

    private static final String MDC_SUBSYSTEM = "subsystem";
    private static final List<String> subsystemFilters = new CopyOnWriteArrayList<>();
    private static volatile LogLevel minLevel = LogLevel.TRACE;

    private final String subsystem;
    private final Logger logger;

    private SubsystemLogger(String subsystem) {
        this.subsystem = subsystem;
        this.logger = LoggerFactory.getLogger("botsession." + subsystem.replace('/', '.'));
    }

    /**
     * @param subsystem subsystem path; nested parts are separated by '/'
     */
    public static SubsystemLogger create(String subsystem) {
        return new SubsystemLogger(subsystem);
    }

    public void debug(String message, Map<String, Object> meta) {
        log(LogLevel.DEBUG, message, meta, null);
    }

    public void warn(String message, Map<String, Object> meta, Throwable t) {
        log(LogLevel.WARN, message, meta, t);
    }

    /**
     * Restrict logging to subsystems equal to, or nested under, one of the
     * given prefixes. Null or no prefixes lets every subsystem log.
     */
    public static void setSubsystemFilter(String... prefixes) {
        subsystemFilters.clear();
        if (prefixes != null) {
            Stream.of(prefixes)
                    .filter(p -> p != null && !p.isBlank())
                    .map(String::trim)
                    .forEach(subsystemFilters::add);
        }
    }

    public static void setMinLevel(LogLevel level) {
        minLevel = level != null ? level : LogLevel.TRACE;
    }

    /** Whether the subsystem filters let this logger through. */
    public boolean shouldLog() {
        return subsystemFilters.isEmpty() || subsystemFilters.stream()
                .anyMatch(p -> subsystem.equals(p) || subsystem.startsWith(p + "/"));
    }

    public String getSubsystem() {
        return subsystem;
    }

    private void log(LogLevel level, String message, Map<String, Object> meta, Throwable t) {
        if (!level.isEnabledFor(minLevel) || !shouldLog()) {
            return;
        }
        MDC.put(MDC_SUBSYSTEM, subsystem);
        try {
            String line = formatMessage(message, meta);
            if (level == LogLevel.WARN) {
                logger.warn(line, t);
            } else {
                logger.debug(line, t);
            }
        } finally {
            MDC.remove(MDC_SUBSYSTEM);
        }
    }

    String formatMessage(String message, Map<String, Object> meta) {
        String line = "[" + subsystem + "] " + message;
        if (meta == null || meta.isEmpty()) {
            return line;
        }
        return meta.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ", line + " {", "}"));
    }
}
