package com.botsession.common.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SubsystemLoggerTest {

    @AfterEach
    void reset() {
        SubsystemLogger.setSubsystemFilter();
        SubsystemLogger.setMinLevel(LogLevel.TRACE);
    }

    @Test
    void formatMessage_prefixesSubsystem() {
        SubsystemLogger log = SubsystemLogger.create("dispatch");
        assertEquals("[dispatch] hello", log.formatMessage("hello", null));
    }

    @Test
    void formatMessage_appendsMeta() {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("trigger", "echo");
        meta.put("params", 2);

        String line = SubsystemLogger.create("dispatch").formatMessage("ran", meta);

        assertEquals("[dispatch] ran {trigger=echo, params=2}", line);
    }

    @Test
    void shouldLog_matchesPrefixOnPathBoundary() {
        SubsystemLogger.setSubsystemFilter("dispatch", " ", null);

        assertTrue(SubsystemLogger.create("dispatch").shouldLog());
        assertTrue(SubsystemLogger.create("dispatch/registry").shouldLog());
        assertFalse(SubsystemLogger.create("dispatcher").shouldLog());
    }

    @Test
    void setSubsystemFilter_emptyClears() {
        SubsystemLogger.setSubsystemFilter("channel");
        SubsystemLogger.setSubsystemFilter();

        assertTrue(SubsystemLogger.create("dispatch").shouldLog());
    }

    @Test
    void logMethods_belowMinLevel_doNotThrow() {
        SubsystemLogger.setMinLevel(LogLevel.SILENT);
        SubsystemLogger log = SubsystemLogger.create("dispatch");

        assertDoesNotThrow(() -> {
            log.debug("quiet", null);
            log.warn("quiet", Map.of("k", "v"), new IllegalStateException("x"));
        });
    }
}
