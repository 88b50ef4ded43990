package com.civics.ingest.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forRun should set runId, mode, and operation in MDC")
    void forRunSetsMDC() {
        try (LogContext ctx = LogContext.forRun("run-1", "enrichment")) {
            assertEquals("run-1", MDC.get("runId"));
            assertEquals("enrichment", MDC.get("mode"));
            assertEquals("ingest", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forProvider should set runId and provider in MDC")
    void forProviderSetsMDC() {
        try (LogContext ctx = LogContext.forProvider("run-1", "federal")) {
            assertEquals("federal", MDC.get("provider"));
            assertEquals("fetch", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("MDC should be cleared on close")
    void mdcClearedOnClose() {
        LogContext ctx = LogContext.forEntity("run-1", "c-1").with("phase", "add");
        assertEquals("c-1", MDC.get("canonicalId"));
        assertEquals("add", MDC.get("phase"));

        ctx.close();

        assertNull(MDC.get("canonicalId"));
        assertNull(MDC.get("phase"));
        assertNull(MDC.get("runId"));
    }

    @Test
    @DisplayName("Nested contexts should only remove their own keys")
    void nestedContexts() {
        try (LogContext run = LogContext.forRun("run-1", "first_time")) {
            try (LogContext entity = LogContext.forEntity("run-1", "c-1")) {
                assertEquals("c-1", MDC.get("canonicalId"));
            }
            assertNull(MDC.get("canonicalId"));
            assertEquals("first_time", MDC.get("mode"));
        }
    }

    @Test
    @DisplayName("generateRunId should produce unique ids")
    void uniqueRunIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateRunId());
        }
        assertEquals(100, ids.size());
    }
}
