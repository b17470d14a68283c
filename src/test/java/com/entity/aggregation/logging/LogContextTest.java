package com.entity.aggregation.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forQuery should set queryId, intentType, and operation in MDC")
    void forQuerySetsMDC() {
        try (LogContext ctx = LogContext.forQuery("q-123", "RANKING")) {
            assertEquals("q-123", MDC.get("queryId"));
            assertEquals("RANKING", MDC.get("intentType"));
            assertEquals("query", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forIngest should set batchId, batchSize, and operation in MDC")
    void forIngestSetsMDC() {
        try (LogContext ctx = LogContext.forIngest("batch-9", 42)) {
            assertEquals("batch-9", MDC.get("batchId"));
            assertEquals("42", MDC.get("batchSize"));
            assertEquals("ingest", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("close should remove only the keys the context added")
    void closeClearsOwnKeys() {
        MDC.put("tenant", "acme");
        try (LogContext ctx = LogContext.forQuery("q-1", "SEARCH").with("stage", "SCORED")) {
            assertEquals("SCORED", MDC.get("stage"));
        }

        assertNull(MDC.get("queryId"));
        assertNull(MDC.get("intentType"));
        assertNull(MDC.get("operation"));
        assertNull(MDC.get("stage"));
        assertEquals("acme", MDC.get("tenant"));
    }

    @Test
    @DisplayName("newId should generate distinct ids")
    void newIdUnique() {
        assertNotEquals(LogContext.newId(), LogContext.newId());
    }
}
