package com.identity.engine.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LoggingContextTest {

    @AfterEach
    void tearDown() {
        LoggingContext.clearAll();
    }

    @Test
    void forAggregate_shouldPopulateAndClearContext() {
        String traceId;
        try (var ctx = LoggingContext.forAggregate("tenant-1", "user", "user-1")) {
            assertEquals("tenant-1", MDC.get(LoggingContext.TENANT_ID));
            assertEquals("user", MDC.get(LoggingContext.AGGREGATE_TYPE));
            assertEquals("user-1", MDC.get(LoggingContext.AGGREGATE_ID));
            traceId = MDC.get(LoggingContext.TRACE_ID);
            assertNotNull(traceId);
        }

        assertNull(MDC.get(LoggingContext.TENANT_ID));
        assertNull(MDC.get(LoggingContext.AGGREGATE_ID));
        assertEquals(traceId, MDC.get(LoggingContext.TRACE_ID));
    }

    @Test
    void nestedContexts_shouldKeepTraceId() {
        try (var outer = LoggingContext.forClient("tenant-1", "svc")) {
            String traceId = MDC.get(LoggingContext.TRACE_ID);
            try (var inner = LoggingContext.forAggregate("tenant-1", "user", "user-1")) {
                assertEquals(traceId, MDC.get(LoggingContext.TRACE_ID));
                assertEquals("svc", MDC.get(LoggingContext.CLIENT_ID));
            }
        }
    }

    @Test
    void captureAndRestore_shouldCarryContextToAnotherThread() throws InterruptedException {
        Map<String, String> captured;
        try (var ctx = LoggingContext.forAggregate("tenant-1", "user", "user-1")) {
            captured = LoggingContext.capture();
        }

        String[] seen = new String[3];
        Thread worker = new Thread(() -> {
            LoggingContext.restore(captured);
            seen[0] = MDC.get(LoggingContext.AGGREGATE_ID);
            seen[1] = MDC.get(LoggingContext.TRACE_ID);
            LoggingContext.clearAll();
            seen[2] = MDC.get(LoggingContext.TRACE_ID);
        });
        worker.start();
        worker.join(5000);

        assertEquals("user-1", seen[0]);
        assertEquals(captured.get(LoggingContext.TRACE_ID), seen[1]);
        assertNull(seen[2]);
    }

    @Test
    void restore_shouldIgnoreMissingSnapshot() {
        LoggingContext.restore(null);

        assertNull(MDC.get(LoggingContext.TENANT_ID));
    }
}
