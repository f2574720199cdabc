package com.supplier.matching.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

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
        try (LogContext ctx = LogContext.forRun("run-123", "HYBRID")) {
            assertEquals("run-123", MDC.get("runId"));
            assertEquals("HYBRID", MDC.get("mode"));
            assertEquals("match", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forExport should set runId, format, and operation in MDC")
    void forExportSetsMDC() {
        try (LogContext ctx = LogContext.forExport("run-456", "csv")) {
            assertEquals("run-456", MDC.get("runId"));
            assertEquals("csv", MDC.get("format"));
            assertEquals("export", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("MDC should be cleaned up after try-with-resources")
    void tryWithResourcesCleansUp() {
        try (LogContext ctx = LogContext.forRun("run-123", "TEXT").with("phase", "score")) {
            assertEquals("score", MDC.get("phase"));
        }
        assertNull(MDC.get("runId"));
        assertNull(MDC.get("mode"));
        assertNull(MDC.get("operation"));
        assertNull(MDC.get("phase"));
    }

    @Test
    @DisplayName("Keys set outside the context are left alone")
    void foreignKeysKept() {
        MDC.put("requestId", "req-1");
        try (LogContext ctx = LogContext.forRun("run-1", "TEXT")) {
            assertEquals("req-1", MDC.get("requestId"));
        }
        assertEquals("req-1", MDC.get("requestId"));
    }

    @Test
    @DisplayName("generateRunId should produce unique values")
    void generateRunIdUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateRunId());
        }
        assertEquals(100, ids.size());
    }

    @Test
    @DisplayName("wrap() carries the run context onto worker threads")
    void wrapPropagatesToWorker() throws Exception {
        ExecutorService worker = Executors.newSingleThreadExecutor();
        try {
            String seen;
            try (LogContext ctx = LogContext.forRun("run-42", "HYBRID")) {
                seen = worker.submit(LogContext.wrap(() -> MDC.get("runId"))).get();
            }
            assertEquals("run-42", seen);

            // the worker's MDC is left clean for the next task
            assertNull(worker.submit(() -> MDC.get("runId")).get());
        } finally {
            worker.shutdownNow();
        }
    }
}
