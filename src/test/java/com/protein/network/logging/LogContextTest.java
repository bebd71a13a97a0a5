package com.protein.network.logging;

import com.protein.network.core.model.AnalysisStage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("forAnalysis should set run id and operation")
    void forAnalysis() {
        try (LogContext ctx = LogContext.forAnalysis("run-1")) {
            assertEquals("run-1", MDC.get("runId"));
            assertEquals("analyze", MDC.get("operation"));
        }
        assertNull(MDC.get("runId"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("Closing a nested stage context should keep the run id")
    void nestedStage() {
        try (LogContext analysis = LogContext.forAnalysis("run-2")) {
            try (LogContext stage = LogContext.forStage(AnalysisStage.JOIN_ATTRIBUTES)) {
                assertEquals("join-attributes", MDC.get("stage"));
                assertEquals("run-2", MDC.get("runId"));
            }
            assertNull(MDC.get("stage"));
            assertEquals("run-2", MDC.get("runId"));
        }
    }

    @Test
    @DisplayName("forImport should set source and operation")
    void forImport() {
        try (LogContext ctx = LogContext.forImport("interactions").with("file", "edges.tsv")) {
            assertEquals("interactions", MDC.get("source"));
            assertEquals("import", MDC.get("operation"));
            assertEquals("edges.tsv", MDC.get("file"));
        }
        assertNull(MDC.get("file"));
    }

    @Test
    @DisplayName("Run ids should be unique")
    void uniqueRunIds() {
        assertNotEquals(LogContext.generateRunId(), LogContext.generateRunId());
    }
}
