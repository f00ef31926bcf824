package com.forecast.pipeline.logging;

import com.forecast.pipeline.core.model.CompositeKey;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class LogContextTest {

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("Should set and clear stage context")
    void testStageContext() {
        try (LogContext ctx = LogContext.forStage("forecastScaleCap", "capped_forecast", CompositeKey.of("EDOLLAR", "ewmac8"))) {
            assertEquals("forecastScaleCap", MDC.get("stage"));
            assertEquals("capped_forecast", MDC.get("attribute"));
            assertEquals("EDOLLAR/ewmac8", MDC.get("key"));
            assertEquals("compute", MDC.get("operation"));
        }
        assertNull(MDC.get("stage"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("Nested contexts should restore the outer values")
    void testNestedRestore() {
        try (LogContext outer = LogContext.forStage("forecastScaleCap", "capped_forecast", CompositeKey.of("X", "v"))) {
            try (LogContext inner = LogContext.forStage("rules", "raw_forecast", CompositeKey.of("X", "v"))) {
                assertEquals("rules", MDC.get("stage"));
            }
            assertEquals("forecastScaleCap", MDC.get("stage"));
            assertEquals("capped_forecast", MDC.get("attribute"));
        }
        assertNull(MDC.get("stage"));
    }

    @Test
    @DisplayName("Should support invalidation context with extra keys")
    void testInvalidationContext() {
        try (LogContext ctx = LogContext.forInvalidation("entity").with("entityId", "EDOLLAR")) {
            assertEquals("invalidate", MDC.get("operation"));
            assertEquals("entity", MDC.get("scope"));
            assertEquals("EDOLLAR", MDC.get("entityId"));
            assertNotNull(MDC.get("invalidationId"));
        }
        assertNull(MDC.get("entityId"));
        assertNull(MDC.get("invalidationId"));
    }
}
