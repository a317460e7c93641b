package com.stackforge.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setRun puts runId in MDC")
    void setRun() {
        MdcContext.setRun("a1b2c3d4");
        assertEquals("a1b2c3d4", MDC.get("runId"));
    }

    @Test
    @DisplayName("setStack puts runId, stack, and operation in MDC")
    void setStack() {
        MdcContext.setStack("a1b2c3d4", "dev/vpc", "launch");
        assertEquals("a1b2c3d4", MDC.get("runId"));
        assertEquals("dev/vpc", MDC.get("stack"));
        assertEquals("launch", MDC.get("operation"));
    }

    @Test
    @DisplayName("clearStack keeps the run id")
    void clearStack() {
        MdcContext.setStack("a1b2c3d4", "dev/vpc", "launch");
        MdcContext.clearStack();
        assertEquals("a1b2c3d4", MDC.get("runId"));
        assertNull(MDC.get("stack"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("clear removes all stackforge MDC keys")
    void clear() {
        MdcContext.setStack("a1b2c3d4", "dev/vpc", "launch");
        MdcContext.clear();
        assertNull(MDC.get("runId"));
        assertNull(MDC.get("stack"));
        assertNull(MDC.get("operation"));
    }
}
