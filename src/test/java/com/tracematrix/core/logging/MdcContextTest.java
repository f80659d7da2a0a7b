package com.tracematrix.core.logging;

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
    @DisplayName("setPhase puts phase in MDC")
    void setPhase() {
        MdcContext.setPhase("scan");
        assertEquals("scan", MDC.get("phase"));
    }

    @Test
    @DisplayName("clearRequirement keeps the phase")
    void clearRequirement() {
        MdcContext.setPhase("link");
        MdcContext.setRequirement("REQ-001");
        assertEquals("REQ-001", MDC.get("requirementId"));

        MdcContext.clearRequirement();

        assertNull(MDC.get("requirementId"));
        assertEquals("link", MDC.get("phase"));
    }

    @Test
    @DisplayName("clear removes all tracematrix MDC keys")
    void clear() {
        MdcContext.setPhase("sign");
        MdcContext.setRequirement("REQ-001");
        MdcContext.clear();
        assertNull(MDC.get("phase"));
        assertNull(MDC.get("requirementId"));
    }
}
