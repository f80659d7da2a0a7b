package com.tracematrix.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Tracematrix-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setPhase(String phase) {
        MDC.put("phase", phase);
    }

    public static void setRequirement(String requirementId) {
        MDC.put("requirementId", requirementId);
    }

    public static void clearRequirement() {
        MDC.remove("requirementId");
    }

    public static void clear() {
        MDC.remove("phase");
        MDC.remove("requirementId");
    }
}
