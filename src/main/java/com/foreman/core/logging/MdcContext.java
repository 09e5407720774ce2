package com.foreman.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Foreman-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setPhase(String phase) {
        MDC.put("sessionPhase", phase);
    }

    public static void setTask(String taskId) {
        MDC.put("taskId", taskId);
    }

    public static void clearTask() {
        MDC.remove("taskId");
    }

    public static void clear() {
        MDC.remove("sessionPhase");
        MDC.remove("taskId");
    }
}
