package com.taskrunner.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing taskrunner MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTask(String taskId) {
        MDC.put("taskId", taskId);
    }

    public static void setStep(String taskId, String step) {
        MDC.put("taskId", taskId);
        MDC.put("step", step);
    }

    public static void setNode(String nodeId) {
        MDC.put("nodeId", nodeId);
    }

    public static void clearNode() {
        MDC.remove("nodeId");
    }

    public static void clear() {
        MDC.remove("taskId");
        MDC.remove("step");
        MDC.remove("nodeId");
    }
}
