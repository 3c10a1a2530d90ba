package com.sandcastle.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Sandcastle-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setExecution(String executionId, String functionName) {
        MDC.put("executionId", executionId);
        MDC.put("functionName", functionName);
    }

    public static void setTestIndex(int testIndex) {
        MDC.put("testIndex", String.valueOf(testIndex));
    }

    public static void clear() {
        MDC.remove("executionId");
        MDC.remove("functionName");
        MDC.remove("testIndex");
    }
}
