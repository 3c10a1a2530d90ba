package com.sandcastle.core.model;

/**
 * Declared execution limits, fixed for the lifetime of an executor.
 *
 * @param timeoutSeconds wall-clock limit per test case
 * @param memoryLimitMb  address-space limit of each worker interpreter
 */
public record ExecutorConfig(int timeoutSeconds, int memoryLimitMb) {

    public static final int DEFAULT_TIMEOUT_SECONDS = 5;
    public static final int DEFAULT_MEMORY_LIMIT_MB = 256;

    public ExecutorConfig {
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeoutSeconds must be positive: " + timeoutSeconds);
        }
        if (memoryLimitMb <= 0) {
            throw new IllegalArgumentException("memoryLimitMb must be positive: " + memoryLimitMb);
        }
    }

    public static ExecutorConfig defaults() {
        return new ExecutorConfig(DEFAULT_TIMEOUT_SECONDS, DEFAULT_MEMORY_LIMIT_MB);
    }
}
