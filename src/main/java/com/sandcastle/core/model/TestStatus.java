package com.sandcastle.core.model;

/**
 * Verdict for one evaluated test case.
 */
public enum TestStatus {
    PASSED,
    WRONG_ANSWER,
    RUNTIME_ERROR,
    NAME_NOT_FOUND,
    TIMEOUT;

    public String metricTag() {
        return name().toLowerCase();
    }
}
