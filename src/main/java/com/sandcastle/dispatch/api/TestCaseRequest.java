package com.sandcastle.dispatch.api;

import com.sandcastle.core.model.TestCase;

import java.util.Map;

/**
 * One test case in an {@link ExecutionRequest}. {@code input} maps parameter names to
 * argument values.
 */
public record TestCaseRequest(
    Map<String, Object> input,
    Object expected,
    String description,
    Boolean hidden
) {

    public TestCase toTestCase() {
        return new TestCase(input, expected, description, hidden != null && hidden);
    }
}
