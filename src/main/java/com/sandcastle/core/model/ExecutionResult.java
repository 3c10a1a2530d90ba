package com.sandcastle.core.model;

import java.util.List;

/**
 * Aggregate outcome of one execution request.
 *
 * @param success     true iff every test case was attempted and passed
 * @param testResults results in test-case order; evaluation stops at the first failure
 * @param totalMillis sum of the per-test execution times
 */
public record ExecutionResult(
    boolean success,
    List<TestResult> testResults,
    long totalMillis
) {

    public ExecutionResult {
        testResults = List.copyOf(testResults);
    }

    public int passedCount() {
        return (int) testResults.stream().filter(TestResult::passed).count();
    }

    public int totalCount() {
        return testResults.size();
    }
}
