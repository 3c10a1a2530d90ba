package com.sandcastle.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sandcastle.core.model.ExecutionResult;
import com.sandcastle.core.model.TestResult;
import com.sandcastle.core.model.TestStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON response for POST /api/v1/executions.
 *
 * <p>{@code total_count} is the number of submitted cases; {@code test_results} only
 * holds the cases that ran, since execution stops at the first failure.
 */
public record ExecutionResponse(
    boolean success,
    @JsonProperty("passed_count") int passedCount,
    @JsonProperty("total_count") int totalCount,
    @JsonProperty("total_ms") long totalMs,
    @JsonProperty("test_results") List<TestResultView> testResults
) {

    public static ExecutionResponse from(ExecutionResult result, int submitted) {
        var views = new ArrayList<TestResultView>();
        for (int i = 0; i < result.testResults().size(); i++) {
            views.add(TestResultView.from(i, result.testResults().get(i)));
        }
        return new ExecutionResponse(result.success(), result.passedCount(), submitted,
                result.totalMillis(), views);
    }

    /**
     * Per-test entry. Hidden cases never expose their input, expected value, actual value
     * or a wrong-answer message, which would reveal the expected value.
     */
    public record TestResultView(
        int index,
        String description,
        TestStatus status,
        boolean passed,
        boolean hidden,
        Object input,
        Object expected,
        Object actual,
        @JsonProperty("execution_ms") long executionMs,
        @JsonProperty("error_message") String errorMessage
    ) {

        static TestResultView from(int index, TestResult result) {
            var testCase = result.testCase();
            if (testCase.hidden()) {
                String message = result.status() == TestStatus.WRONG_ANSWER ? null : result.errorMessage();
                return new TestResultView(index, testCase.description(), result.status(), result.passed(),
                        true, null, null, null, result.executionMillis(), message);
            }
            return new TestResultView(index, testCase.description(), result.status(), result.passed(),
                    false, testCase.input(), testCase.expected(), result.actual(),
                    result.executionMillis(), result.errorMessage());
        }
    }
}
