package com.sandcastle.core.model;

/**
 * Outcome of evaluating one {@link TestCase}.
 *
 * @param testCase        the evaluated test case
 * @param passed          true only for {@link TestStatus#PASSED}
 * @param actual          value returned by the candidate; {@code null} when it did not return
 * @param executionMillis time spent in the candidate function
 * @param errorMessage    plain-text explanation for non-passing results
 * @param status          verdict
 */
public record TestResult(
    TestCase testCase,
    boolean passed,
    Object actual,
    long executionMillis,
    String errorMessage,
    TestStatus status
) {

    public static TestResult passed(TestCase testCase, Object actual, long executionMillis) {
        return new TestResult(testCase, true, actual, executionMillis, null, TestStatus.PASSED);
    }

    public static TestResult wrongAnswer(TestCase testCase, Object actual, long executionMillis, String message) {
        return new TestResult(testCase, false, actual, executionMillis, message, TestStatus.WRONG_ANSWER);
    }

    public static TestResult failed(TestCase testCase, TestStatus status, String message) {
        return new TestResult(testCase, false, null, 0, message, status);
    }

    public static TestResult timedOut(TestCase testCase, long timeoutSeconds) {
        return new TestResult(testCase, false, null, timeoutSeconds * 1000,
                "Timeout: exceeded " + timeoutSeconds + "s", TestStatus.TIMEOUT);
    }
}
