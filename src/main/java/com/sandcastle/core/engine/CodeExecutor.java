package com.sandcastle.core.engine;

import com.sandcastle.core.model.ExecutionResult;
import com.sandcastle.core.model.TestCase;

import java.util.List;

/**
 * Runs submitted source against test cases in isolation.
 *
 * <p>Both {@code execute} variants validate syntax first. Test cases run sequentially in
 * the given order and execution stops at the first case that does not pass, so the result
 * may hold fewer entries than were supplied.
 */
public interface CodeExecutor {

    /**
     * @throws com.sandcastle.core.model.CodeExecutionException of kind SYNTAX when the
     *         source does not parse
     */
    void validateSyntax(String code);

    /**
     * Runs with the configured default timeout.
     */
    ExecutionResult execute(String code, List<TestCase> testCases, String functionName);

    /**
     * @param timeoutSeconds per-test wall-clock limit
     * @throws com.sandcastle.core.model.CodeExecutionException SYNTAX for unparsable source,
     *         RUNTIME when a worker vanished without reporting
     */
    ExecutionResult execute(String code, List<TestCase> testCases, String functionName, int timeoutSeconds);
}
