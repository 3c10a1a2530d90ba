package com.sandcastle.core.engine;

import com.sandcastle.core.logging.MdcContext;
import com.sandcastle.core.metrics.SandcastleMetrics;
import com.sandcastle.core.model.CodeExecutionException;
import com.sandcastle.core.model.ErrorKind;
import com.sandcastle.core.model.ExecutionResult;
import com.sandcastle.core.model.ExecutorConfig;
import com.sandcastle.core.model.TestCase;
import com.sandcastle.core.model.TestResult;
import com.sandcastle.core.syntax.SyntaxValidator;
import com.sandcastle.sandbox.WorkerSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Default {@link CodeExecutor}: one fresh worker process per test case.
 *
 * <p>The executor holds no per-call state, so concurrent calls are independent. The
 * reported total time is the sum of per-test times, not wall-clock time.
 */
@Service
public class SandboxCodeExecutor implements CodeExecutor {

    private static final Logger log = LoggerFactory.getLogger(SandboxCodeExecutor.class);

    private final SyntaxValidator syntaxValidator;
    private final WorkerSupervisor supervisor;
    private final ExecutorConfig config;
    private final SandcastleMetrics metrics;

    public SandboxCodeExecutor(SyntaxValidator syntaxValidator, WorkerSupervisor supervisor,
                               ExecutorConfig config,
                               @Autowired(required = false) SandcastleMetrics metrics) {
        this.syntaxValidator = syntaxValidator;
        this.supervisor = supervisor;
        this.config = config;
        this.metrics = metrics;
    }

    @Override
    public void validateSyntax(String code) {
        try {
            syntaxValidator.validate(code);
        } catch (CodeExecutionException e) {
            if (e.getKind() == ErrorKind.SYNTAX && metrics != null) {
                metrics.recordSyntaxRejection();
            }
            throw e;
        }
    }

    @Override
    public ExecutionResult execute(String code, List<TestCase> testCases, String functionName) {
        return execute(code, testCases, functionName, config.timeoutSeconds());
    }

    @Override
    public ExecutionResult execute(String code, List<TestCase> testCases, String functionName,
                                   int timeoutSeconds) {
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeoutSeconds must be positive, got " + timeoutSeconds);
        }
        String executionId = UUID.randomUUID().toString().substring(0, 8);
        MdcContext.setExecution(executionId, functionName);
        try {
            validateSyntax(code);
            List<TestCase> cases = testCases == null ? List.of() : testCases;

            Duration timeout = Duration.ofSeconds(timeoutSeconds);
            var results = new ArrayList<TestResult>();
            long totalMillis = 0;
            boolean allPassed = true;

            for (int i = 0; i < cases.size(); i++) {
                MdcContext.setTestIndex(i);
                TestResult result = supervisor.runOne(code, cases.get(i), functionName, timeout);
                results.add(result);
                totalMillis += result.executionMillis();
                if (metrics != null) {
                    metrics.recordTestResult(result.status(), result.executionMillis());
                }
                if (!result.passed()) {
                    log.info("Test {} of {} failed with {}: {}", i + 1, cases.size(),
                            result.status(), result.errorMessage());
                    allPassed = false;
                    break;
                }
            }

            boolean success = allPassed && results.size() == cases.size();
            log.info("Execution {} finished: {}/{} passed in {}ms", executionId,
                    results.stream().filter(TestResult::passed).count(), cases.size(), totalMillis);
            if (metrics != null) {
                metrics.recordExecution(success, totalMillis);
            }
            return new ExecutionResult(success, results, totalMillis);
        } catch (CodeExecutionException e) {
            if (e.getKind() == ErrorKind.RUNTIME && metrics != null) {
                metrics.recordInternalError();
            }
            log.warn("Execution {} aborted ({}): {}", executionId, e.getKind(), e.getMessage());
            throw e;
        } finally {
            MdcContext.clear();
        }
    }
}
