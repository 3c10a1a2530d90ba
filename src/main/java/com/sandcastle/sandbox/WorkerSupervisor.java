package com.sandcastle.sandbox;

import com.sandcastle.channel.ChannelEvent;
import com.sandcastle.channel.FailureClass;
import com.sandcastle.channel.WorkerOutcome;
import com.sandcastle.channel.WorkerRequest;
import com.sandcastle.core.compare.StructuralComparator;
import com.sandcastle.core.format.PythonLiterals;
import com.sandcastle.core.metrics.SandcastleMetrics;
import com.sandcastle.core.model.CodeExecutionException;
import com.sandcastle.core.model.TestCase;
import com.sandcastle.core.model.TestResult;
import com.sandcastle.core.model.TestStatus;
import com.sandcastle.core.model.Values;
import com.sandcastle.core.security.BuiltinAllowlist;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Runs one test case in one worker and turns whatever happens into a {@link TestResult}.
 *
 * <p>Flow: clone input -> launch worker -> wait for READY (startup deadline) -> wait for
 * the outcome (test deadline) -> classify. On timeout the worker is stopped through the
 * {@link TerminationEscalator}. A worker that closes its channel without an outcome is an
 * internal error and raises {@link CodeExecutionException}.
 */
public class WorkerSupervisor {

    private static final Logger log = LoggerFactory.getLogger(WorkerSupervisor.class);

    private final WorkerLauncher launcher;
    private final TerminationEscalator escalator;
    private final BuiltinAllowlist allowlist;
    private final Duration startupTimeout;
    private final SandcastleMetrics metrics;

    public WorkerSupervisor(WorkerLauncher launcher, TerminationEscalator escalator,
                            BuiltinAllowlist allowlist, Duration startupTimeout,
                            SandcastleMetrics metrics) {
        this.launcher = launcher;
        this.escalator = escalator;
        this.allowlist = allowlist;
        this.startupTimeout = startupTimeout;
        this.metrics = metrics;
    }

    public TestResult runOne(String code, TestCase testCase, String functionName, Duration timeout) {
        @SuppressWarnings("unchecked")
        Map<String, Object> input = (Map<String, Object>) Values.deepCopy(testCase.input());
        var request = WorkerRequest.run(code, functionName, input, allowlist.names());

        WorkerHandle worker = launch(request);
        try (worker) {
            ChannelEvent event = worker.channel().receive(startupTimeout);
            if (event.kind() == ChannelEvent.Kind.TIMEOUT) {
                stop(worker);
                throw CodeExecutionException.internal(
                        "Worker did not start within " + startupTimeout.toSeconds() + "s");
            }
            if (event.kind() == ChannelEvent.Kind.READY) {
                event = worker.channel().receive(timeout);
            }

            return switch (event.kind()) {
                case OUTCOME -> classify(testCase, event.outcome());
                case TIMEOUT -> {
                    log.info("Worker {} exceeded {}s, stopping it", worker.process().pid(), timeout.toSeconds());
                    stop(worker);
                    yield TestResult.timedOut(testCase, timeout.toSeconds());
                }
                case CLOSED, READY -> throw vanished(worker);
            };
        } catch (InterruptedException e) {
            stop(worker);
            Thread.currentThread().interrupt();
            throw CodeExecutionException.internal("Execution interrupted", e);
        } finally {
            reap(worker);
        }
    }

    /**
     * Compiles {@code code} in a worker without executing it, so validation uses the same
     * interpreter and grammar as execution.
     *
     * @return {@link WorkerOutcome.Success} when the source compiles, otherwise a
     *         {@link FailureClass#SYNTAX} failure carrying {@code "Line <n>: <message>"}
     */
    public WorkerOutcome compile(String code) {
        WorkerHandle worker = launch(WorkerRequest.check(code));
        try (worker) {
            ChannelEvent event = worker.channel().receive(startupTimeout);
            return switch (event.kind()) {
                case OUTCOME -> event.outcome();
                case TIMEOUT -> {
                    stop(worker);
                    throw CodeExecutionException.internal(
                            "Syntax check did not finish within " + startupTimeout.toSeconds() + "s");
                }
                case CLOSED, READY -> throw vanished(worker);
            };
        } catch (InterruptedException e) {
            stop(worker);
            Thread.currentThread().interrupt();
            throw CodeExecutionException.internal("Syntax check interrupted", e);
        } finally {
            reap(worker);
        }
    }

    private WorkerHandle launch(WorkerRequest request) {
        try {
            return launcher.launch(request);
        } catch (IOException e) {
            throw CodeExecutionException.internal("Failed to start worker: " + e.getMessage(), e);
        }
    }

    private TestResult classify(TestCase testCase, WorkerOutcome outcome) {
        if (outcome instanceof WorkerOutcome.Failure failure) {
            TestStatus status = switch (failure.errorClass()) {
                case NAME_NOT_FOUND -> TestStatus.NAME_NOT_FOUND;
                case SYNTAX, RUNTIME -> TestStatus.RUNTIME_ERROR;
            };
            return TestResult.failed(testCase, status, failure.errorMessage());
        }
        var success = (WorkerOutcome.Success) outcome;
        Object actual = success.returnValue();
        if (StructuralComparator.equivalent(actual, testCase.expected())) {
            return TestResult.passed(testCase, actual, success.elapsedMillis());
        }
        String message = "Expected " + PythonLiterals.str(testCase.expected())
                + ", got " + PythonLiterals.str(actual);
        return TestResult.wrongAnswer(testCase, actual, success.elapsedMillis(), message);
    }

    private CodeExecutionException vanished(WorkerHandle worker) {
        int exitCode = awaitExitCode(worker.process());
        String stderr = worker.stderr().text();
        if (!stderr.isBlank()) {
            log.warn("Worker {} exited ({}) without reporting; stderr tail:\n{}",
                    worker.process().pid(), exitCode, stderr);
        }
        return CodeExecutionException.internal("Process terminated unexpectedly (exit code " + exitCode + ")");
    }

    private void stop(WorkerHandle worker) {
        List<TerminationState> visited = escalator.stop(worker.process());
        if (TerminationEscalator.wasForced(visited) && metrics != null) {
            metrics.recordForcedKill();
        }
    }

    /** Gives a finished worker the grace period to exit, then escalates. */
    private void reap(WorkerHandle worker) {
        ProcessController process = worker.process();
        if (!process.isAlive()) {
            return;
        }
        try {
            if (process.awaitExit(escalator.getGracePeriod())) {
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        stop(worker);
    }

    private int awaitExitCode(ProcessController process) {
        try {
            process.awaitExit(escalator.getGracePeriod());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return process.exitCode();
    }
}
