package com.sandcastle.core.metrics;

import com.sandcastle.core.model.TestStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for code execution.
 */
@Service
public class SandcastleMetrics {

    private final MeterRegistry registry;

    public SandcastleMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordExecution(boolean success, long ms) {
        Timer.builder("sandcastle.execution.duration")
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordTestResult(TestStatus status, long ms) {
        Counter.builder("sandcastle.tests.total")
                .tag("status", status.metricTag())
                .register(registry)
                .increment();
        Timer.builder("sandcastle.test.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordSyntaxRejection() {
        Counter.builder("sandcastle.syntax.rejections")
                .description("Submissions rejected before any worker was started")
                .register(registry)
                .increment();
    }

    public void recordInternalError() {
        Counter.builder("sandcastle.internal.errors")
                .description("Workers that exited without reporting an outcome")
                .register(registry)
                .increment();
    }

    /**
     * Records a worker that ignored graceful termination and had to be killed.
     */
    public void recordForcedKill() {
        Counter.builder("sandcastle.workers.forced_kills")
                .register(registry)
                .increment();
    }
}
