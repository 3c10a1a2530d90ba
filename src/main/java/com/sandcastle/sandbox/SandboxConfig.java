package com.sandcastle.sandbox;

import com.sandcastle.channel.ChannelCodec;
import com.sandcastle.core.metrics.SandcastleMetrics;
import com.sandcastle.core.model.ExecutorConfig;
import com.sandcastle.core.security.BuiltinAllowlist;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

@Configuration
public class SandboxConfig {

    private static final Logger log = LoggerFactory.getLogger(SandboxConfig.class);

    @Bean
    public ChannelCodec channelCodec() {
        return new ChannelCodec();
    }

    @Bean
    public ExecutorConfig executorConfig(SandboxProperties properties) {
        return properties.toExecutorConfig();
    }

    @Bean
    public TerminationEscalator terminationEscalator(SandboxProperties properties) {
        return new TerminationEscalator(Duration.ofMillis(properties.getTerminationGraceMillis()));
    }

    @Bean
    public WorkerLauncher workerLauncher(ChannelCodec codec, SandboxProperties properties) throws IOException {
        Path script = WorkerScript.materialize();
        log.info("Workers run '{}' with {}", properties.getPythonExecutable(), script);
        return new PythonWorkerLauncher(codec, properties.getPythonExecutable(), script,
                properties.getMemoryLimitMb());
    }

    /**
     * Supervises one worker per test case. The startup deadline covers interpreter boot
     * and sandbox setup; the per-test timeout only starts once the worker reports ready.
     */
    @Bean
    public WorkerSupervisor workerSupervisor(WorkerLauncher launcher, TerminationEscalator escalator,
                                             BuiltinAllowlist allowlist, SandboxProperties properties,
                                             @Autowired(required = false) SandcastleMetrics metrics) {
        return new WorkerSupervisor(launcher, escalator, allowlist,
                Duration.ofSeconds(properties.getStartupTimeoutSeconds()), metrics);
    }
}
