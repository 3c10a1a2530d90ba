package com.sandcastle.sandbox;

import com.sandcastle.core.security.BuiltinAllowlist;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Actuator health indicator for worker launching.
 * Reports DOWN when the configured Python interpreter cannot be found.
 */
@Component
public class WorkerHealthIndicator implements HealthIndicator {

    private final SandboxProperties properties;
    private final BuiltinAllowlist allowlist;

    public WorkerHealthIndicator(SandboxProperties properties, BuiltinAllowlist allowlist) {
        this.properties = properties;
        this.allowlist = allowlist;
    }

    @Override
    public Health health() {
        String python = properties.getPythonExecutable();
        Optional<Path> resolved = PythonExecutable.resolve(python);
        var builder = resolved.isPresent() ? Health.up() : Health.down();
        return builder
                .withDetail("pythonExecutable", python)
                .withDetail("resolvedPath", resolved.map(Path::toString).orElse("not found"))
                .withDetail("timeoutSeconds", properties.getTimeoutSeconds())
                .withDetail("memoryLimitMb", properties.getMemoryLimitMb())
                .withDetail("allowedBuiltins", allowlist.names().size())
                .build();
    }
}
