package com.sandcastle.sandbox;

import com.sandcastle.core.model.ExecutorConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "sandcastle")
public class SandboxProperties {

    private Sandbox sandbox = new Sandbox();
    private Worker worker = new Worker();

    // -- Sandbox accessors (delegate to nested) --
    public int getTimeoutSeconds() { return sandbox.timeoutSeconds; }
    public int getMemoryLimitMb() { return sandbox.memoryLimitMb; }
    public int getStartupTimeoutSeconds() { return sandbox.startupTimeoutSeconds; }
    public long getTerminationGraceMillis() { return sandbox.terminationGraceMillis; }

    // -- Worker accessors (delegate to nested) --
    public String getPythonExecutable() { return worker.pythonExecutable; }

    public ExecutorConfig toExecutorConfig() {
        return new ExecutorConfig(sandbox.timeoutSeconds, sandbox.memoryLimitMb);
    }

    public Sandbox getSandbox() { return sandbox; }
    public void setSandbox(Sandbox sandbox) { this.sandbox = sandbox; }
    public Worker getWorker() { return worker; }
    public void setWorker(Worker worker) { this.worker = worker; }

    public static class Sandbox {
        private int timeoutSeconds = ExecutorConfig.DEFAULT_TIMEOUT_SECONDS;
        private int memoryLimitMb = ExecutorConfig.DEFAULT_MEMORY_LIMIT_MB;
        private int startupTimeoutSeconds = 10;
        private long terminationGraceMillis = 1000;

        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public int getMemoryLimitMb() { return memoryLimitMb; }
        public void setMemoryLimitMb(int memoryLimitMb) { this.memoryLimitMb = memoryLimitMb; }
        public int getStartupTimeoutSeconds() { return startupTimeoutSeconds; }
        public void setStartupTimeoutSeconds(int startupTimeoutSeconds) { this.startupTimeoutSeconds = startupTimeoutSeconds; }
        public long getTerminationGraceMillis() { return terminationGraceMillis; }
        public void setTerminationGraceMillis(long terminationGraceMillis) { this.terminationGraceMillis = terminationGraceMillis; }
    }

    public static class Worker {
        /** Interpreter command; a bare name is looked up on PATH. */
        private String pythonExecutable = "python3";

        public String getPythonExecutable() { return pythonExecutable; }
        public void setPythonExecutable(String pythonExecutable) { this.pythonExecutable = pythonExecutable; }
    }
}
