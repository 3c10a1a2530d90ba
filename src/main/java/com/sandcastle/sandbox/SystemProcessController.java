package com.sandcastle.sandbox;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * {@link ProcessController} backed by an operating system {@link Process}.
 */
public class SystemProcessController implements ProcessController {

    private final Process process;

    public SystemProcessController(Process process) {
        this.process = process;
    }

    @Override
    public long pid() {
        return process.pid();
    }

    @Override
    public boolean isAlive() {
        return process.isAlive();
    }

    @Override
    public void terminate() {
        process.destroy();
    }

    @Override
    public void kill() {
        process.destroyForcibly();
    }

    @Override
    public boolean awaitExit(Duration timeout) throws InterruptedException {
        return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public int exitCode() {
        return process.isAlive() ? -1 : process.exitValue();
    }
}
