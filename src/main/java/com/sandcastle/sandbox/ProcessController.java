package com.sandcastle.sandbox;

import java.time.Duration;

/**
 * The operations the supervisor needs on a worker process. Kept narrow so termination
 * logic can be exercised against a fake.
 */
public interface ProcessController {

    long pid();

    boolean isAlive();

    /** Requests graceful termination (SIGTERM on Unix). */
    void terminate();

    /** Forcibly kills the process (SIGKILL on Unix). */
    void kill();

    /**
     * Waits up to {@code timeout} for the process to exit.
     * @return true if it exited
     */
    boolean awaitExit(Duration timeout) throws InterruptedException;

    /**
     * Exit code, or -1 while the process is still running.
     */
    int exitCode();
}
