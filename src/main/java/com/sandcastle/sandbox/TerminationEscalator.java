package com.sandcastle.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Stops a worker: graceful termination first, a bounded wait, then a forced kill
 * followed by an unbounded wait for exit.
 */
public class TerminationEscalator {

    private static final Logger log = LoggerFactory.getLogger(TerminationEscalator.class);

    public static final Duration DEFAULT_GRACE_PERIOD = Duration.ofSeconds(1);

    private final Duration gracePeriod;

    public TerminationEscalator(Duration gracePeriod) {
        this.gracePeriod = gracePeriod;
    }

    public Duration getGracePeriod() {
        return gracePeriod;
    }

    /**
     * Drives {@code process} to {@link TerminationState#EXITED}.
     *
     * <p>An interrupt during the graceful wait skips straight to the kill; the interrupt
     * flag is restored before returning.
     *
     * @return the states visited, ending with {@code EXITED}
     */
    public List<TerminationState> stop(ProcessController process) {
        var visited = new ArrayList<TerminationState>();
        boolean interrupted = false;
        TerminationState state = process.isAlive() ? TerminationState.RUNNING : TerminationState.EXITED;
        visited.add(state);

        while (state != TerminationState.EXITED) {
            switch (state) {
                case RUNNING -> {
                    log.debug("Requesting graceful termination of worker {}", process.pid());
                    process.terminate();
                    state = TerminationState.TERMINATE_REQUESTED;
                }
                case TERMINATE_REQUESTED -> {
                    boolean exited;
                    try {
                        exited = process.awaitExit(gracePeriod);
                    } catch (InterruptedException e) {
                        interrupted = true;
                        exited = false;
                    }
                    if (exited) {
                        state = TerminationState.EXITED;
                    } else {
                        log.warn("Worker {} ignored termination for {} ms, killing", process.pid(),
                                gracePeriod.toMillis());
                        process.kill();
                        state = TerminationState.KILL_REQUESTED;
                    }
                }
                case KILL_REQUESTED -> {
                    interrupted |= awaitExitUninterruptibly(process);
                    state = TerminationState.EXITED;
                }
                default -> throw new IllegalStateException("Unexpected state " + state);
            }
            visited.add(state);
        }

        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return visited;
    }

    public static boolean wasForced(List<TerminationState> visited) {
        return visited.contains(TerminationState.KILL_REQUESTED);
    }

    private static boolean awaitExitUninterruptibly(ProcessController process) {
        boolean interrupted = false;
        while (true) {
            try {
                if (process.awaitExit(Duration.ofSeconds(1))) {
                    return interrupted;
                }
                if (!process.isAlive()) {
                    return interrupted;
                }
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
    }
}
