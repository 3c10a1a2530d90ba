package com.sandcastle.sandbox;

/**
 * States of worker shutdown escalation.
 * {@code RUNNING -> TERMINATE_REQUESTED -> (EXITED | KILL_REQUESTED) -> EXITED}
 */
public enum TerminationState {
    RUNNING,
    TERMINATE_REQUESTED,
    KILL_REQUESTED,
    EXITED
}
