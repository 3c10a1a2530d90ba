package com.sandcastle.channel;

/**
 * What the supervisor observed on the channel within one receive deadline.
 */
public record ChannelEvent(Kind kind, WorkerOutcome outcome) {

    public enum Kind {
        /** Interpreter booted; user code is about to run. */
        READY,
        /** The worker reported its outcome. */
        OUTCOME,
        /** The pipe closed; the worker will not write anything else. */
        CLOSED,
        /** The deadline passed with nothing received. */
        TIMEOUT
    }

    public static final ChannelEvent READY = new ChannelEvent(Kind.READY, null);
    public static final ChannelEvent CLOSED = new ChannelEvent(Kind.CLOSED, null);
    public static final ChannelEvent TIMEOUT = new ChannelEvent(Kind.TIMEOUT, null);

    public static ChannelEvent outcome(WorkerOutcome outcome) {
        return new ChannelEvent(Kind.OUTCOME, outcome);
    }
}
