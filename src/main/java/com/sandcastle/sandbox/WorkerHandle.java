package com.sandcastle.sandbox;

import com.sandcastle.channel.ResultChannel;

/**
 * A launched worker: its process, the channel it reports on, and its stderr tail.
 */
public record WorkerHandle(
    ProcessController process,
    ResultChannel channel,
    OutputTail stderr
) implements AutoCloseable {

    @Override
    public void close() {
        channel.close();
    }
}
