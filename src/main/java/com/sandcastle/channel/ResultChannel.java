package com.sandcastle.channel;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Supervisor end of the one-shot worker channel.
 *
 * <p>A daemon reader thread turns frames from the worker's stdout into
 * {@link ChannelEvent}s. End of stream is delivered as {@link ChannelEvent#CLOSED}, so a
 * worker killed before writing is detected instead of blocking the supervisor.
 */
public class ResultChannel implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResultChannel.class);

    private final BlockingQueue<ChannelEvent> events = new LinkedBlockingQueue<>();
    private final InputStream source;
    private volatile boolean closed;

    private ResultChannel(InputStream source) {
        this.source = source;
    }

    /**
     * Starts reading {@code source} on a daemon thread named after {@code name}.
     */
    public static ResultChannel open(InputStream source, ChannelCodec codec, String name) {
        var channel = new ResultChannel(source);
        Thread reader = new Thread(() -> channel.pump(codec), "result-channel-" + name);
        reader.setDaemon(true);
        reader.start();
        return channel;
    }

    private void pump(ChannelCodec codec) {
        try (var reader = new BufferedReader(new InputStreamReader(source, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                try {
                    codec.parseFrame(line).ifPresent(events::add);
                } catch (JsonProcessingException e) {
                    log.warn("Discarding malformed outcome frame: {}", e.getOriginalMessage());
                }
            }
        } catch (IOException e) {
            log.debug("Result channel stream ended with error: {}", e.getMessage());
        } finally {
            events.add(ChannelEvent.CLOSED);
        }
    }

    /**
     * Waits up to {@code timeout} for the next event.
     *
     * @return the event, {@link ChannelEvent#CLOSED} once the stream has ended, or
     *         {@link ChannelEvent#TIMEOUT} if nothing arrived in time
     */
    public ChannelEvent receive(Duration timeout) throws InterruptedException {
        if (closed && events.isEmpty()) {
            return ChannelEvent.CLOSED;
        }
        ChannelEvent event = events.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (event == null) {
            return ChannelEvent.TIMEOUT;
        }
        if (event.kind() == ChannelEvent.Kind.CLOSED) {
            closed = true;
        }
        return event;
    }

    @Override
    public void close() {
        try {
            source.close();
        } catch (IOException e) {
            log.debug("Failed to close result channel: {}", e.getMessage());
        }
    }
}
