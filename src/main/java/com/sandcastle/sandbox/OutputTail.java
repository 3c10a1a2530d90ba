package com.sandcastle.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Drains a worker's stderr so the pipe never fills, keeping the last few lines for
 * diagnostics when a worker dies without reporting.
 */
public class OutputTail {

    private static final Logger log = LoggerFactory.getLogger(OutputTail.class);

    static final int MAX_LINES = 40;

    private final Deque<String> lines = new ArrayDeque<>();

    public static OutputTail drain(InputStream stream, String name) {
        var tail = new OutputTail();
        Thread drainer = new Thread(() -> tail.pump(stream), "worker-stderr-" + name);
        drainer.setDaemon(true);
        drainer.start();
        return tail;
    }

    public static OutputTail empty() {
        return new OutputTail();
    }

    private void pump(InputStream stream) {
        try (var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                append(line);
            }
        } catch (IOException e) {
            log.debug("Worker stderr closed: {}", e.getMessage());
        }
    }

    synchronized void append(String line) {
        if (lines.size() == MAX_LINES) {
            lines.removeFirst();
        }
        lines.addLast(line);
    }

    public synchronized String text() {
        return String.join("\n", lines);
    }
}
