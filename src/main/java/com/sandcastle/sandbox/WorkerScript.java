package com.sandcastle.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * The Python worker script, shipped on the classpath and copied to a file the
 * interpreter can run. Copied once at startup; the file is removed when the JVM exits.
 */
public final class WorkerScript {

    private static final Logger log = LoggerFactory.getLogger(WorkerScript.class);

    static final String RESOURCE = "worker/sandcastle_worker.py";

    private WorkerScript() {}

    public static Path materialize() throws IOException {
        Path target = Files.createTempFile("sandcastle-worker-", ".py");
        target.toFile().deleteOnExit();
        return materialize(target);
    }

    static Path materialize(Path target) throws IOException {
        try (InputStream in = WorkerScript.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IOException("Worker script " + RESOURCE + " is missing from the classpath");
            }
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
        log.debug("Worker script written to {}", target);
        return target;
    }
}
