package com.sandcastle.sandbox;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkerCommandTest {

    @Test
    @DisplayName("runs the script in an isolated interpreter with the memory limit")
    void isolatedInterpreter() {
        var command = WorkerCommand.build("/usr/bin/python3", Path.of("/tmp/sandcastle-worker.py"), 128);

        assertEquals(List.of("/usr/bin/python3", "-I", "-S", "-B", "/tmp/sandcastle-worker.py",
                "--memory-limit-mb", "128"), command);
    }

    @Test
    @DisplayName("bare interpreter names are passed through for PATH lookup")
    void bareName() {
        var command = WorkerCommand.build("python3", Path.of("worker.py"), 256);

        assertEquals("python3", command.get(0));
        assertEquals("256", command.get(command.size() - 1));
    }
}
