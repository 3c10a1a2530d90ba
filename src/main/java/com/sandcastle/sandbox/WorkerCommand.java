package com.sandcastle.sandbox;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the command line for a worker interpreter.
 *
 * <p>The interpreter runs isolated ({@code -I}: no environment variables, no user site,
 * no script directory on the import path), without the {@code site} module ({@code -S})
 * and without writing bytecode ({@code -B}). The memory limit is applied by the script
 * itself before any submitted code runs.
 */
public final class WorkerCommand {

    static final List<String> INTERPRETER_FLAGS = List.of("-I", "-S", "-B");

    private WorkerCommand() {}

    public static List<String> build(String pythonExecutable, Path script, int memoryLimitMb) {
        var command = new ArrayList<String>();
        command.add(pythonExecutable);
        command.addAll(INTERPRETER_FLAGS);
        command.add(script.toString());
        command.add("--memory-limit-mb");
        command.add(String.valueOf(memoryLimitMb));
        return command;
    }
}
