package com.sandcastle.sandbox;

import com.sandcastle.channel.ChannelCodec;
import com.sandcastle.channel.ResultChannel;
import com.sandcastle.channel.WorkerRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.List;

/**
 * Launches each worker as a separate Python interpreter running the worker script.
 *
 * <p>The request is written to the interpreter's stdin, which is then closed; stdout
 * becomes the result channel and stderr is drained into an {@link OutputTail}.
 */
public class PythonWorkerLauncher implements WorkerLauncher {

    private static final Logger log = LoggerFactory.getLogger(PythonWorkerLauncher.class);

    private final ChannelCodec codec;
    private final List<String> command;

    public PythonWorkerLauncher(ChannelCodec codec, String pythonExecutable, Path script, int memoryLimitMb) {
        this.codec = codec;
        this.command = List.copyOf(WorkerCommand.build(pythonExecutable, script, memoryLimitMb));
    }

    @Override
    public WorkerHandle launch(WorkerRequest request) throws IOException {
        Process process = new ProcessBuilder(command).start();
        String name = String.valueOf(process.pid());
        log.debug("Started {} worker {} for function '{}'", request.mode(), name, request.functionName());

        var channel = ResultChannel.open(process.getInputStream(), codec, name);
        var stderr = OutputTail.drain(process.getErrorStream(), name);
        try (OutputStream stdin = process.getOutputStream()) {
            codec.writeRequest(stdin, request);
        } catch (IOException e) {
            // worker died before reading; the channel will report CLOSED
            log.warn("Could not deliver request to worker {}: {}", name, e.getMessage());
        }
        return new WorkerHandle(new SystemProcessController(process), channel, stderr);
    }
}
