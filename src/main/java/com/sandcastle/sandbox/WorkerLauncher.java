package com.sandcastle.sandbox;

import com.sandcastle.channel.WorkerRequest;

import java.io.IOException;

/**
 * Starts one isolated worker for one test case.
 * Implementations: {@link PythonWorkerLauncher}.
 */
public interface WorkerLauncher {

    /**
     * Spawns a worker and hands it {@code request}.
     *
     * @throws IOException if the process cannot be started
     */
    WorkerHandle launch(WorkerRequest request) throws IOException;
}
