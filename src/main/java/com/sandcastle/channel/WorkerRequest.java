package com.sandcastle.channel;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Everything a worker needs, written to its stdin as one JSON document.
 *
 * @param mode            {@link Mode#RUN} to execute and call, {@link Mode#CHECK} to compile only
 * @param code            submitted source text
 * @param functionName    callable to resolve after executing the source
 * @param input           keyword arguments, already deep-copied by the supervisor
 * @param allowedBuiltins builtin names the sandbox exposes
 */
public record WorkerRequest(
    Mode mode,
    String code,
    @JsonProperty("function_name") String functionName,
    Map<String, Object> input,
    @JsonProperty("allowed_builtins") List<String> allowedBuiltins
) {

    public enum Mode {
        RUN,
        CHECK
    }

    public static WorkerRequest run(String code, String functionName, Map<String, Object> input,
                                    List<String> allowedBuiltins) {
        return new WorkerRequest(Mode.RUN, code, functionName, input, allowedBuiltins);
    }

    /** Compile-only request; the worker never executes the source. */
    public static WorkerRequest check(String code) {
        return new WorkerRequest(Mode.CHECK, code, null, Map.of(), List.of());
    }
}
