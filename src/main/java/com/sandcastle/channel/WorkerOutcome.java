package com.sandcastle.channel;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * The single message a worker sends back to its supervisor.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = WorkerOutcome.Success.class, name = "success"),
    @JsonSubTypes.Type(value = WorkerOutcome.Failure.class, name = "failure")
})
public interface WorkerOutcome {

    /**
     * The candidate returned normally.
     *
     * @param returnValue   JSON-shaped return value
     * @param elapsedMillis time spent inside the call
     */
    record Success(
        @JsonProperty("return_value") Object returnValue,
        @JsonProperty("elapsed_millis") long elapsedMillis
    ) implements WorkerOutcome {}

    /**
     * The candidate could not be run or raised.
     */
    record Failure(
        @JsonProperty("error_class") FailureClass errorClass,
        @JsonProperty("error_message") String errorMessage
    ) implements WorkerOutcome {}
}
