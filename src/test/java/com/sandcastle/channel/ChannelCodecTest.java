package com.sandcastle.channel;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ChannelCodecTest {

    private final ChannelCodec codec = new ChannelCodec();

    @Test
    @DisplayName("run request uses the field names the worker script reads")
    void runRequest() throws Exception {
        var request = WorkerRequest.run("def f(x):\n    return x\n", "f",
                Map.of("x", List.of(1, 2.5, "a")), List.of("len", "abs"));
        var out = new ByteArrayOutputStream();
        codec.writeRequest(out, request);

        String json = out.toString(StandardCharsets.UTF_8);
        assertTrue(json.contains("\"mode\":\"RUN\""), json);
        assertTrue(json.contains("\"function_name\":\"f\""), json);
        assertTrue(json.contains("\"input\":{\"x\":[1,2.5,\"a\"]}"), json);
        assertTrue(json.contains("\"allowed_builtins\":[\"len\",\"abs\"]"), json);
    }

    @Test
    @DisplayName("check request carries only the source")
    void checkRequest() throws Exception {
        var out = new ByteArrayOutputStream();
        codec.writeRequest(out, WorkerRequest.check("x = 1"));

        String json = out.toString(StandardCharsets.UTF_8);
        assertTrue(json.contains("\"mode\":\"CHECK\""), json);
        assertTrue(json.contains("\"code\":\"x = 1\""), json);
    }

    @Test
    @DisplayName("outcome written by the worker script parses")
    void scriptOutcome() throws Exception {
        String frame = "@@sandcastle:outcome {\"type\": \"success\", \"return_value\": [0, 1, NaN], \"elapsed_millis\": 2}";

        var outcome = (WorkerOutcome.Success) codec.parseFrame(frame).orElseThrow().outcome();

        assertEquals(2, outcome.elapsedMillis());
        var values = (List<?>) outcome.returnValue();
        assertEquals(List.of(0, 1), values.subList(0, 2));
        assertTrue(Double.isNaN((Double) values.get(2)));
    }

    @Test
    @DisplayName("outcome frame is a single line that parses back to the same outcome")
    void outcomeFrame() throws Exception {
        var outcome = new WorkerOutcome.Success(List.of(1, List.of(2.5, "x"), Map.of("ok", false)), 4);
        String frame = codec.outcomeFrame(outcome);

        assertTrue(frame.startsWith("@@sandcastle:outcome {"));
        assertFalse(frame.contains("\n"));
        var event = codec.parseFrame(frame).orElseThrow();
        assertEquals(ChannelEvent.Kind.OUTCOME, event.kind());
        assertEquals(outcome, event.outcome());
    }

    @Test
    @DisplayName("failure outcome uses snake_case fields")
    void failureFrame() throws Exception {
        var failure = new WorkerOutcome.Failure(FailureClass.NAME_NOT_FOUND, "Function 'g' not found in code");
        String frame = codec.outcomeFrame(failure);

        assertTrue(frame.contains("\"type\":\"failure\""));
        assertTrue(frame.contains("\"error_class\":\"NAME_NOT_FOUND\""));
        assertEquals(failure, codec.parseFrame(frame).orElseThrow().outcome());
    }

    @Test
    @DisplayName("NaN return values survive the trip")
    void nanSurvives() throws Exception {
        String frame = codec.outcomeFrame(new WorkerOutcome.Success(Double.NaN, 0));
        var outcome = (WorkerOutcome.Success) codec.parseFrame(frame).orElseThrow().outcome();
        assertTrue(Double.isNaN((Double) outcome.returnValue()));
    }

    @Test
    @DisplayName("ready frame and non-frame lines")
    void otherLines() throws Exception {
        assertEquals(ChannelEvent.READY, codec.parseFrame(codec.readyFrame()).orElseThrow());
        assertTrue(codec.parseFrame("some stray output").isEmpty());
        assertTrue(codec.parseFrame("@@sandcastle:unknown").isEmpty());
        assertTrue(codec.parseFrame(null).isEmpty());
    }

    @Test
    @DisplayName("malformed outcome JSON is rejected")
    void malformed() {
        assertThrows(JsonProcessingException.class, () -> codec.parseFrame("@@sandcastle:outcome {not json"));
    }
}
