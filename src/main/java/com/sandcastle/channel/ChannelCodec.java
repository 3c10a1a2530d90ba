package com.sandcastle.channel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Optional;

/**
 * Wire format shared by the supervisor and the Python worker script
 * ({@code worker/sandcastle_worker.py}).
 *
 * <p>The request travels as one JSON document on the worker's stdin. The worker answers
 * on stdout with line frames:
 * <pre>
 * &#64;&#64;sandcastle:ready
 * &#64;&#64;sandcastle:outcome {"type":"success","return_value":[1,2.5],"elapsed_millis":3}
 * </pre>
 * Lines without the prefix are ignored by the reader. Integral and floating numbers keep
 * their JSON form, and NaN/Infinity are bare tokens on both sides, as Python's
 * {@code json} module writes them.
 */
public final class ChannelCodec {

    public static final String FRAME_PREFIX = "@@sandcastle:";
    static final String READY_FRAME = FRAME_PREFIX + "ready";
    static final String OUTCOME_FRAME = FRAME_PREFIX + "outcome ";

    private final ObjectMapper mapper;

    public ChannelCodec() {
        this.mapper = JsonMapper.builder()
                .disable(JsonWriteFeature.WRITE_NAN_AS_STRINGS)
                .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
                .disable(SerializationFeature.INDENT_OUTPUT)
                .build();
    }

    public void writeRequest(OutputStream out, WorkerRequest request) throws IOException {
        mapper.writeValue(out, request);
    }

    public String readyFrame() {
        return READY_FRAME;
    }

    public String outcomeFrame(WorkerOutcome outcome) throws JsonProcessingException {
        return OUTCOME_FRAME + mapper.writerFor(WorkerOutcome.class).writeValueAsString(outcome);
    }

    /**
     * Parses one stdout line. Returns empty for lines that are not frames.
     *
     * @throws JsonProcessingException if an outcome frame carries malformed JSON
     */
    public Optional<ChannelEvent> parseFrame(String line) throws JsonProcessingException {
        if (line == null || !line.startsWith(FRAME_PREFIX)) {
            return Optional.empty();
        }
        if (line.equals(READY_FRAME)) {
            return Optional.of(ChannelEvent.READY);
        }
        if (line.startsWith(OUTCOME_FRAME)) {
            String json = line.substring(OUTCOME_FRAME.length());
            return Optional.of(ChannelEvent.outcome(mapper.readValue(json, WorkerOutcome.class)));
        }
        return Optional.empty();
    }
}
