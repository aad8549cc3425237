package com.fluxwatch.core.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fluxwatch.core.exception.AnomalyEngineException;
import com.fluxwatch.core.model.CalibrationState;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * JSON encoding of {@link CalibrationState} checkpoints.
 *
 * <p>
 * Decoding goes through the state's validating builder, so a checkpoint
 * that violates the state invariants is rejected instead of resumed.
 * </p>
 *
 * @since 1.0.0
 */
public class CheckpointCodec {

    private final ObjectMapper mapper;

    public CheckpointCodec() {
        this(new ObjectMapper());
    }

    public CheckpointCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "ObjectMapper must not be null");
    }

    public String toJson(CalibrationState state) {
        Objects.requireNonNull(state, "CalibrationState must not be null");
        try {
            return mapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new AnomalyEngineException("Failed to encode calibration state", e);
        }
    }

    public byte[] toBytes(CalibrationState state) {
        return toJson(state).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @throws AnomalyEngineException if the JSON is malformed or describes an
     *                                invalid state
     */
    public CalibrationState fromJson(String json) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            return mapper.readValue(json, CalibrationState.class);
        } catch (JsonProcessingException e) {
            throw new AnomalyEngineException("Failed to decode calibration state: " + e.getOriginalMessage(), e);
        }
    }

    public CalibrationState fromBytes(byte[] json) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            return mapper.readValue(json, CalibrationState.class);
        } catch (IOException e) {
            throw new AnomalyEngineException("Failed to decode calibration state", e);
        }
    }
}
