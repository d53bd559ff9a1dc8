package com.tradecontrol.position;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.tradecontrol.exception.StateCodecException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON form of {@link PositionControlSnapshot} for the storage collaborator.
 *
 * <p>Uses a shared ObjectMapper with ISO-8601 instants.
 */
public final class ControlStateCodec {

    private static final Logger log = LoggerFactory.getLogger(ControlStateCodec.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    static {
        OBJECT_MAPPER.findAndRegisterModules();
        OBJECT_MAPPER.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    private ControlStateCodec() {}

    public static String toJson(PositionControlSnapshot snapshot) {
        try {
            return OBJECT_MAPPER.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize snapshot of session {}", snapshot.getSessionId(), e);
            throw new StateCodecException("Snapshot serialization failed", e);
        }
    }

    public static PositionControlSnapshot fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new StateCodecException("Snapshot JSON is empty", null);
        }
        try {
            return OBJECT_MAPPER.readValue(json, PositionControlSnapshot.class);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize snapshot: {}", json, e);
            throw new StateCodecException("Snapshot deserialization failed", e);
        }
    }
}
