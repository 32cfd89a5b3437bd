package com.nayem.roomsync.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON encoding of everything the engine writes to Redis.
 */
public class StateCodec {

    private final ObjectMapper objectMapper;

    public StateCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public StateCodec() {
        this(new ObjectMapper());
    }

    public String writeState(RoomState state) {
        return write(state.roomId(), state, "RoomState");
    }

    public RoomState readState(String roomId, String json) {
        return read(roomId, json, RoomState.class);
    }

    public String writeChange(StateChange change) {
        return write(change.roomId(), change, "StateChange");
    }

    public StateChange readChange(String roomId, String json) {
        return read(roomId, json, StateChange.class);
    }

    public String writeEvent(String roomId, RoomEvent event) {
        return write(roomId, event, "RoomEvent");
    }

    public RoomEvent readEvent(String roomId, String json) {
        return read(roomId, json, RoomEvent.class);
    }

    /**
     * Converts an arbitrary value (map, POJO, {@link JsonNode}) to a JSON tree.
     */
    public JsonNode toTree(String roomId, Object value) {
        try {
            return objectMapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            throw new StateSerializationException(roomId, "Value is not representable as JSON", e);
        }
    }

    private String write(String roomId, Object value, String what) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StateSerializationException(roomId, "Failed to serialize " + what, e);
        }
    }

    private <T> T read(String roomId, String json, Class<T> type) {
        try {
            T value = objectMapper.readValue(json, type);
            if (value == null) {
                throw new StateSerializationException(roomId,
                        "Stored " + type.getSimpleName() + " for room " + roomId + " is JSON null", null);
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new StateSerializationException(roomId,
                    "Failed to deserialize " + type.getSimpleName() + " for room " + roomId, e);
        }
    }
}
