package com.nayem.roomsync.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.Objects;

/**
 * One committed revision of a room's shared document.
 * <p>
 * {@code data} is always a JSON object. Instances handed out by
 * {@link RoomStateEngine} are private copies, so callers may modify
 * {@code data} without affecting the engine's cache.
 * </p>
 *
 * @param roomId        the room this document belongs to
 * @param version       revision number, starting at 1
 * @param data          the document
 * @param lastUpdatedAt commit time of this revision
 * @param lastUpdatedBy actor of the mutation that produced this revision, if any
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RoomState(
        String roomId,
        long version,
        ObjectNode data,
        Instant lastUpdatedAt,
        String lastUpdatedBy) {

    public RoomState {
        Objects.requireNonNull(roomId, "roomId");
        if (version < 1) {
            throw new IllegalArgumentException("version must be >= 1, was " + version);
        }
        if (data == null) {
            data = JsonNodeFactory.instance.objectNode();
        }
    }

    public static RoomState initial(String roomId, Instant now) {
        return new RoomState(roomId, 1, JsonNodeFactory.instance.objectNode(), now, null);
    }

    /**
     * The revision that follows this one.
     */
    public RoomState next(ObjectNode newData, String actor, Instant now) {
        return new RoomState(roomId, version + 1, newData, now, actor);
    }

    public RoomState copy() {
        return new RoomState(roomId, version, data.deepCopy(), lastUpdatedAt, lastUpdatedBy);
    }
}
