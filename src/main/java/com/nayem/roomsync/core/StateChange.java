package com.nayem.roomsync.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Record of one committed mutation.
 * <p>
 * The same value is published on {@code room:{roomId}:state:updates} and
 * pushed onto {@code room:{roomId}:state:history}.
 * </p>
 *
 * @param roomId     the mutated room
 * @param version    the version the mutation produced
 * @param changeType which operation produced it
 * @param changes    the request data for REPLACE/MERGE, {@code {path: value}}
 *                   for PATCH, {@code {path: null}} for DELETE
 * @param actor      who performed it, if known
 * @param timestamp  commit time
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StateChange(
        String roomId,
        long version,
        ChangeType changeType,
        JsonNode changes,
        String actor,
        Instant timestamp) {
}
