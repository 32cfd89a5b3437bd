package com.nayem.roomsync.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Ad-hoc domain event (e.g. {@code player_joined}) carried on
 * {@code room:{roomId}:events}, separate from state-diff notifications.
 */
public record RoomEvent(String eventType, JsonNode payload, Instant timestamp) {
}
