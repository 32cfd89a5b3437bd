package com.nayem.roomsync.core;

/**
 * Redis key and channel names. Every process in the fleet must agree on these.
 */
public final class RoomKeys {

    private static final String PREFIX = "room:";

    private RoomKeys() {
    }

    public static String stateKey(String roomId) {
        return PREFIX + roomId + ":state";
    }

    public static String updatesChannel(String roomId) {
        return PREFIX + roomId + ":state:updates";
    }

    public static String eventsChannel(String roomId) {
        return PREFIX + roomId + ":events";
    }

    public static String historyKey(String roomId) {
        return PREFIX + roomId + ":state:history";
    }

    public static String requireRoomId(String roomId) {
        if (roomId == null || roomId.isBlank()) {
            throw new IllegalArgumentException("roomId must not be blank");
        }
        return roomId;
    }
}
