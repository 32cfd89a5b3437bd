package com.nayem.roomsync.core;

/**
 * A stored document or channel message could not be read or written as JSON.
 * Treat as corruption: retrying will not help.
 */
public class StateSerializationException extends RoomStateException {

    public StateSerializationException(String roomId, String message, Throwable cause) {
        super(roomId, message, cause);
    }
}
