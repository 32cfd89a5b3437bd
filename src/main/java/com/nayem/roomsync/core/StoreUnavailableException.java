package com.nayem.roomsync.core;

/**
 * The backing store could not be reached or rejected the command.
 */
public class StoreUnavailableException extends RoomStateException {

    public StoreUnavailableException(String roomId, String message, Throwable cause) {
        super(roomId, message, cause);
    }
}
