package com.nayem.roomsync.core;

import java.time.Duration;

public class StoreTimeoutException extends RoomStateException {

    public StoreTimeoutException(String roomId, String operation, Duration timeout) {
        super(roomId, String.format("%s on room %s did not complete within %dms",
                operation, roomId, timeout.toMillis()));
    }

    public StoreTimeoutException(String roomId, String message, Throwable cause) {
        super(roomId, message, cause);
    }
}
