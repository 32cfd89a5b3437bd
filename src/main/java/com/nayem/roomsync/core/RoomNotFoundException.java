package com.nayem.roomsync.core;

public class RoomNotFoundException extends RoomStateException {

    public RoomNotFoundException(String roomId) {
        super(roomId, "Room state not found: " + roomId);
    }
}
