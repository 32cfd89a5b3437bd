package com.nayem.roomsync.core;

/**
 * Base type for every failure surfaced by the room state engine.
 * <p>
 * Futures returned by {@link RoomStateEngine} complete exceptionally with a
 * subclass of this exception (or with {@link IllegalArgumentException} for
 * malformed input).
 * </p>
 */
public abstract class RoomStateException extends RuntimeException {

    private final String roomId;

    protected RoomStateException(String roomId, String message) {
        super(message);
        this.roomId = roomId;
    }

    protected RoomStateException(String roomId, String message, Throwable cause) {
        super(message, cause);
        this.roomId = roomId;
    }

    /**
     * Returns the room the failed call addressed, or {@code null} when the
     * failure is not tied to one room.
     */
    public String getRoomId() {
        return roomId;
    }

    /**
     * Whether the caller may re-read the state and try the same call again.
     */
    public boolean isRetryable() {
        return false;
    }
}
