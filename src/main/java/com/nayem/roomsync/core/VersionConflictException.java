package com.nayem.roomsync.core;

/**
 * The stored version moved past the one the caller based its write on.
 * Nothing was written; re-read and retry.
 */
public class VersionConflictException extends RoomStateException {

    private final long expectedVersion;
    private final long actualVersion;

    public VersionConflictException(String roomId, long expectedVersion, long actualVersion) {
        this(roomId, expectedVersion, actualVersion,
                String.format("State version conflict on room %s: expected %d but found %d",
                        roomId, expectedVersion, actualVersion));
    }

    private VersionConflictException(String roomId, long expectedVersion, long actualVersion, String message) {
        super(roomId, message);
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    /**
     * Another writer committed over {@code expectedVersion} between this
     * caller's read and its compare-and-set.
     */
    public static VersionConflictException overwritten(String roomId, long expectedVersion, int attempts) {
        return new VersionConflictException(roomId, expectedVersion, -1,
                String.format("State version conflict on room %s: version %d was overwritten, gave up after %d attempt(s)",
                        roomId, expectedVersion, attempts));
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    /**
     * @return the version found in the store, or -1 when it is unknown
     */
    public long getActualVersion() {
        return actualVersion;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
