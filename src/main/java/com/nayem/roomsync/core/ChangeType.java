package com.nayem.roomsync.core;

/**
 * The operation that produced a room state revision.
 */
public enum ChangeType {
    /**
     * {@code updateState} with {@code merge=false}.
     */
    REPLACE,

    /**
     * {@code updateState} with {@code merge=true}.
     */
    MERGE,

    /**
     * {@code patchState}: one dot-path set.
     */
    PATCH,

    /**
     * {@code deleteStateKey}: one dot-path removal.
     */
    DELETE
}
