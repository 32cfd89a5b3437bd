package com.nayem.roomsync.core;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Whole-document update: either replaces {@code data} or shallow-merges the
 * given top-level keys into it.
 */
public record UpdateRequest(ObjectNode data, boolean merge) {

    public UpdateRequest {
        Objects.requireNonNull(data, "data");
    }

    public static UpdateRequest replace(ObjectNode data) {
        return new UpdateRequest(data, false);
    }

    public static UpdateRequest merge(ObjectNode data) {
        return new UpdateRequest(data, true);
    }

    ObjectNode applyTo(ObjectNode current) {
        if (!merge) {
            return data.deepCopy();
        }
        ObjectNode merged = current.deepCopy();
        merged.setAll(data.deepCopy());
        return merged;
    }

    ChangeType changeType() {
        return merge ? ChangeType.MERGE : ChangeType.REPLACE;
    }
}
