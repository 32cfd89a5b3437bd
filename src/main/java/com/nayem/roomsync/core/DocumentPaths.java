package com.nayem.roomsync.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Dot-path addressing ({@code "player.score"}) into a room document.
 * <p>
 * Only objects are traversed; array indices are not supported. Paths must be
 * non-empty and may not contain empty segments.
 * </p>
 */
public final class DocumentPaths {

    private DocumentPaths() {
    }

    public static List<String> parse(String path) {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("path must not be empty");
        }
        String[] segments = path.split("\\.", -1);
        for (String segment : segments) {
            if (segment.isEmpty()) {
                throw new IllegalArgumentException("path contains an empty segment: '" + path + "'");
            }
        }
        return List.of(segments);
    }

    /**
     * @return the node at {@code path}, or {@code null} if any segment is missing
     */
    public static JsonNode get(ObjectNode root, String path) {
        JsonNode current = root;
        for (String segment : parse(path)) {
            if (current == null || !current.isObject()) {
                return null;
            }
            current = current.get(segment);
        }
        return current;
    }

    /**
     * Sets the leaf at {@code path}. Missing intermediate segments, and
     * intermediate segments holding a non-object value, become empty objects.
     */
    public static void set(ObjectNode root, String path, JsonNode value) {
        List<String> segments = parse(path);
        ObjectNode current = root;
        for (int i = 0; i < segments.size() - 1; i++) {
            JsonNode child = current.get(segments.get(i));
            if (child == null || !child.isObject()) {
                current = current.putObject(segments.get(i));
            } else {
                current = (ObjectNode) child;
            }
        }
        current.set(segments.get(segments.size() - 1), value == null ? NullNode.getInstance() : value);
    }

    /**
     * Removes the leaf at {@code path}.
     *
     * @return false if the leaf, or any segment leading to it, was absent
     */
    public static boolean remove(ObjectNode root, String path) {
        List<String> segments = parse(path);
        ObjectNode current = root;
        for (int i = 0; i < segments.size() - 1; i++) {
            JsonNode child = current.get(segments.get(i));
            if (child == null || !child.isObject()) {
                return false;
            }
            current = (ObjectNode) child;
        }
        return current.remove(segments.get(segments.size() - 1)) != null;
    }
}
