package io.querybridge.core.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * Dotted-path lookups on JSON trees, shared by the adapters.
 *
 * <p>
 * Thread-safe, stateless utility class.
 */
public final class JsonPaths {

    private JsonPaths() {}

    /**
     * Resolves {@code path} (e.g. {@code "author.name"}) against {@code node}.
     * Numeric segments index into arrays.
     *
     * @return the node at the path, or {@link MissingNode} when any segment is absent
     */
    public static JsonNode at(JsonNode node, String path) {
        if (node == null) {
            return MissingNode.getInstance();
        }
        if (path == null || path.isEmpty()) {
            return node;
        }
        JsonNode current = node;
        for (String segment : path.split("\\.")) {
            if (current.isObject()) {
                current = current.path(segment);
            } else if (current.isArray() && isIndex(segment)) {
                current = current.path(Integer.parseInt(segment));
            } else {
                return MissingNode.getInstance();
            }
            if (current.isMissingNode()) {
                return current;
            }
        }
        return current;
    }

    /** {@code true} for {@code null}, JSON null and missing nodes. */
    public static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    private static boolean isIndex(String segment) {
        if (segment.isEmpty() || segment.length() > 9) {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
