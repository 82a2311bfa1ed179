package io.specado.core.translate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Map;

/**
 * Applies a model's {@code mappings.paths} renames to a request body.
 *
 * <p>
 * Sources and targets are dotted field paths; a leading {@code $.} is
 * ignored. Intermediate objects of a target are created as needed. Sources
 * absent from the body are skipped.
 */
final class FieldMappings {

    private FieldMappings() {}

    static void apply(ObjectNode body, Map<String, String> mappings) {
        for (Map.Entry<String, String> mapping : mappings.entrySet()) {
            String[] source = segments(mapping.getKey());
            String[] target = segments(mapping.getValue());
            if (source.length == 0 || target.length == 0 || String.join(".", source).equals(String.join(".", target))) {
                continue;
            }
            JsonNode value = remove(body, source);
            if (value != null) {
                put(body, target, value);
            }
        }
    }

    private static JsonNode remove(ObjectNode body, String[] path) {
        ObjectNode parent = body;
        for (int i = 0; i < path.length - 1; i++) {
            JsonNode child = parent.get(path[i]);
            if (child == null || !child.isObject()) {
                return null;
            }
            parent = (ObjectNode) child;
        }
        return parent.remove(path[path.length - 1]);
    }

    private static void put(ObjectNode body, String[] path, JsonNode value) {
        ObjectNode parent = body;
        for (int i = 0; i < path.length - 1; i++) {
            JsonNode child = parent.get(path[i]);
            if (child == null || !child.isObject()) {
                child = parent.putObject(path[i]);
            }
            parent = (ObjectNode) child;
        }
        parent.set(path[path.length - 1], value);
    }

    private static String[] segments(String path) {
        String trimmed = path.startsWith("$.") ? path.substring(2) : path;
        if (trimmed.isBlank()) {
            return new String[0];
        }
        return trimmed.split("\\.");
    }
}
