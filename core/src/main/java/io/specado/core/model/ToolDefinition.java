package io.specado.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * A function tool the model may call.
 *
 * @param name        tool name, unique within a prompt
 * @param description optional description
 * @param parameters  JSON Schema of the tool arguments, may be null
 */
public record ToolDefinition(String name, String description, JsonNode parameters) {

    public ToolDefinition {
        Objects.requireNonNull(name, "tool name must not be null");
    }
}
