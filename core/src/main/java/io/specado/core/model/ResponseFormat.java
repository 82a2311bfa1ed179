package io.specado.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * Requested output format.
 *
 * @param type       {@code text}, {@code json_object} or {@code json_schema}
 * @param jsonSchema the schema for {@code json_schema}, otherwise null
 */
public record ResponseFormat(String type, JsonNode jsonSchema) {

    public static final String TEXT = "text";
    public static final String JSON_OBJECT = "json_object";
    public static final String JSON_SCHEMA = "json_schema";

    public ResponseFormat {
        Objects.requireNonNull(type, "response format type must not be null");
    }

    /** Plain text needs no provider support; every other format does. */
    public boolean isStructured() {
        return !TEXT.equals(type);
    }
}
