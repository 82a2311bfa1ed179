package io.specado.core.model;

import java.util.Arrays;
import java.util.Optional;

/** How a model produces structured JSON output. */
public enum JsonOutputStrategy {
    /** A native request parameter ({@code response_format}). */
    NATIVE("native"),
    /** An instruction in the system prompt. */
    SYSTEM_PROMPT("system_prompt"),
    NONE("none");

    private final String wireName;

    JsonOutputStrategy(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<JsonOutputStrategy> fromWire(String value) {
        return Arrays.stream(values()).filter(s -> s.wireName.equals(value)).findFirst();
    }
}
