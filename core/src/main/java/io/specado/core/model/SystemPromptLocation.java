package io.specado.core.model;

import java.util.Arrays;
import java.util.Optional;

/** Where a provider expects the system prompt. */
public enum SystemPromptLocation {
    /** As a leading {@code system} message. */
    MESSAGES("messages"),
    /** As a top-level {@code system} field of the request body. */
    TOP_LEVEL("top_level");

    private final String wireName;

    SystemPromptLocation(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<SystemPromptLocation> fromWire(String value) {
        return Arrays.stream(values()).filter(l -> l.wireName.equals(value)).findFirst();
    }
}
