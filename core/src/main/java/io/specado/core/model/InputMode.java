package io.specado.core.model;

import java.util.Arrays;
import java.util.Optional;

/** Input modes a model accepts, declared under {@code input_modes} in a provider spec. */
public enum InputMode {
    /** Multi-turn role-tagged message lists. */
    MESSAGES("messages"),
    /** A single text prompt. */
    SINGLE_TEXT("single_text"),
    /** Image content parts. */
    IMAGES("images");

    private final String wireName;

    InputMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<InputMode> fromWire(String value) {
        return Arrays.stream(values()).filter(m -> m.wireName.equals(value)).findFirst();
    }
}
