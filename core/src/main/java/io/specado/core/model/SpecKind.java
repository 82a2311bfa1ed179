package io.specado.core.model;

import java.util.Arrays;
import java.util.Optional;

/** The two document kinds the engine understands. */
public enum SpecKind {
    PROMPT_SPEC("prompt_spec"),
    PROVIDER_SPEC("provider_spec");

    private final String wireName;

    SpecKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<SpecKind> fromWire(String value) {
        return Arrays.stream(values()).filter(k -> k.wireName.equals(value)).findFirst();
    }
}
