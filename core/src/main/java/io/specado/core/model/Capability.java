package io.specado.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Endpoint capabilities a model may declare. Closed set: translation fallback
 * logic switches over it exhaustively.
 */
public enum Capability {
    CHAT_COMPLETION("chat_completion"),
    STREAMING_CHAT_COMPLETION("streaming_chat_completion");

    private final String wireName;

    Capability(String wireName) {
        this.wireName = wireName;
    }

    /** Key used for this capability in a provider spec's {@code endpoints} map. */
    public String wireName() {
        return wireName;
    }

    public static Optional<Capability> fromWire(String value) {
        return Arrays.stream(values()).filter(c -> c.wireName.equals(value)).findFirst();
    }
}
