package io.specado.core.model;

import java.util.Arrays;
import java.util.Optional;

/** Transport protocol of an endpoint. */
public enum Protocol {
    HTTP("http"),
    /** Server-Sent Events over HTTP. */
    SSE("sse");

    private final String wireName;

    Protocol(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<Protocol> fromWire(String value) {
        return Arrays.stream(values()).filter(p -> p.wireName.equals(value)).findFirst();
    }
}
