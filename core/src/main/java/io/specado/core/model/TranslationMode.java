package io.specado.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Fidelity policy for translation.
 *
 * <ul>
 * <li>{@link #STANDARD}: unsupported features are degraded through a
 * documented fallback, each recorded as a diagnostic.</li>
 * <li>{@link #STRICT}: any unsupported feature fails the whole
 * translation.</li>
 * </ul>
 */
public enum TranslationMode {
    STANDARD("standard"),
    STRICT("strict");

    private final String wireName;

    TranslationMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<TranslationMode> fromWire(String value) {
        return Arrays.stream(values()).filter(m -> m.wireName.equals(value)).findFirst();
    }
}
