package io.specado.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Validation strictness. Each level includes every check of the level before
 * it.
 *
 * <ul>
 * <li>{@link #BASIC}: structural well-formedness against the bundled JSON
 * Schema.</li>
 * <li>{@link #PARTIAL}: adds internal cross-reference rules.</li>
 * <li>{@link #STRICT}: adds spec version compatibility and full
 * required-field coverage.</li>
 * </ul>
 */
public enum ValidationMode {
    BASIC("basic"),
    PARTIAL("partial"),
    STRICT("strict");

    private final String wireName;

    ValidationMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Returns {@code true} if this mode runs every check of {@code other}. */
    public boolean includes(ValidationMode other) {
        return ordinal() >= other.ordinal();
    }

    public static Optional<ValidationMode> fromWire(String value) {
        return Arrays.stream(values()).filter(m -> m.wireName.equals(value)).findFirst();
    }
}
