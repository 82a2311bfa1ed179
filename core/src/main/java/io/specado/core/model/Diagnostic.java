package io.specado.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Non-fatal note describing a degradation applied during translation.
 *
 * @param feature the degraded feature (e.g. {@code images})
 * @param code    what happened to it
 * @param path    JSON path in the prompt spec of the affected input
 * @param message human-readable description
 */
public record Diagnostic(String feature, Code code, String path, String message) {

    /** Kind of degradation. */
    public enum Code {
        /** Input was removed from the request. */
        DROPPED,
        /** A less capable request shape was used instead. */
        FALLBACK,
        /** The feature was approximated by other means. */
        EMULATED;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public Diagnostic {
        Objects.requireNonNull(feature, "feature must not be null");
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }
}
