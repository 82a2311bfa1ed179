package io.specado.core.model;

import java.util.Objects;

/**
 * One validation finding.
 *
 * @param severity error or warning
 * @param path     JSON path of the offending node, {@code $} for the root
 * @param message  human-readable description
 */
public record Finding(Severity severity, String path, String message) {

    public Finding {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static Finding error(String path, String message) {
        return new Finding(Severity.ERROR, path, message);
    }

    public static Finding warning(String path, String message) {
        return new Finding(Severity.WARNING, path, message);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
