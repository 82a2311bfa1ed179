package io.specado.core.model;

import java.util.Locale;

/** Severity of a validation {@link Finding}. */
public enum Severity {
    ERROR,
    WARNING;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
