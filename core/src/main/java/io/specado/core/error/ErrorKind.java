package io.specado.core.error;

import java.util.Arrays;
import java.util.Optional;

/**
 * Error taxonomy shared by every engine operation.
 *
 * <p>
 * The numeric {@link #code()} values are part of the wire contract with
 * binding layers and MUST NOT change.
 */
public enum ErrorKind {
    SUCCESS(0),
    INVALID_INPUT(-1),
    JSON_ERROR(-2),
    PROVIDER_NOT_FOUND(-3),
    MODEL_NOT_FOUND(-4),
    NETWORK_ERROR(-5),
    AUTHENTICATION_ERROR(-6),
    RATE_LIMIT_ERROR(-7),
    TIMEOUT_ERROR(-8),
    INTERNAL_ERROR(-9),
    MEMORY_ERROR(-10),
    UTF8_ERROR(-11),
    NULL_POINTER(-12),
    CANCELLED(-13),
    NOT_IMPLEMENTED(-14),
    UNKNOWN(-99);

    private final int code;

    ErrorKind(int code) {
        this.code = code;
    }

    /** Stable numeric code exposed to binding layers. */
    public int code() {
        return code;
    }

    /** Returns {@code true} for {@link #SUCCESS}. */
    public boolean isSuccess() {
        return this == SUCCESS;
    }

    /** Looks up a kind by its numeric code. */
    public static Optional<ErrorKind> fromCode(int code) {
        return Arrays.stream(values()).filter(k -> k.code == code).findFirst();
    }
}
