package io.specado.core.error;

import java.util.Objects;

/**
 * Abstract base for all engine exceptions. Never thrown directly; each concrete
 * subclass is bound to exactly one {@link ErrorKind}.
 *
 * <p>
 * Components throw these; {@code SpecadoEngine} converts them into
 * {@link Outcome} values so callers never see an exception for an expected
 * failure mode.
 */
public abstract class SpecadoException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    protected SpecadoException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    protected SpecadoException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    /** The taxonomy entry this failure belongs to. */
    public ErrorKind kind() {
        return kind;
    }
}
