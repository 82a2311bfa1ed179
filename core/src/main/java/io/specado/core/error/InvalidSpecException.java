package io.specado.core.error;

/** Thrown when input parses but has the wrong shape or violates a spec invariant. */
public final class InvalidSpecException extends SpecadoException {

    private static final long serialVersionUID = 1L;

    public InvalidSpecException(String message) {
        super(ErrorKind.INVALID_INPUT, message);
    }

    public InvalidSpecException(String message, Throwable cause) {
        super(ErrorKind.INVALID_INPUT, message, cause);
    }
}
