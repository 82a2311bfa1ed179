package io.specado.core.error;

/** Thrown when an operation is invoked with an option value it does not recognize. */
public final class InvalidOptionException extends SpecadoException {

    private static final long serialVersionUID = 1L;

    public InvalidOptionException(String message) {
        super(ErrorKind.INVALID_INPUT, message);
    }

    public InvalidOptionException(String message, Throwable cause) {
        super(ErrorKind.INVALID_INPUT, message, cause);
    }
}
