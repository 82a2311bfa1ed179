package io.specado.core.error;

/** Thrown when input text cannot be parsed as JSON or YAML at all. */
public final class MalformedSpecException extends SpecadoException {

    private static final long serialVersionUID = 1L;

    public MalformedSpecException(String message) {
        super(ErrorKind.JSON_ERROR, message);
    }

    public MalformedSpecException(String message, Throwable cause) {
        super(ErrorKind.JSON_ERROR, message, cause);
    }
}
