package io.specado.core.error;

/** Thrown when input bytes are not valid UTF-8. */
public final class InvalidEncodingException extends SpecadoException {

    private static final long serialVersionUID = 1L;

    public InvalidEncodingException(String message) {
        super(ErrorKind.UTF8_ERROR, message);
    }

    public InvalidEncodingException(String message, Throwable cause) {
        super(ErrorKind.UTF8_ERROR, message, cause);
    }
}
