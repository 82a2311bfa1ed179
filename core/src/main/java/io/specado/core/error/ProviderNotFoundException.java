package io.specado.core.error;

/** Thrown when a provider spec declares no usable models. */
public final class ProviderNotFoundException extends SpecadoException {

    private static final long serialVersionUID = 1L;

    public ProviderNotFoundException(String message) {
        super(ErrorKind.PROVIDER_NOT_FOUND, message);
    }

    public ProviderNotFoundException(String message, Throwable cause) {
        super(ErrorKind.PROVIDER_NOT_FOUND, message, cause);
    }
}
