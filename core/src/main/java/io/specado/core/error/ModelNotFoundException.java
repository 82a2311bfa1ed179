package io.specado.core.error;

/**
 * Thrown when the requested model id is absent from a provider spec, or when
 * the matching model declares no endpoints at all.
 */
public final class ModelNotFoundException extends SpecadoException {

    private static final long serialVersionUID = 1L;

    private final String modelId;

    public ModelNotFoundException(String message, String modelId) {
        super(ErrorKind.MODEL_NOT_FOUND, message);
        this.modelId = modelId;
    }

    /** The model id that could not be resolved. */
    public String modelId() {
        return modelId;
    }
}
