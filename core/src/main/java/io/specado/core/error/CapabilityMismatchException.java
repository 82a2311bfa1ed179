package io.specado.core.error;

import java.util.List;

/**
 * Thrown by a strict translation when the prompt requests features the target
 * model does not support. The missing feature names are sorted so the message
 * is reproducible.
 */
public final class CapabilityMismatchException extends SpecadoException {

    private static final long serialVersionUID = 1L;

    private final String modelId;
    private final List<String> missingFeatures;

    public CapabilityMismatchException(String modelId, List<String> missingFeatures) {
        super(
                ErrorKind.NOT_IMPLEMENTED,
                "Model '" + modelId + "' does not support requested feature"
                        + (missingFeatures.size() > 1 ? "s" : "") + ": " + String.join(", ", missingFeatures));
        this.modelId = modelId;
        this.missingFeatures = List.copyOf(missingFeatures);
    }

    public String modelId() {
        return modelId;
    }

    /** Missing feature names in ascending order. */
    public List<String> missingFeatures() {
        return missingFeatures;
    }
}
