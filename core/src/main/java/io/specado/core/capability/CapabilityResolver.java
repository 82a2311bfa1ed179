package io.specado.core.capability;

import io.specado.core.error.ModelNotFoundException;
import io.specado.core.error.ProviderNotFoundException;
import io.specado.core.model.ModelSpec;
import io.specado.core.model.ProviderSpec;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds a model in a provider spec. Matching is exact and case-sensitive:
 * ids are tried first, then aliases, each in document order.
 *
 * <p>
 * Stateless and thread-safe.
 */
public final class CapabilityResolver {

    private static final Logger LOG = LoggerFactory.getLogger(CapabilityResolver.class);

    /**
     * Resolves {@code modelId} against {@code spec}.
     *
     * @throws ProviderNotFoundException if the spec declares no models
     * @throws ModelNotFoundException    if no model matches, or the match
     *                                   declares no endpoints
     */
    public ModelCapabilities resolve(ProviderSpec spec, String modelId) {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(modelId, "modelId must not be null");
        String provider = spec.provider().name();
        if (spec.models().isEmpty()) {
            throw new ProviderNotFoundException("Provider '" + provider + "' declares no models");
        }

        ModelSpec model = spec.models().stream()
                .filter(m -> m.id().equals(modelId))
                .findFirst()
                .or(() -> spec.models().stream()
                        .filter(m -> m.aliases().contains(modelId))
                        .findFirst())
                .orElseThrow(() -> new ModelNotFoundException(
                        "Model '" + modelId + "' not found for provider '" + provider + "'. Available models: "
                                + spec.models().stream().map(ModelSpec::id).collect(Collectors.joining(", ")),
                        modelId));

        if (model.endpoints().isEmpty()) {
            throw new ModelNotFoundException(
                    "Model '" + model.id() + "' of provider '" + provider + "' declares no supported endpoints",
                    modelId);
        }

        LOG.debug("Resolved model '{}' to '{}' of provider '{}'", modelId, model.id(), provider);
        return new ModelCapabilities(spec.provider(), model);
    }
}
