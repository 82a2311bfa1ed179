package io.specado.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Description of a provider's API surface.
 *
 * <p>
 * Immutable and safe to reuse across translations.
 *
 * @param specVersion declared spec version
 * @param provider    provider identity
 * @param models      declared models in document order, ids unique
 */
public record ProviderSpec(String specVersion, ProviderInfo provider, List<ModelSpec> models) {

    public ProviderSpec {
        Objects.requireNonNull(provider, "provider must not be null");
        models = models != null ? List.copyOf(models) : List.of();
    }
}
