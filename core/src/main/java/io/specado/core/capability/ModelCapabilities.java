package io.specado.core.capability;

import io.specado.core.model.Capability;
import io.specado.core.model.EndpointDescriptor;
import io.specado.core.model.InputMode;
import io.specado.core.model.ModelSpec;
import io.specado.core.model.ProviderInfo;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only facts about one resolved model of one provider.
 *
 * @param provider the provider the model belongs to
 * @param model    the resolved model, with at least one endpoint
 */
public record ModelCapabilities(ProviderInfo provider, ModelSpec model) {

    public ModelCapabilities {
        Objects.requireNonNull(provider, "provider must not be null");
        Objects.requireNonNull(model, "model must not be null");
    }

    public String providerName() {
        return provider.name();
    }

    public String baseUrl() {
        return provider.baseUrl();
    }

    public Map<String, String> providerHeaders() {
        return provider.headers();
    }

    public String modelId() {
        return model.id();
    }

    public Map<Capability, EndpointDescriptor> endpoints() {
        return model.endpoints();
    }

    public Optional<EndpointDescriptor> endpoint(Capability capability) {
        return Optional.ofNullable(model.endpoints().get(capability));
    }

    public boolean supports(Capability capability) {
        return model.endpoints().containsKey(capability);
    }

    public Set<InputMode> inputModes() {
        return model.inputModes();
    }

    public boolean supports(InputMode mode) {
        return model.inputModes().contains(mode);
    }
}
