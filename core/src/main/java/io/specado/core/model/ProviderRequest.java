package io.specado.core.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Concrete request addressed to one provider endpoint.
 *
 * <p>
 * The body is owned by this request once built; callers must treat it as
 * read-only. Header values may still contain {@code ${ENV:NAME}} references,
 * resolved when the request is sent.
 *
 * @param provider   provider name
 * @param model      resolved model id
 * @param capability selected endpoint capability
 * @param endpoint   selected endpoint
 * @param url        absolute request URL
 * @param headers    request headers in insertion order
 * @param body       JSON request body
 */
public record ProviderRequest(
        String provider,
        String model,
        Capability capability,
        EndpointDescriptor endpoint,
        String url,
        Map<String, String> headers,
        ObjectNode body) {

    public ProviderRequest {
        Objects.requireNonNull(provider, "provider must not be null");
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(capability, "capability must not be null");
        Objects.requireNonNull(endpoint, "endpoint must not be null");
        Objects.requireNonNull(url, "url must not be null");
        Objects.requireNonNull(body, "body must not be null");
        headers = headers != null ? Collections.unmodifiableMap(new LinkedHashMap<>(headers)) : Map.of();
    }

    /** Returns {@code true} if the selected endpoint speaks server-sent events. */
    public boolean isStreaming() {
        return endpoint.protocol() == Protocol.SSE;
    }
}
