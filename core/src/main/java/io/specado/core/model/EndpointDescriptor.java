package io.specado.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * How to reach one capability of a model.
 *
 * @param method   HTTP method, upper-case
 * @param path     request path relative to the provider base URL
 * @param protocol transport protocol
 * @param headers  endpoint-specific headers, overlaid on provider headers
 */
public record EndpointDescriptor(String method, String path, Protocol protocol, Map<String, String> headers) {

    public EndpointDescriptor {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(protocol, "protocol must not be null");
        headers = headers != null ? Collections.unmodifiableMap(new LinkedHashMap<>(headers)) : Map.of();
    }
}
