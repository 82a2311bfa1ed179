package io.specado.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Provider identity and connection root.
 *
 * @param name    provider name (e.g. {@code openai})
 * @param baseUrl absolute base URL
 * @param headers headers sent with every request, values may carry
 *                {@code ${ENV:NAME}} references
 */
public record ProviderInfo(String name, String baseUrl, Map<String, String> headers) {

    public ProviderInfo {
        Objects.requireNonNull(name, "provider name must not be null");
        Objects.requireNonNull(baseUrl, "provider base_url must not be null");
        headers = headers != null ? Collections.unmodifiableMap(new LinkedHashMap<>(headers)) : Map.of();
    }
}
