package io.specado.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Where to find content in a provider's synchronous response. Paths are JSLT
 * path expressions; JSONPath-style {@code $.a[0].b} is accepted too.
 *
 * @param contentPath      path to the generated text
 * @param finishReasonPath path to the provider finish reason
 * @param finishReasonMap  provider finish reason to normalized finish reason
 */
public record ResponseNormalization(String contentPath, String finishReasonPath, Map<String, String> finishReasonMap) {

    public ResponseNormalization {
        finishReasonMap = finishReasonMap != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(finishReasonMap))
                : Map.of();
    }
}
