package io.specado.core.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Error details extracted from a non-2xx provider response body. Understands
 * the OpenAI ({@code {"error":{"type","code","message"}}}) and Anthropic
 * ({@code {"type":"error","error":{"type","message"}}}) shapes; any other
 * body yields an empty error carrying a body excerpt as its message.
 *
 * @param type    provider error type, may be null
 * @param code    provider error code, may be null
 * @param message provider error message, may be null
 */
record ProviderError(String type, String code, String message) {

    private static final int EXCERPT_LENGTH = 200;

    static ProviderError parse(ObjectMapper mapper, String body) {
        if (body == null || body.isBlank()) {
            return new ProviderError(null, null, null);
        }
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            return new ProviderError(null, null, excerpt(body));
        }
        JsonNode error = root.path("error");
        if (error.isObject()) {
            return new ProviderError(text(error.get("type")), text(error.get("code")), text(error.get("message")));
        }
        if (error.isTextual()) {
            return new ProviderError(null, null, error.asText());
        }
        String message = text(root.get("message"));
        return new ProviderError(null, null, message != null ? message : excerpt(body));
    }

    private static String text(JsonNode node) {
        return node != null && node.isValueNode() && !node.isNull() ? node.asText() : null;
    }

    private static String excerpt(String body) {
        String trimmed = body.strip();
        return trimmed.length() <= EXCERPT_LENGTH ? trimmed : trimmed.substring(0, EXCERPT_LENGTH) + "...";
    }
}
