package io.specado.core.model;

import java.util.Objects;

/**
 * Provider response reduced to a provider-independent shape.
 *
 * @param id           provider response id, may be null
 * @param model        model that produced the response
 * @param role         always {@code assistant} for chat responses
 * @param content      generated text, may be null
 * @param finishReason normalized finish reason, may be null
 * @param usage        token usage, may be null
 */
public record UniformResponse(String id, String model, Role role, String content, String finishReason, Usage usage) {

    public UniformResponse {
        Objects.requireNonNull(model, "model must not be null");
        role = role != null ? role : Role.ASSISTANT;
    }
}
