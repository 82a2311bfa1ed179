package io.specado.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Objects;

/**
 * Provider-agnostic description of a chat request.
 *
 * <p>
 * Immutable, created by {@code SpecParser}. The message list is never empty;
 * the parser rejects such prompts.
 *
 * @param specVersion     declared spec version, may be null
 * @param id              prompt identifier, may be null
 * @param modelClass      model class, {@code Chat} when not declared
 * @param messages        ordered conversation, a {@code system} shortcut is
 *                        already folded in as the leading message
 * @param sampling        sampling parameters, never null
 * @param maxOutputTokens output token limit, may be null
 * @param stop            stop sequences, never null
 * @param tools           tool definitions, never null
 * @param toolChoice      tool choice as declared, may be null
 * @param responseFormat  requested output format, may be null
 * @param inputImages     images attached outside the message list
 * @param stream          whether incremental output was requested
 * @param metadata        opaque caller metadata, may be null
 */
public record PromptSpec(
        String specVersion,
        String id,
        String modelClass,
        List<Message> messages,
        SamplingParams sampling,
        Integer maxOutputTokens,
        List<String> stop,
        List<ToolDefinition> tools,
        JsonNode toolChoice,
        ResponseFormat responseFormat,
        List<ContentPart> inputImages,
        boolean stream,
        JsonNode metadata) {

    public static final String DEFAULT_MODEL_CLASS = "Chat";

    public PromptSpec {
        messages = List.copyOf(Objects.requireNonNull(messages, "messages must not be null"));
        modelClass = modelClass != null ? modelClass : DEFAULT_MODEL_CLASS;
        sampling = sampling != null ? sampling : SamplingParams.NONE;
        stop = stop != null ? List.copyOf(stop) : List.of();
        tools = tools != null ? List.copyOf(tools) : List.of();
        inputImages = inputImages != null ? List.copyOf(inputImages) : List.of();
    }

    /** Returns {@code true} if any message carries image parts or images are attached. */
    public boolean requestsImages() {
        return !inputImages.isEmpty() || messages.stream().anyMatch(Message::hasImages);
    }

    /**
     * Returns {@code true} if the prompt is a conversation: more than one
     * non-system message, or any assistant turn.
     */
    public boolean isConversation() {
        long turns = messages.stream().filter(m -> m.role() != Role.SYSTEM).count();
        return turns > 1 || messages.stream().anyMatch(m -> m.role() == Role.ASSISTANT);
    }

    public boolean hasTools() {
        return !tools.isEmpty();
    }

    public boolean requestsStructuredOutput() {
        return responseFormat != null && responseFormat.isStructured();
    }
}
