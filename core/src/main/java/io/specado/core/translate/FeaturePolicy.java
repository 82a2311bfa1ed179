package io.specado.core.translate;

import io.specado.core.capability.ModelCapabilities;
import io.specado.core.model.ContentPart;
import io.specado.core.model.Diagnostic;
import io.specado.core.model.JsonOutputStrategy;
import io.specado.core.model.Message;
import io.specado.core.model.ResponseFormat;
import io.specado.core.model.Role;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Degradations applied in standard mode when a requested feature is not
 * supported. Each entry depends only on the feature and the model facts,
 * changes the draft and returns exactly one diagnostic.
 */
final class FeaturePolicy {

    static final String JSON_INSTRUCTION = "Respond only with a single valid JSON object and no other text.";

    private FeaturePolicy() {}

    static Diagnostic degrade(Feature feature, TranslationDraft draft, ModelCapabilities model) {
        switch (feature) {
            case MULTI_TURN_MESSAGES:
                return flattenConversation(draft);
            case IMAGES:
                return dropImages(draft, model);
            case TOOLS:
                return dropTools(draft, model);
            case RESPONSE_FORMAT:
                return emulateOrDropResponseFormat(draft, model);
            case STREAMING:
                return fallBackToChatCompletion(draft, model);
            default:
                throw new IllegalStateException("No degradation policy for feature " + feature);
        }
    }

    /**
     * Folds every non-system message into one user message of
     * {@code role: text} lines. System messages stay where they are; image
     * parts are kept on the folded message for the images policy to judge.
     */
    private static Diagnostic flattenConversation(TranslationDraft draft) {
        List<Message> system = new ArrayList<>();
        List<String> lines = new ArrayList<>();
        List<ContentPart> images = new ArrayList<>();
        int folded = 0;
        for (Message message : draft.messages) {
            if (message.role() == Role.SYSTEM) {
                system.add(message);
                continue;
            }
            folded++;
            lines.add(message.role().wireName() + ": " + message.text());
            message.content().stream().filter(ContentPart::isImage).forEach(images::add);
        }
        List<ContentPart> parts = new ArrayList<>();
        parts.add(ContentPart.text(String.join("\n", lines)));
        parts.addAll(images);

        draft.messages.clear();
        draft.messages.addAll(system);
        draft.messages.add(new Message(Role.USER, parts, null));
        return new Diagnostic(
                Feature.MULTI_TURN_MESSAGES.wireName(),
                Diagnostic.Code.FALLBACK,
                "$.messages",
                "Model does not accept message lists; " + folded + " message(s) flattened into a single user turn");
    }

    private static Diagnostic dropImages(TranslationDraft draft, ModelCapabilities model) {
        int count = draft.imageCount();
        boolean inMessages = draft.messages.stream().anyMatch(Message::hasImages);
        List<Message> textOnly = draft.messages.stream().map(Message::withoutImages).collect(Collectors.toList());
        draft.messages.clear();
        draft.messages.addAll(textOnly);
        draft.inputImages.clear();
        return new Diagnostic(
                Feature.IMAGES.wireName(),
                Diagnostic.Code.DROPPED,
                inMessages ? "$.messages" : "$.media.input_images",
                "Model '" + model.modelId() + "' does not accept image input; dropped " + count + " image(s)");
    }

    private static Diagnostic dropTools(TranslationDraft draft, ModelCapabilities model) {
        int count = draft.tools.size();
        draft.tools.clear();
        draft.toolChoice = null;
        return new Diagnostic(
                Feature.TOOLS.wireName(),
                Diagnostic.Code.DROPPED,
                "$.tools",
                "Model '" + model.modelId() + "' does not support tools; dropped " + count
                        + " tool definition(s) and tool_choice");
    }

    private static Diagnostic emulateOrDropResponseFormat(TranslationDraft draft, ModelCapabilities model) {
        ResponseFormat format = draft.responseFormat;
        draft.responseFormat = null;
        if (model.model().jsonStrategy() == JsonOutputStrategy.SYSTEM_PROMPT) {
            String instruction = JSON_INSTRUCTION;
            if (format.jsonSchema() != null) {
                instruction = instruction + " The JSON must conform to this JSON Schema: " + format.jsonSchema();
            }
            appendToSystemPrompt(draft, instruction);
            return new Diagnostic(
                    Feature.RESPONSE_FORMAT.wireName(),
                    Diagnostic.Code.EMULATED,
                    "$.response_format",
                    "Structured output (" + format.type() + ") emulated through a system prompt instruction");
        }
        return new Diagnostic(
                Feature.RESPONSE_FORMAT.wireName(),
                Diagnostic.Code.DROPPED,
                "$.response_format",
                "Model '" + model.modelId() + "' has no structured output support; dropped response_format "
                        + format.type());
    }

    private static Diagnostic fallBackToChatCompletion(TranslationDraft draft, ModelCapabilities model) {
        draft.stream = false;
        return new Diagnostic(
                Feature.STREAMING.wireName(),
                Diagnostic.Code.FALLBACK,
                "$.stream",
                "Model '" + model.modelId() + "' has no streaming endpoint; using chat_completion");
    }

    /** Appends to the first system message, or inserts a leading one. */
    private static void appendToSystemPrompt(TranslationDraft draft, String instruction) {
        for (int i = 0; i < draft.messages.size(); i++) {
            Message message = draft.messages.get(i);
            if (message.role() == Role.SYSTEM) {
                String merged = message.text() + "\n\n" + instruction;
                draft.messages.set(i, new Message(Role.SYSTEM, List.of(ContentPart.text(merged)), message.name()));
                return;
            }
        }
        draft.messages.add(0, Message.of(Role.SYSTEM, instruction));
    }
}
