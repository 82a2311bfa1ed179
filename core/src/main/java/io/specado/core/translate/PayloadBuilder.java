package io.specado.core.translate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.specado.core.capability.ModelCapabilities;
import io.specado.core.model.ContentPart;
import io.specado.core.model.Message;
import io.specado.core.model.PromptSpec;
import io.specado.core.model.ResponseFormat;
import io.specado.core.model.Role;
import io.specado.core.model.SamplingParams;
import io.specado.core.model.SystemPromptLocation;
import io.specado.core.model.ToolDefinition;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the canonical chat request body from a draft. Keys are written in a
 * fixed order so equal drafts yield equal documents.
 */
final class PayloadBuilder {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private PayloadBuilder() {}

    static ObjectNode build(PromptSpec prompt, TranslationDraft draft, ModelCapabilities model) {
        ObjectNode body = NODES.objectNode();
        body.put("model", model.modelId());

        boolean topLevelSystem = model.model().systemPromptLocation() == SystemPromptLocation.TOP_LEVEL;
        List<String> systemTexts = new ArrayList<>();
        ArrayNode messages = NODES.arrayNode();
        for (Message message : withAttachedImages(draft)) {
            if (topLevelSystem && message.role() == Role.SYSTEM) {
                systemTexts.add(message.text());
            } else {
                messages.add(message(message));
            }
        }
        if (!systemTexts.isEmpty()) {
            body.put("system", String.join("\n\n", systemTexts));
        }
        body.set("messages", messages);

        SamplingParams sampling = prompt.sampling();
        putIfSet(body, "temperature", sampling.temperature());
        putIfSet(body, "top_p", sampling.topP());
        if (sampling.topK() != null) {
            body.put("top_k", sampling.topK());
        }
        putIfSet(body, "frequency_penalty", sampling.frequencyPenalty());
        putIfSet(body, "presence_penalty", sampling.presencePenalty());
        if (sampling.seed() != null) {
            body.put("seed", sampling.seed());
        }
        if (prompt.maxOutputTokens() != null) {
            body.put("max_tokens", prompt.maxOutputTokens());
        }
        if (!prompt.stop().isEmpty()) {
            ArrayNode stop = body.putArray("stop");
            prompt.stop().forEach(stop::add);
        }
        if (!draft.tools.isEmpty()) {
            ArrayNode tools = body.putArray("tools");
            for (ToolDefinition tool : draft.tools) {
                tools.add(tool(tool));
            }
            if (draft.toolChoice != null) {
                body.set("tool_choice", toolChoice(draft.toolChoice));
            }
        }
        if (draft.responseFormat != null && draft.responseFormat.isStructured()) {
            body.set("response_format", responseFormat(draft.responseFormat));
        }
        if (draft.stream) {
            body.put("stream", true);
        }
        return body;
    }

    /** Attached images join the content of the last user message. */
    private static List<Message> withAttachedImages(TranslationDraft draft) {
        if (draft.inputImages.isEmpty()) {
            return draft.messages;
        }
        List<Message> messages = new ArrayList<>(draft.messages);
        for (int i = messages.size() - 1; i >= 0; i--) {
            Message message = messages.get(i);
            if (message.role() == Role.USER) {
                List<ContentPart> parts = new ArrayList<>(message.content());
                parts.addAll(draft.inputImages);
                messages.set(i, new Message(Role.USER, parts, message.name()));
                return messages;
            }
        }
        messages.add(new Message(Role.USER, draft.inputImages, null));
        return messages;
    }

    private static ObjectNode message(Message message) {
        ObjectNode node = NODES.objectNode();
        node.put("role", message.role().wireName());
        if (!message.hasImages()) {
            node.put("content", message.text());
        } else {
            ArrayNode parts = node.putArray("content");
            for (ContentPart part : message.content()) {
                ObjectNode partNode = parts.addObject();
                if (part.isImage()) {
                    partNode.put("type", "image_url");
                    partNode.putObject("image_url").put("url", part.url());
                } else {
                    partNode.put("type", "text");
                    partNode.put("text", part.text());
                }
            }
        }
        if (message.name() != null) {
            node.put("name", message.name());
        }
        return node;
    }

    private static ObjectNode tool(ToolDefinition tool) {
        ObjectNode node = NODES.objectNode();
        node.put("type", "function");
        ObjectNode function = node.putObject("function");
        function.put("name", tool.name());
        if (tool.description() != null) {
            function.put("description", tool.description());
        }
        function.set("parameters", tool.parameters() != null ? tool.parameters().deepCopy() : emptyObjectSchema());
        return node;
    }

    /** {@code {"name": x}} becomes the function form; other values pass through. */
    private static JsonNode toolChoice(JsonNode toolChoice) {
        if (toolChoice.isObject() && toolChoice.path("name").isTextual() && !toolChoice.has("type")) {
            ObjectNode node = NODES.objectNode();
            node.put("type", "function");
            node.putObject("function").put("name", toolChoice.get("name").asText());
            return node;
        }
        return toolChoice.deepCopy();
    }

    private static ObjectNode responseFormat(ResponseFormat format) {
        ObjectNode node = NODES.objectNode();
        node.put("type", format.type());
        if (format.jsonSchema() != null) {
            node.set("json_schema", format.jsonSchema().deepCopy());
        }
        return node;
    }

    private static ObjectNode emptyObjectSchema() {
        ObjectNode schema = NODES.objectNode();
        schema.put("type", "object");
        schema.putObject("properties");
        return schema;
    }

    private static void putIfSet(ObjectNode node, String field, Double value) {
        if (value != null) {
            node.put(field, value);
        }
    }
}
