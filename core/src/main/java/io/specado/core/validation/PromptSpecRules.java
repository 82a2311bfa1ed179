package io.specado.core.validation;

import com.fasterxml.jackson.databind.JsonNode;
import io.specado.core.model.Finding;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Cross-reference and coverage rules for prompt specs. Rules read the raw
 * tree and tolerate shapes the schema already rejected.
 */
final class PromptSpecRules {

    static final Set<String> MODEL_CLASSES = Set.of(
            "Chat", "ReasoningChat", "VisionChat", "AudioChat", "MultimodalChat", "VideoChat", "RAGChat");

    /** Top-level fields accepted in strict mode. */
    static final Set<String> KNOWN_FIELDS = Set.of(
            "spec_version",
            "id",
            "model_class",
            "model",
            "system",
            "messages",
            "sampling",
            "temperature",
            "top_p",
            "top_k",
            "seed",
            "max_tokens",
            "limits",
            "stop",
            "tools",
            "tool_choice",
            "response_format",
            "media",
            "rag",
            "conversation",
            "preferences",
            "stream",
            "strict_mode",
            "metadata");

    private static final Pattern TOOL_NAME = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private static final List<String> STRICT_REQUIRED = List.of("spec_version", "id", "model_class");

    private PromptSpecRules() {}

    static List<Finding> crossReferences(JsonNode root) {
        List<Finding> findings = new ArrayList<>();
        checkToolChoice(root, findings);
        checkSystemMessages(root, findings);
        checkResponseFormat(root, findings);
        checkModelClass(root, findings);
        checkLimits(root, findings);
        checkMediaForModelClass(root, findings);
        checkSampling(root, findings);
        return findings;
    }

    static List<Finding> coverage(JsonNode root) {
        List<Finding> findings = new ArrayList<>();
        for (String field : STRICT_REQUIRED) {
            // spec_version is covered by the version check
            if (!"spec_version".equals(field) && isAbsent(root.get(field))) {
                findings.add(Finding.error("$." + field, "Required field " + field + " is missing"));
            }
        }
        for (Map.Entry<String, JsonNode> entry : root.properties()) {
            if (!KNOWN_FIELDS.contains(entry.getKey())) {
                findings.add(Finding.error(
                        "$." + entry.getKey(), "Unknown field '" + entry.getKey() + "' not allowed in strict mode"));
            }
        }
        return findings;
    }

    private static void checkToolChoice(JsonNode root, List<Finding> findings) {
        JsonNode tools = root.path("tools");
        Set<String> names = new HashSet<>();
        if (tools.isArray()) {
            for (int i = 0; i < tools.size(); i++) {
                JsonNode name = tools.get(i).path("name");
                if (name.isTextual() && !TOOL_NAME.matcher(name.asText()).matches()) {
                    findings.add(Finding.error(
                            "$.tools[" + i + "].name",
                            "Tool name '" + name.asText() + "' must be 1 to 64 letters, digits, '_' or '-'"));
                }
                if (name.isTextual() && !names.add(name.asText())) {
                    findings.add(Finding.error(
                            "$.tools[" + i + "].name", "Duplicate tool name '" + name.asText() + "'"));
                }
            }
        }

        JsonNode toolChoice = root.get("tool_choice");
        if (isAbsent(toolChoice)) {
            return;
        }
        if (!tools.isArray() || tools.isEmpty()) {
            findings.add(
                    Finding.error("$.tool_choice", "tool_choice requires tools array to be defined and non-empty"));
            return;
        }
        String named = namedTool(toolChoice);
        if (named != null && !names.contains(named)) {
            findings.add(Finding.error(
                    "$.tool_choice", "tool_choice references undeclared tool '" + named + "'"));
        }
    }

    private static String namedTool(JsonNode toolChoice) {
        if (!toolChoice.isObject()) {
            return null;
        }
        if (toolChoice.path("name").isTextual()) {
            return toolChoice.get("name").asText();
        }
        JsonNode function = toolChoice.path("function").path("name");
        return function.isTextual() ? function.asText() : null;
    }

    private static void checkSystemMessages(JsonNode root, List<Finding> findings) {
        JsonNode messages = root.path("messages");
        if (!messages.isArray()) {
            return;
        }
        boolean shortcut = root.path("system").isTextual();
        for (int i = 0; i < messages.size(); i++) {
            if (!"system".equals(messages.get(i).path("role").asText())) {
                continue;
            }
            if (shortcut || i > 0) {
                findings.add(Finding.warning(
                        "$.messages[" + i + "].role",
                        "Only a single leading system message is portable across providers"));
            }
        }
    }

    private static void checkResponseFormat(JsonNode root, List<Finding> findings) {
        JsonNode format = root.path("response_format");
        if (format.isObject()
                && "json_schema".equals(format.path("type").asText())
                && isAbsent(format.get("json_schema"))) {
            findings.add(Finding.error(
                    "$.response_format.json_schema", "response_format of type json_schema requires json_schema"));
        }
    }

    private static void checkModelClass(JsonNode root, List<Finding> findings) {
        JsonNode modelClass = root.path("model_class");
        if (modelClass.isTextual() && !MODEL_CLASSES.contains(modelClass.asText())) {
            findings.add(Finding.error(
                    "$.model_class",
                    "Model class '" + modelClass.asText() + "' is not supported, expected one of "
                            + MODEL_CLASSES.stream().sorted().toList()));
        }
    }

    private static void checkLimits(JsonNode root, List<Finding> findings) {
        JsonNode limits = root.path("limits");
        if (limits.path("reasoning_tokens").isNumber() && !"ReasoningChat".equals(modelClass(root))) {
            findings.add(Finding.error(
                    "$.limits.reasoning_tokens",
                    "reasoning_tokens is only valid when model_class is ReasoningChat, found " + modelClass(root)));
        }
        positive(limits.path("max_output_tokens"), "$.limits.max_output_tokens", findings);
        positive(limits.path("max_prompt_tokens"), "$.limits.max_prompt_tokens", findings);
        positive(limits.path("reasoning_tokens"), "$.limits.reasoning_tokens", findings);
        positive(root.path("max_tokens"), "$.max_tokens", findings);
    }

    private static void checkMediaForModelClass(JsonNode root, List<Finding> findings) {
        JsonNode media = root.path("media");
        String modelClass = modelClass(root);
        if (media.has("input_audio") && !Set.of("AudioChat", "MultimodalChat").contains(modelClass)) {
            findings.add(Finding.error(
                    "$.media.input_audio",
                    "input_audio is only valid for AudioChat or MultimodalChat, found " + modelClass));
        }
        if (media.has("input_video") && !Set.of("MultimodalChat", "VideoChat").contains(modelClass)) {
            findings.add(Finding.error(
                    "$.media.input_video",
                    "input_video is only valid for MultimodalChat or VideoChat, found " + modelClass));
        }
        if (root.has("rag") && !"RAGChat".equals(modelClass)) {
            findings.add(
                    Finding.error("$.rag", "rag configuration is only valid when model_class is RAGChat, found "
                            + modelClass));
        }
    }

    private static void checkSampling(JsonNode root, List<Finding> findings) {
        JsonNode sampling = root.path("sampling");
        range(sampling.path("temperature"), 0.0, 2.0, "$.sampling.temperature", findings);
        range(root.path("temperature"), 0.0, 2.0, "$.temperature", findings);
        range(sampling.path("top_p"), 0.0, 1.0, "$.sampling.top_p", findings);
        range(sampling.path("frequency_penalty"), -2.0, 2.0, "$.sampling.frequency_penalty", findings);
        range(sampling.path("presence_penalty"), -2.0, 2.0, "$.sampling.presence_penalty", findings);
    }

    private static void range(JsonNode value, double min, double max, String path, List<Finding> findings) {
        if (value.isNumber() && (value.doubleValue() < min || value.doubleValue() > max)) {
            findings.add(Finding.warning(
                    path, "Value " + value.asText() + " is outside the usual range [" + min + ", " + max + "]"));
        }
    }

    private static void positive(JsonNode value, String path, List<Finding> findings) {
        if (value.isIntegralNumber() && value.longValue() <= 0) {
            findings.add(Finding.error(path, "Must be greater than 0, found " + value.asText()));
        }
    }

    private static String modelClass(JsonNode root) {
        JsonNode modelClass = root.path("model_class");
        return modelClass.isTextual() ? modelClass.asText() : "Chat";
    }

    private static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }
}
