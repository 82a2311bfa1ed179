package io.specado.core.translate;

import com.fasterxml.jackson.databind.JsonNode;
import io.specado.core.model.Finding;
import io.specado.core.model.Message;
import io.specado.core.model.ModelConstraints;
import io.specado.core.model.ModelSpec;
import io.specado.core.model.PromptSpec;
import io.specado.core.model.Role;
import io.specado.core.model.SamplingParams;
import io.specado.core.model.ToolDefinition;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rules a prompt must pass before it is mapped onto a model. Every finding is
 * an error; any finding fails the translation in both modes.
 */
final class PromptPrecheck {

    static final Pattern TOOL_NAME = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private PromptPrecheck() {}

    static List<Finding> check(PromptSpec prompt, ModelSpec model) {
        List<Finding> findings = new ArrayList<>();
        checkTools(prompt, findings);
        checkOutputLimit(prompt, findings);
        checkExclusiveFields(prompt, model.constraints(), findings);
        checkSizeLimits(prompt, model.constraints(), findings);
        return findings;
    }

    private static void checkTools(PromptSpec prompt, List<Finding> findings) {
        Set<String> names = new HashSet<>();
        for (int i = 0; i < prompt.tools().size(); i++) {
            String name = prompt.tools().get(i).name();
            if (!TOOL_NAME.matcher(name).matches()) {
                findings.add(Finding.error(
                        "$.tools[" + i + "].name",
                        "Tool name '" + name + "' must be 1 to 64 letters, digits, '_' or '-'"));
            }
            if (!names.add(name)) {
                findings.add(Finding.error("$.tools[" + i + "].name", "Duplicate tool name '" + name + "'"));
            }
        }

        JsonNode toolChoice = prompt.toolChoice();
        if (toolChoice == null) {
            return;
        }
        if (prompt.tools().isEmpty()) {
            findings.add(Finding.error("$.tool_choice", "tool_choice requires a non-empty tools array"));
            return;
        }
        String named = namedTool(toolChoice);
        if (named != null && !names.contains(named)) {
            findings.add(Finding.error("$.tool_choice", "tool_choice references undeclared tool '" + named + "'"));
        }
    }

    private static String namedTool(JsonNode toolChoice) {
        if (toolChoice.path("name").isTextual()) {
            return toolChoice.get("name").asText();
        }
        JsonNode function = toolChoice.path("function").path("name");
        return function.isTextual() ? function.asText() : null;
    }

    private static void checkOutputLimit(PromptSpec prompt, List<Finding> findings) {
        Integer limit = prompt.maxOutputTokens();
        if (limit != null && limit <= 0) {
            findings.add(Finding.error(
                    "$.limits.max_output_tokens", "Output token limit must be greater than 0, found " + limit));
        }
    }

    private static void checkExclusiveFields(PromptSpec prompt, ModelConstraints constraints, List<Finding> findings) {
        for (List<String> group : constraints.mutuallyExclusive()) {
            List<String> present = group.stream().filter(field -> isPresent(prompt, field)).toList();
            if (present.size() > 1) {
                findings.add(Finding.error(
                        "$",
                        "Mutually exclusive fields present: " + String.join(", ", present) + " (only one of "
                                + String.join(", ", group) + " is allowed)"));
            }
        }
    }

    /** Field names not listed here are never considered present. */
    private static boolean isPresent(PromptSpec prompt, String field) {
        SamplingParams sampling = prompt.sampling();
        switch (field) {
            case "tools":
                return prompt.hasTools();
            case "tool_choice":
                return prompt.toolChoice() != null;
            case "response_format":
                return prompt.responseFormat() != null;
            case "sampling":
                return !sampling.isEmpty();
            case "temperature":
            case "sampling.temperature":
                return sampling.temperature() != null;
            case "top_p":
            case "sampling.top_p":
                return sampling.topP() != null;
            case "top_k":
            case "sampling.top_k":
                return sampling.topK() != null;
            case "frequency_penalty":
            case "sampling.frequency_penalty":
                return sampling.frequencyPenalty() != null;
            case "presence_penalty":
            case "sampling.presence_penalty":
                return sampling.presencePenalty() != null;
            case "seed":
            case "sampling.seed":
                return sampling.seed() != null;
            case "limits":
            case "max_tokens":
            case "limits.max_output_tokens":
                return prompt.maxOutputTokens() != null;
            case "stop":
                return !prompt.stop().isEmpty();
            case "media":
                return !prompt.inputImages().isEmpty();
            case "stream":
                return prompt.stream();
            default:
                return false;
        }
    }

    private static void checkSizeLimits(PromptSpec prompt, ModelConstraints constraints, List<Finding> findings) {
        Integer maxSystem = constraints.maxSystemPromptBytes();
        if (maxSystem != null) {
            List<Message> messages = prompt.messages();
            for (int i = 0; i < messages.size(); i++) {
                Message message = messages.get(i);
                if (message.role() != Role.SYSTEM) {
                    continue;
                }
                int size = utf8Length(message.text());
                if (size > maxSystem) {
                    findings.add(Finding.error(
                            "$.messages",
                            "System message at position " + (i + 1) + " is " + size
                                    + " bytes, model allows at most " + maxSystem));
                }
            }
        }

        Integer maxSchema = constraints.maxToolSchemaBytes();
        if (maxSchema != null) {
            List<ToolDefinition> tools = prompt.tools();
            for (int i = 0; i < tools.size(); i++) {
                JsonNode parameters = tools.get(i).parameters();
                int size = parameters != null ? utf8Length(parameters.toString()) : 0;
                if (size > maxSchema) {
                    findings.add(Finding.error(
                            "$.tools[" + i + "].parameters",
                            "Tool schema is " + size + " bytes, model allows at most " + maxSchema));
                }
            }
        }
    }

    private static int utf8Length(String text) {
        return text.getBytes(StandardCharsets.UTF_8).length;
    }
}
