package io.specado.core.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.schibsted.spt.data.jslt.Expression;
import com.schibsted.spt.data.jslt.JsltException;
import com.schibsted.spt.data.jslt.Parser;
import io.specado.core.capability.ModelCapabilities;
import io.specado.core.error.InvalidSpecException;
import io.specado.core.model.ResponseNormalization;
import io.specado.core.model.Role;
import io.specado.core.model.UniformResponse;
import io.specado.core.model.Usage;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reduces a provider's synchronous response to a {@link UniformResponse}.
 *
 * <p>
 * When the model declares {@code response_normalization} paths they are
 * evaluated as JSLT expressions. Otherwise the response shape is detected:
 * OpenAI-style {@code choices}, then Anthropic-style {@code content} blocks,
 * then a raw fallback that keeps the whole document as content.
 */
public final class ResponseNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(ResponseNormalizer.class);

    /**
     * Normalizes {@code response} produced by {@code model}.
     *
     * @throws InvalidSpecException if a declared normalization path is not a
     *                              valid JSLT expression
     */
    public UniformResponse normalize(JsonNode response, ModelCapabilities model) {
        Objects.requireNonNull(response, "response must not be null");
        Objects.requireNonNull(model, "model must not be null");
        ResponseNormalization paths = model.model().responseNormalization();
        if (paths != null && paths.contentPath() != null) {
            LOG.debug("Normalizing response of '{}' with declared paths", model.modelId());
            return fromDeclaredPaths(response, model, paths);
        }
        if (response.path("choices").isArray()) {
            return fromChoices(response, model);
        }
        if (response.path("content").isArray()) {
            return fromContentBlocks(response, model);
        }
        LOG.debug("Unrecognized response shape from '{}', using raw fallback", model.modelId());
        return new UniformResponse(
                text(response.get("id")),
                model.modelId(),
                Role.ASSISTANT,
                response.isTextual() ? response.asText() : response.toString(),
                null,
                null);
    }

    private UniformResponse fromDeclaredPaths(JsonNode response, ModelCapabilities model, ResponseNormalization paths) {
        String content = contentText(evaluate(paths.contentPath(), "content_path", response));
        String finishReason = null;
        if (paths.finishReasonPath() != null) {
            String raw = text(evaluate(paths.finishReasonPath(), "finish_reason_path", response));
            if (raw != null) {
                finishReason = normalizeFinishReason(paths.finishReasonMap().getOrDefault(raw, raw));
            }
        }
        return new UniformResponse(
                text(response.get("id")), modelOf(response, model), Role.ASSISTANT, content, finishReason,
                usage(response));
    }

    private UniformResponse fromChoices(JsonNode response, ModelCapabilities model) {
        JsonNode choice = response.path("choices").path(0);
        String content = contentText(choice.path("message").get("content"));
        if (content == null) {
            content = text(choice.get("text"));
        }
        String finishReason = text(choice.get("finish_reason"));
        return new UniformResponse(
                text(response.get("id")),
                modelOf(response, model),
                Role.ASSISTANT,
                content,
                finishReason != null ? normalizeFinishReason(finishReason) : null,
                usage(response));
    }

    private UniformResponse fromContentBlocks(JsonNode response, ModelCapabilities model) {
        String finishReason = text(response.get("stop_reason"));
        return new UniformResponse(
                text(response.get("id")),
                modelOf(response, model),
                Role.ASSISTANT,
                contentText(response.get("content")),
                finishReason != null ? normalizeFinishReason(finishReason) : null,
                usage(response));
    }

    /**
     * Evaluates a JSLT path. JSONPath-style paths are accepted by mapping
     * the leading {@code $} onto the JSLT context node.
     */
    private static JsonNode evaluate(String path, String field, JsonNode response) {
        String expression = path.startsWith("$") ? path.substring(1) : path;
        if (expression.isEmpty()) {
            expression = ".";
        } else if (!expression.startsWith(".")) {
            expression = "." + expression;
        }
        try {
            Expression compiled = Parser.compileString(expression);
            return compiled.apply(response);
        } catch (JsltException e) {
            throw new InvalidSpecException("Invalid " + field + " '" + path + "': " + e.getMessage(), e);
        }
    }

    /** Strings as-is, arrays of text blocks joined, null and missing as null. */
    private static String contentText(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isArray()) {
            return StreamSupport.stream(node.spliterator(), false)
                    .map(block -> block.isTextual() ? block.asText() : text(block.get("text")))
                    .filter(Objects::nonNull)
                    .collect(Collectors.joining());
        }
        return node.toString();
    }

    /** Maps provider finish reasons onto the normalized vocabulary. */
    static String normalizeFinishReason(String reason) {
        switch (reason.toLowerCase(Locale.ROOT)) {
            case "stop":
            case "end_turn":
            case "stop_sequence":
                return "stop";
            case "length":
            case "max_tokens":
                return "length";
            case "tool_call":
            case "tool_calls":
            case "tool_use":
            case "function_call":
                return "tool_call";
            case "content_filter":
                return "content_filter";
            case "end_conversation":
            case "end":
                return "end_conversation";
            default:
                return "other";
        }
    }

    private static Usage usage(JsonNode response) {
        JsonNode usage = response.get("usage");
        if (usage == null || !usage.isObject()) {
            return null;
        }
        Long prompt = number(usage.get("prompt_tokens"));
        Long completion = number(usage.get("completion_tokens"));
        if (prompt == null && completion == null) {
            prompt = number(usage.get("input_tokens"));
            completion = number(usage.get("output_tokens"));
        }
        return Usage.of(prompt, completion, number(usage.get("total_tokens")));
    }

    private static String modelOf(JsonNode response, ModelCapabilities model) {
        String reported = text(response.get("model"));
        return reported != null ? reported : model.modelId();
    }

    private static Long number(JsonNode node) {
        return node != null && node.isIntegralNumber() ? node.longValue() : null;
    }

    private static String text(JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : null;
    }
}
