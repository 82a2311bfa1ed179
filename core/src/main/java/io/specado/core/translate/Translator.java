package io.specado.core.translate;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.specado.core.capability.ModelCapabilities;
import io.specado.core.error.CapabilityMismatchException;
import io.specado.core.error.InvalidSpecException;
import io.specado.core.error.ModelNotFoundException;
import io.specado.core.model.Capability;
import io.specado.core.model.Diagnostic;
import io.specado.core.model.EndpointDescriptor;
import io.specado.core.model.Finding;
import io.specado.core.model.PromptSpec;
import io.specado.core.model.Protocol;
import io.specado.core.model.ProviderRequest;
import io.specado.core.model.TranslationMode;
import io.specado.core.model.TranslationResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a prompt spec onto a resolved model.
 *
 * <p>
 * The prompt first passes {@link PromptPrecheck}; any finding rejects it.
 *
 * <p>
 * Features the prompt needs are checked against the model in {@link Feature}
 * order. Strict mode rejects any gap; standard mode closes each gap through
 * {@link FeaturePolicy} and records one diagnostic per degraded feature.
 *
 * <p>
 * Stateless and thread-safe.
 */
public final class Translator {

    private static final Logger LOG = LoggerFactory.getLogger(Translator.class);

    static final String CONTENT_TYPE = "Content-Type";
    static final String ACCEPT = "Accept";

    /**
     * Translates {@code prompt} for {@code model}.
     *
     * @throws InvalidSpecException        if the prompt has no messages or
     *                                     fails a pre-translation check
     * @throws ModelNotFoundException      if the model declares no
     *                                     {@code chat_completion} endpoint
     * @throws CapabilityMismatchException in strict mode, if any requested
     *                                     feature is unsupported
     */
    public TranslationResult translate(PromptSpec prompt, ModelCapabilities model, TranslationMode mode) {
        Objects.requireNonNull(prompt, "prompt must not be null");
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        if (prompt.messages().isEmpty()) {
            throw new InvalidSpecException("Prompt spec must contain at least one message");
        }
        if (model.endpoints().isEmpty()) {
            throw new ModelNotFoundException(
                    "Model '" + model.modelId() + "' declares no supported endpoints", model.modelId());
        }
        List<Finding> problems = PromptPrecheck.check(prompt, model.model());
        if (!problems.isEmpty()) {
            LOG.debug("Prompt rejected for model {}: {} finding(s)", model.modelId(), problems.size());
            throw new InvalidSpecException("Prompt cannot be translated for model '" + model.modelId() + "': "
                    + problems.stream().map(f -> f.path() + ": " + f.message()).collect(Collectors.joining("; ")));
        }

        List<Feature> missing = new ArrayList<>();
        for (Feature feature : Feature.values()) {
            if (feature.isRequestedBy(prompt) && !feature.isSupportedBy(model)) {
                missing.add(feature);
            }
        }

        if (mode == TranslationMode.STRICT && !missing.isEmpty()) {
            List<String> names = missing.stream().map(Feature::wireName).sorted().toList();
            throw new CapabilityMismatchException(model.modelId(), names);
        }

        TranslationDraft draft = new TranslationDraft(prompt);
        List<Diagnostic> diagnostics = new ArrayList<>(missing.size());
        for (Feature feature : missing) {
            diagnostics.add(FeaturePolicy.degrade(feature, draft, model));
        }

        Capability capability = draft.stream && model.supports(Capability.STREAMING_CHAT_COMPLETION)
                ? Capability.STREAMING_CHAT_COMPLETION
                : Capability.CHAT_COMPLETION;
        EndpointDescriptor endpoint = model.endpoint(capability)
                .orElseThrow(() -> new ModelNotFoundException(
                        "Model '" + model.modelId() + "' declares no " + capability.wireName() + " endpoint",
                        model.modelId()));

        ObjectNode body = PayloadBuilder.build(prompt, draft, model);
        FieldMappings.apply(body, model.model().fieldMappings());

        ProviderRequest request = new ProviderRequest(
                model.providerName(),
                model.modelId(),
                capability,
                endpoint,
                joinUrl(model.baseUrl(), endpoint.path()),
                headers(model, endpoint),
                body);

        LOG.atInfo()
                .addKeyValue("provider", model.providerName())
                .addKeyValue("model", model.modelId())
                .addKeyValue("mode", mode.wireName())
                .addKeyValue("capability", capability.wireName())
                .addKeyValue("diagnostics", diagnostics.size())
                .log("translation.completed");
        return new TranslationResult(request, diagnostics, mode);
    }

    static String joinUrl(String baseUrl, String path) {
        String base = baseUrl;
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        if (path.isEmpty()) {
            return base;
        }
        return path.startsWith("/") ? base + path : base + "/" + path;
    }

    /**
     * Provider headers overlaid by endpoint headers, names compared
     * case-insensitively, then the content negotiation headers.
     */
    static Map<String, String> headers(ModelCapabilities model, EndpointDescriptor endpoint) {
        Map<String, String> headers = new LinkedHashMap<>();
        model.providerHeaders().forEach((name, value) -> overlay(headers, name, value));
        endpoint.headers().forEach((name, value) -> overlay(headers, name, value));
        overlay(headers, CONTENT_TYPE, "application/json");
        if (endpoint.protocol() == Protocol.SSE) {
            overlay(headers, ACCEPT, "text/event-stream");
        }
        return headers;
    }

    private static void overlay(Map<String, String> headers, String name, String value) {
        headers.keySet().removeIf(existing -> existing.equalsIgnoreCase(name));
        headers.put(name, value);
    }
}
