package io.specado.core.validation;

import com.fasterxml.jackson.databind.JsonNode;
import io.specado.core.model.Capability;
import io.specado.core.model.Finding;
import io.specado.core.model.InputMode;
import io.specado.core.model.JsonOutputStrategy;
import io.specado.core.model.Protocol;
import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Cross-reference and coverage rules for provider specs. Rules read the raw
 * tree and tolerate shapes the schema already rejected.
 */
final class ProviderSpecRules {

    static final String ENV_REFERENCE_PREFIX = "${ENV:";

    private static final Set<String> CREDENTIAL_HEADERS =
            Set.of("authorization", "proxy-authorization", "x-api-key", "api-key", "x-goog-api-key");

    private static final List<String> STRICT_MODEL_FIELDS = List.of("family", "input_modes");

    private ProviderSpecRules() {}

    static List<Finding> crossReferences(JsonNode root) {
        List<Finding> findings = new ArrayList<>();
        JsonNode provider = root.path("provider");
        checkBaseUrl(provider, findings);
        checkCredentialHeaders(provider.path("headers"), "$.provider.headers", findings);

        JsonNode models = root.path("models");
        if (!models.isArray()) {
            return findings;
        }
        checkIdentifiers(models, findings);
        for (int i = 0; i < models.size(); i++) {
            JsonNode model = models.get(i);
            if (model.isObject()) {
                checkModel(model, "$.models[" + i + "]", findings);
            }
        }
        return findings;
    }

    static List<Finding> coverage(JsonNode root) {
        List<Finding> findings = new ArrayList<>();
        JsonNode models = root.path("models");
        if (!models.isArray()) {
            return findings;
        }
        for (int i = 0; i < models.size(); i++) {
            JsonNode model = models.get(i);
            for (String field : STRICT_MODEL_FIELDS) {
                if (model.isObject() && !model.hasNonNull(field)) {
                    findings.add(Finding.error(
                            "$.models[" + i + "]." + field, "Required field " + field + " is missing"));
                }
            }
        }
        return findings;
    }

    private static void checkBaseUrl(JsonNode provider, List<Finding> findings) {
        JsonNode baseUrl = provider.path("base_url");
        if (!baseUrl.isTextual()) {
            return;
        }
        if (!isHttpUrl(baseUrl.asText())) {
            findings.add(Finding.error(
                    "$.provider.base_url", "base_url must be an absolute http or https URL, found '"
                            + baseUrl.asText() + "'"));
        }
    }

    private static boolean isHttpUrl(String value) {
        try {
            URI uri = URI.create(value);
            String scheme = uri.getScheme();
            return scheme != null
                    && (scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                    && uri.getHost() != null;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /** Model ids must be unique; aliases must not collide with any other id or alias. */
    private static void checkIdentifiers(JsonNode models, List<Finding> findings) {
        Map<String, Integer> idOwners = new HashMap<>();
        for (int i = 0; i < models.size(); i++) {
            JsonNode id = models.get(i).path("id");
            if (!id.isTextual()) {
                continue;
            }
            Integer previous = idOwners.putIfAbsent(id.asText(), i);
            if (previous != null) {
                findings.add(Finding.error(
                        "$.models[" + i + "].id",
                        "Duplicate model id '" + id.asText() + "' (first declared at $.models[" + previous + "])"));
            }
        }

        Map<String, Integer> aliasOwners = new HashMap<>();
        for (int i = 0; i < models.size(); i++) {
            JsonNode aliases = models.get(i).path("aliases");
            if (!aliases.isArray()) {
                continue;
            }
            for (int j = 0; j < aliases.size(); j++) {
                JsonNode alias = aliases.get(j);
                if (!alias.isTextual()) {
                    continue;
                }
                String path = "$.models[" + i + "].aliases[" + j + "]";
                Integer idOwner = idOwners.get(alias.asText());
                Integer aliasOwner = aliasOwners.putIfAbsent(alias.asText(), i);
                if (idOwner != null && idOwner != i) {
                    findings.add(Finding.error(
                            path, "Alias '" + alias.asText() + "' collides with model id at $.models[" + idOwner
                                    + "]"));
                } else if (aliasOwner != null && aliasOwner != i) {
                    findings.add(Finding.error(
                            path, "Alias '" + alias.asText() + "' is also declared by $.models[" + aliasOwner + "]"));
                }
            }
        }
    }

    private static void checkModel(JsonNode model, String path, List<Finding> findings) {
        JsonNode endpoints = model.path("endpoints");
        if (endpoints.isObject()) {
            for (Map.Entry<String, JsonNode> entry : endpoints.properties()) {
                checkEndpoint(entry.getKey(), entry.getValue(), path + ".endpoints." + entry.getKey(), findings);
            }
            if (!endpoints.has(Capability.CHAT_COMPLETION.wireName())) {
                findings.add(Finding.error(
                        path + ".endpoints", "Model must declare a chat_completion endpoint"));
            }
        }

        JsonNode inputModes = model.path("input_modes");
        if (inputModes.isObject()
                && !inputModes.path(InputMode.MESSAGES.wireName()).asBoolean(false)
                && !inputModes.path(InputMode.SINGLE_TEXT.wireName()).asBoolean(false)) {
            findings.add(Finding.error(
                    path + ".input_modes", "At least one of messages or single_text input modes must be enabled"));
        }

        JsonNode jsonOutput = model.path("json_output");
        if (JsonOutputStrategy.NATIVE.wireName().equals(jsonOutput.path("strategy").asText())
                && !jsonOutput.path("native_param").asBoolean(false)) {
            findings.add(Finding.error(
                    path + ".json_output.native_param", "json_output strategy native requires native_param true"));
        }

        JsonNode paths = model.path("mappings").path("paths");
        if (paths.isObject()) {
            for (Map.Entry<String, JsonNode> entry : paths.properties()) {
                JsonNode target = entry.getValue();
                if (target.isTextual() && (target.asText().isBlank() || hasEmptySegment(target.asText()))) {
                    findings.add(Finding.error(
                            path + ".mappings.paths." + entry.getKey(),
                            "Mapping target for '" + entry.getKey() + "' must be a non-empty field path"));
                }
            }
        }
    }

    private static void checkEndpoint(String name, JsonNode endpoint, String path, List<Finding> findings) {
        Optional<Capability> capability = Capability.fromWire(name);
        if (capability.isEmpty()) {
            findings.add(Finding.warning(path, "Unknown endpoint '" + name + "' is ignored"));
        }
        JsonNode endpointPath = endpoint.path("path");
        if (endpointPath.isTextual() && !endpointPath.asText().startsWith("/")) {
            findings.add(Finding.error(path + ".path", "Endpoint path must start with '/'"));
        }
        if (capability.orElse(null) == Capability.STREAMING_CHAT_COMPLETION
                && !Protocol.SSE.wireName().equals(endpoint.path("protocol").asText().toLowerCase(Locale.ROOT))) {
            findings.add(Finding.warning(
                    path + ".protocol", "streaming_chat_completion endpoints should use the sse protocol"));
        }
        checkCredentialHeaders(endpoint.path("headers"), path + ".headers", findings);
    }

    private static void checkCredentialHeaders(JsonNode headers, String path, List<Finding> findings) {
        if (!headers.isObject()) {
            return;
        }
        for (Map.Entry<String, JsonNode> entry : headers.properties()) {
            JsonNode value = entry.getValue();
            if (isCredentialHeader(entry.getKey())
                    && value.isTextual()
                    && !value.asText().contains(ENV_REFERENCE_PREFIX)) {
                findings.add(Finding.warning(
                        path + "." + entry.getKey(),
                        "Credential header '" + entry.getKey() + "' should use a ${ENV:NAME} reference"));
            }
        }
    }

    private static boolean isCredentialHeader(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return CREDENTIAL_HEADERS.contains(lower) || lower.endsWith("-token") || lower.endsWith("-api-key");
    }

    private static boolean hasEmptySegment(String dotted) {
        for (String segment : dotted.split("\\.", -1)) {
            if (segment.isEmpty()) {
                return true;
            }
        }
        return false;
    }
}
