package io.specado.core.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.specado.core.config.EngineConfig;
import io.specado.core.model.Finding;
import io.specado.core.model.SemanticVersion;
import io.specado.core.model.SpecKind;
import io.specado.core.model.ValidationMode;
import io.specado.core.model.ValidationReport;
import io.specado.core.spec.SpecReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates prompt and provider spec documents at three levels of strictness.
 *
 * <p>
 * Always produces a report for a parseable document; invalid documents are
 * described by error findings, never by exceptions. Findings are ordered:
 * schema findings sorted by path then message, then cross-reference findings
 * in rule order, then version and coverage findings.
 *
 * <p>
 * The bundled schemas are compiled once per instance. Thread-safe.
 */
public final class SpecValidator {

    private static final Logger LOG = LoggerFactory.getLogger(SpecValidator.class);
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    static final String PROMPT_SCHEMA = "/schemas/prompt-spec.schema.json";
    static final String PROVIDER_SCHEMA = "/schemas/provider-spec.schema.json";

    private static final Comparator<Finding> BY_PATH_THEN_MESSAGE =
            Comparator.comparing(Finding::path).thenComparing(Finding::message);

    private final EngineConfig config;
    private final JsonSchema promptSchema;
    private final JsonSchema providerSchema;

    public SpecValidator() {
        this(EngineConfig.defaults());
    }

    public SpecValidator(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.promptSchema = loadSchema(PROMPT_SCHEMA);
        this.providerSchema = loadSchema(PROVIDER_SCHEMA);
    }

    /**
     * Parses and validates a JSON document.
     *
     * @throws io.specado.core.error.MalformedSpecException if the text is not
     *                                                      valid JSON
     */
    public ValidationReport validate(String text, SpecKind kind, ValidationMode mode) {
        return validate(SpecReader.readJson(text), kind, mode);
    }

    /** Validates an already parsed document. */
    public ValidationReport validate(JsonNode document, SpecKind kind, ValidationMode mode) {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(mode, "mode must not be null");

        List<Finding> findings = new ArrayList<>(schemaFindings(document, kind));

        if (mode.includes(ValidationMode.PARTIAL) && document.isObject()) {
            findings.addAll(kind == SpecKind.PROMPT_SPEC
                    ? PromptSpecRules.crossReferences(document)
                    : ProviderSpecRules.crossReferences(document));
        }
        if (mode.includes(ValidationMode.STRICT) && document.isObject()) {
            findings.addAll(versionFindings(document));
            findings.addAll(kind == SpecKind.PROMPT_SPEC
                    ? PromptSpecRules.coverage(document)
                    : ProviderSpecRules.coverage(document));
        }

        ValidationReport report = new ValidationReport(kind, mode, findings);
        LOG.debug(
                "Validated {} in {} mode: {} error(s), {} warning(s)",
                kind.wireName(),
                mode.wireName(),
                report.errors().size(),
                report.warnings().size());
        return report;
    }

    private List<Finding> schemaFindings(JsonNode document, SpecKind kind) {
        JsonSchema schema = kind == SpecKind.PROMPT_SPEC ? promptSchema : providerSchema;
        Set<ValidationMessage> messages = schema.validate(document);
        List<Finding> findings = new ArrayList<>(messages.size());
        for (ValidationMessage message : messages) {
            String path = message.getInstanceLocation() != null
                    ? message.getInstanceLocation().toString()
                    : "$";
            findings.add(Finding.error(path, message.getMessage()));
        }
        findings.sort(BY_PATH_THEN_MESSAGE);
        return findings;
    }

    /** Checks that {@code spec_version} is present, well-formed and supported. */
    private List<Finding> versionFindings(JsonNode document) {
        JsonNode node = document.get("spec_version");
        if (node == null || node.isNull()) {
            return List.of(Finding.error("$.spec_version", "Required field spec_version is missing"));
        }
        if (!node.isTextual()) {
            // already reported by the schema
            return List.of();
        }
        String declared = node.asText();
        return SemanticVersion.parse(declared)
                .map(version -> config.supports(version)
                        ? List.<Finding>of()
                        : List.of(Finding.error(
                                "$.spec_version",
                                "Unsupported spec_version " + declared + ": supported range is ["
                                        + config.minSpecVersion() + ", " + config.maxSpecVersion() + ")")))
                .orElseGet(() -> List.of(Finding.error(
                        "$.spec_version",
                        "Invalid spec_version '" + declared + "': expected MAJOR.MINOR.PATCH")));
    }

    private static JsonSchema loadSchema(String resource) {
        try (InputStream in = SpecValidator.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Bundled schema not found on classpath: " + resource);
            }
            JsonNode schemaNode = SpecReader.jsonMapper().readTree(in);
            return SCHEMA_FACTORY.getSchema(schemaNode);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load bundled schema " + resource, e);
        }
    }
}
