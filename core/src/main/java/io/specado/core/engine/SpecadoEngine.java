package io.specado.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.specado.core.capability.CapabilityResolver;
import io.specado.core.capability.ModelCapabilities;
import io.specado.core.config.EngineConfig;
import io.specado.core.error.ErrorClassifier;
import io.specado.core.error.ErrorKind;
import io.specado.core.error.InvalidOptionException;
import io.specado.core.error.Outcome;
import io.specado.core.error.SpecadoException;
import io.specado.core.execution.ExecutionClient;
import io.specado.core.execution.ResponseNormalizer;
import io.specado.core.model.ExecutionOutcome;
import io.specado.core.model.PromptSpec;
import io.specado.core.model.ProviderRequest;
import io.specado.core.model.ProviderSpec;
import io.specado.core.model.SpecKind;
import io.specado.core.model.TranslationMode;
import io.specado.core.model.TranslationResult;
import io.specado.core.model.UniformResponse;
import io.specado.core.model.ValidationMode;
import io.specado.core.model.ValidationReport;
import io.specado.core.spec.DocumentWriter;
import io.specado.core.spec.RequestDocumentParser;
import io.specado.core.spec.SpecParser;
import io.specado.core.spec.SpecReader;
import io.specado.core.translate.Translator;
import io.specado.core.validation.SpecValidator;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the engine: translate, run, validate and normalize over
 * structured text, given as strings or as UTF-8 bytes.
 *
 * <p>
 * Every operation returns exactly one {@link Outcome}. Expected failures
 * (bad input, unknown model, provider errors) come back as classified
 * failures; unexpected runtime failures are logged at error level and
 * reported as {@link ErrorKind#INTERNAL_ERROR} unless a more specific kind
 * applies. No operation throws for any input.
 *
 * <p>
 * Stateless and safe for concurrent use. Only {@link #run} blocks.
 */
public final class SpecadoEngine {

    private static final Logger LOG = LoggerFactory.getLogger(SpecadoEngine.class);

    private final SpecParser parser;
    private final SpecValidator validator;
    private final CapabilityResolver resolver;
    private final Translator translator;
    private final ExecutionClient executionClient;
    private final ResponseNormalizer normalizer;
    private final RequestDocumentParser requestParser;
    private final DocumentWriter writer;

    /** Creates an engine with the default configuration. */
    public SpecadoEngine() {
        this(EngineConfig.defaults());
    }

    public SpecadoEngine(EngineConfig config) {
        this(config, System::getenv);
    }

    /**
     * Creates an engine.
     *
     * @param config    engine configuration
     * @param envLookup resolves {@code ${ENV:NAME}} header references at send
     *                  time
     */
    public SpecadoEngine(EngineConfig config, Function<String, String> envLookup) {
        this(
                new SpecParser(),
                new SpecValidator(config),
                new CapabilityResolver(),
                new Translator(),
                new ExecutionClient(config, envLookup),
                new ResponseNormalizer());
    }

    SpecadoEngine(
            SpecParser parser,
            SpecValidator validator,
            CapabilityResolver resolver,
            Translator translator,
            ExecutionClient executionClient,
            ResponseNormalizer normalizer) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.translator = Objects.requireNonNull(translator, "translator must not be null");
        this.executionClient = Objects.requireNonNull(executionClient, "executionClient must not be null");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
        this.requestParser = new RequestDocumentParser();
        this.writer = new DocumentWriter();
    }

    /**
     * Translates a prompt spec into a request for one provider model.
     *
     * @param promptSpecText   prompt spec JSON
     * @param providerSpecText provider spec JSON
     * @param modelId          model id or alias
     * @param mode             {@code standard} or {@code strict}
     * @return the serialized translation result on success
     */
    public Outcome<String> translate(String promptSpecText, String providerSpecText, String modelId, String mode) {
        return guard("translate", () -> {
            requireArgument(promptSpecText, "prompt spec");
            requireArgument(providerSpecText, "provider spec");
            requireArgument(modelId, "model id");
            requireArgument(mode, "mode");
            TranslationMode translationMode = TranslationMode.fromWire(normalizeOption(mode))
                    .orElseThrow(() -> new InvalidOptionException(
                            "Unknown translation mode '" + mode + "' (expected standard or strict)"));
            PromptSpec prompt = parser.parsePrompt(promptSpecText);
            ProviderSpec provider = parser.parseProvider(providerSpecText);
            ModelCapabilities model = resolver.resolve(provider, modelId);
            TranslationResult result = translator.translate(prompt, model, translationMode);
            return Outcome.success(writer.write(result));
        });
    }

    /**
     * Translates UTF-8 encoded prompt and provider specs. Input that is not
     * valid UTF-8 fails with {@link ErrorKind#UTF8_ERROR}.
     */
    public Outcome<String> translate(byte[] promptSpec, byte[] providerSpec, String modelId, String mode) {
        return guard("translate", () -> {
            requireArgument(promptSpec, "prompt spec");
            requireArgument(providerSpec, "provider spec");
            return translate(SpecReader.decode(promptSpec), SpecReader.decode(providerSpec), modelId, mode);
        });
    }

    /**
     * Sends a translated request and returns the raw provider response.
     *
     * @param providerRequestText translation result or bare request JSON
     * @param timeoutSeconds      wall-clock bound, {@code 0} for the
     *                            configured default
     * @return the raw response body on success
     */
    public Outcome<String> run(String providerRequestText, long timeoutSeconds) {
        return guard("run", () -> {
            requireArgument(providerRequestText, "provider request");
            if (timeoutSeconds < 0) {
                return Outcome.failure(
                        ErrorKind.INVALID_INPUT, "timeout_seconds must not be negative, got " + timeoutSeconds);
            }
            ProviderRequest request = requestParser.parse(providerRequestText);
            ExecutionOutcome outcome = executionClient.execute(request, Duration.ofSeconds(timeoutSeconds));
            return outcome.isSuccess()
                    ? Outcome.success(outcome.payload())
                    : Outcome.failure(outcome.kind(), outcome.message());
        });
    }

    /** Runs a UTF-8 encoded request document. */
    public Outcome<String> run(byte[] providerRequest, long timeoutSeconds) {
        return guard("run", () -> {
            requireArgument(providerRequest, "provider request");
            return run(SpecReader.decode(providerRequest), timeoutSeconds);
        });
    }

    /**
     * Validates a spec document.
     *
     * @param specText spec JSON
     * @param specType {@code prompt_spec} or {@code provider_spec}
     * @param mode     {@code basic}, {@code partial} or {@code strict}
     * @return the serialized validation report on success, also when the
     *         document is invalid
     */
    public Outcome<String> validate(String specText, String specType, String mode) {
        return guard("validate", () -> {
            requireArgument(specText, "spec");
            requireArgument(specType, "spec type");
            requireArgument(mode, "mode");
            SpecKind kind = SpecKind.fromWire(normalizeOption(specType))
                    .orElseThrow(() -> new InvalidOptionException(
                            "Unknown spec type '" + specType + "' (expected prompt_spec or provider_spec)"));
            ValidationMode validationMode = ValidationMode.fromWire(normalizeOption(mode))
                    .orElseThrow(() -> new InvalidOptionException(
                            "Unknown validation mode '" + mode + "' (expected basic, partial or strict)"));
            ValidationReport report = validator.validate(specText, kind, validationMode);
            return Outcome.success(writer.write(report));
        });
    }

    /** Validates a UTF-8 encoded spec document. */
    public Outcome<String> validate(byte[] spec, String specType, String mode) {
        return guard("validate", () -> {
            requireArgument(spec, "spec");
            return validate(SpecReader.decode(spec), specType, mode);
        });
    }

    /**
     * Reduces a provider response to the uniform response shape.
     *
     * @param responseText     raw provider response JSON
     * @param providerSpecText provider spec JSON
     * @param modelId          model id or alias that produced the response
     * @return the serialized uniform response on success
     */
    public Outcome<String> normalize(String responseText, String providerSpecText, String modelId) {
        return guard("normalize", () -> {
            requireArgument(responseText, "response");
            requireArgument(providerSpecText, "provider spec");
            requireArgument(modelId, "model id");
            JsonNode response = SpecReader.readJson(responseText);
            ModelCapabilities model = resolver.resolve(parser.parseProvider(providerSpecText), modelId);
            UniformResponse uniform = normalizer.normalize(response, model);
            return Outcome.success(writer.write(uniform));
        });
    }

    /** Normalizes a UTF-8 encoded provider response. */
    public Outcome<String> normalize(byte[] response, byte[] providerSpec, String modelId) {
        return guard("normalize", () -> {
            requireArgument(response, "response");
            requireArgument(providerSpec, "provider spec");
            return normalize(SpecReader.decode(response), SpecReader.decode(providerSpec), modelId);
        });
    }

    private <T> Outcome<T> guard(String operation, Supplier<Outcome<T>> body) {
        try {
            return body.get();
        } catch (MissingArgumentException e) {
            return Outcome.failure(ErrorKind.NULL_POINTER, e.getMessage());
        } catch (SpecadoException e) {
            LOG.debug("{} failed with {}: {}", operation, e.kind(), e.getMessage());
            return Outcome.failure(e);
        } catch (RuntimeException e) {
            ErrorKind kind = ErrorClassifier.classify(e);
            if (kind == ErrorKind.UNKNOWN) {
                kind = ErrorKind.INTERNAL_ERROR;
            }
            LOG.error("Unexpected failure in {} ({})", operation, kind, e);
            return Outcome.failure(kind, operation + " failed: " + describe(e));
        } catch (OutOfMemoryError e) {
            LOG.error("Out of memory in {}", operation, e);
            return Outcome.failure(ErrorKind.MEMORY_ERROR, operation + " ran out of memory");
        }
    }

    private static void requireArgument(Object value, String name) {
        if (value == null) {
            throw new MissingArgumentException(name + " must not be null");
        }
    }

    private static String normalizeOption(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /** Signals a null argument; reported as {@link ErrorKind#NULL_POINTER}. */
    private static final class MissingArgumentException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        MissingArgumentException(String message) {
            super(message);
        }
    }
}
