package io.specado.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.specado.core.model.SemanticVersion;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.function.Consumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link EngineConfig} from a YAML file with an environment variable
 * overlay.
 *
 * <p>
 * File layout:
 *
 * <pre>
 * spec-versions:
 *   min: 1.0.0
 *   max: 2.0.0
 * execution:
 *   default-timeout-seconds: 60
 *   connect-timeout-seconds: 10
 * </pre>
 *
 * <p>
 * Environment variables take precedence over YAML values. A variable counts
 * as set only when it is defined and its trimmed value is non-empty.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final String ENV_MIN_SPEC_VERSION = "SPECADO_MIN_SPEC_VERSION";
    static final String ENV_MAX_SPEC_VERSION = "SPECADO_MAX_SPEC_VERSION";
    static final String ENV_DEFAULT_TIMEOUT_SECONDS = "SPECADO_DEFAULT_TIMEOUT_SECONDS";
    static final String ENV_CONNECT_TIMEOUT_SECONDS = "SPECADO_CONNECT_TIMEOUT_SECONDS";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from {@code configPath}, applying overrides from
     * {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static EngineConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from {@code configPath}, applying overrides from the
     * supplied lookup. The lookup returns {@code null} for undefined variables.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static EngineConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        EngineConfig config = build(root, envLookup);
        LOG.debug("Loaded engine configuration from {}: {}", configPath, config);
        return config;
    }

    /**
     * Builds configuration from defaults and the environment only.
     *
     * @throws ConfigLoadException if an environment value is invalid
     */
    public static EngineConfig fromEnvironment(Function<String, String> envLookup) {
        return build(null, envLookup);
    }

    private static EngineConfig build(JsonNode root, Function<String, String> envLookup) {
        EngineConfig.Builder builder = EngineConfig.builder();

        if (root != null && !root.isMissingNode() && !root.isNull()) {
            JsonNode versions = root.path("spec-versions");
            if (versions.has("min")) {
                builder.minSpecVersion(version(versions.get("min").asText(), "spec-versions.min"));
            }
            if (versions.has("max")) {
                builder.maxSpecVersion(version(versions.get("max").asText(), "spec-versions.max"));
            }
            JsonNode execution = root.path("execution");
            if (execution.has("default-timeout-seconds")) {
                builder.defaultTimeout(seconds(
                        execution.get("default-timeout-seconds").asText(), "execution.default-timeout-seconds"));
            }
            if (execution.has("connect-timeout-seconds")) {
                builder.connectTimeout(seconds(
                        execution.get("connect-timeout-seconds").asText(), "execution.connect-timeout-seconds"));
            }
        }

        env(envLookup, ENV_MIN_SPEC_VERSION, v -> builder.minSpecVersion(version(v, ENV_MIN_SPEC_VERSION)));
        env(envLookup, ENV_MAX_SPEC_VERSION, v -> builder.maxSpecVersion(version(v, ENV_MAX_SPEC_VERSION)));
        env(envLookup, ENV_DEFAULT_TIMEOUT_SECONDS, v -> builder.defaultTimeout(seconds(v, ENV_DEFAULT_TIMEOUT_SECONDS)));
        env(envLookup, ENV_CONNECT_TIMEOUT_SECONDS, v -> builder.connectTimeout(seconds(v, ENV_CONNECT_TIMEOUT_SECONDS)));

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid engine configuration: " + e.getMessage(), e);
        }
    }

    /** Applies an env var override if set. */
    private static void env(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        String value = envLookup.apply(envVar);
        if (value != null && !value.trim().isEmpty()) {
            setter.accept(value.trim());
        }
    }

    private static SemanticVersion version(String text, String source) {
        return SemanticVersion.parse(text)
                .orElseThrow(() ->
                        new ConfigLoadException("Invalid version for " + source + ": '" + text + "'"));
    }

    private static Duration seconds(String text, String source) {
        try {
            long value = Long.parseLong(text.trim());
            if (value <= 0) {
                throw new ConfigLoadException("Timeout for " + source + " must be positive, got " + value);
            }
            return Duration.ofSeconds(value);
        } catch (NumberFormatException e) {
            throw new ConfigLoadException("Invalid number of seconds for " + source + ": '" + text + "'", e);
        }
    }
}
