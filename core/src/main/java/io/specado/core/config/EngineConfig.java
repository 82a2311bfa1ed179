package io.specado.core.config;

import io.specado.core.model.SemanticVersion;
import java.time.Duration;
import java.util.Objects;

/**
 * Engine configuration.
 *
 * <p>
 * Every field has a default. Use {@link #builder()} to override selected
 * values, or {@link ConfigLoader} to read them from YAML and the environment.
 *
 * @param minSpecVersion lowest supported spec version, inclusive
 * @param maxSpecVersion first unsupported spec version, exclusive
 * @param defaultTimeout wall-clock bound for {@code run} when the caller
 *                       passes no timeout
 * @param connectTimeout TCP connect timeout for provider connections
 */
public record EngineConfig(
        SemanticVersion minSpecVersion,
        SemanticVersion maxSpecVersion,
        Duration defaultTimeout,
        Duration connectTimeout) {

    public static final SemanticVersion DEFAULT_MIN_SPEC_VERSION = new SemanticVersion(1, 0, 0);
    public static final SemanticVersion DEFAULT_MAX_SPEC_VERSION = new SemanticVersion(2, 0, 0);
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    public EngineConfig {
        Objects.requireNonNull(minSpecVersion, "minSpecVersion must not be null");
        Objects.requireNonNull(maxSpecVersion, "maxSpecVersion must not be null");
        Objects.requireNonNull(defaultTimeout, "defaultTimeout must not be null");
        Objects.requireNonNull(connectTimeout, "connectTimeout must not be null");
        if (minSpecVersion.compareTo(maxSpecVersion) >= 0) {
            throw new IllegalArgumentException("Supported spec version range is empty: [" + minSpecVersion + ", "
                    + maxSpecVersion + ")");
        }
        if (defaultTimeout.isNegative() || defaultTimeout.isZero()) {
            throw new IllegalArgumentException("defaultTimeout must be positive");
        }
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
    }

    /** Configuration with every default applied. */
    public static EngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns {@code true} if {@code version} lies in {@code [min, max)}. */
    public boolean supports(SemanticVersion version) {
        return version.compareTo(minSpecVersion) >= 0 && version.compareTo(maxSpecVersion) < 0;
    }

    /** Builder for {@link EngineConfig}, pre-populated with the defaults. */
    public static final class Builder {
        private SemanticVersion minSpecVersion = DEFAULT_MIN_SPEC_VERSION;
        private SemanticVersion maxSpecVersion = DEFAULT_MAX_SPEC_VERSION;
        private Duration defaultTimeout = DEFAULT_TIMEOUT;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;

        Builder() {}

        public Builder minSpecVersion(SemanticVersion minSpecVersion) {
            this.minSpecVersion = minSpecVersion;
            return this;
        }

        public Builder maxSpecVersion(SemanticVersion maxSpecVersion) {
            this.maxSpecVersion = maxSpecVersion;
            return this;
        }

        public Builder defaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(minSpecVersion, maxSpecVersion, defaultTimeout, connectTimeout);
        }
    }
}
