package io.specado.core.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import io.specado.core.Fixtures;
import io.specado.core.config.EngineConfig;
import io.specado.core.error.MalformedSpecException;
import io.specado.core.model.Finding;
import io.specado.core.model.SemanticVersion;
import io.specado.core.model.Severity;
import io.specado.core.model.SpecKind;
import io.specado.core.model.ValidationMode;
import io.specado.core.model.ValidationReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

/**
 * Tests for {@link SpecValidator}. Each mode adds checks on top of the
 * previous one; all modes share the bundled JSON Schemas.
 */
class SpecValidatorTest {

    private final SpecValidator validator = new SpecValidator();

    @Nested
    @DisplayName("Prompt specs")
    class PromptSpecs {

        @ParameterizedTest
        @EnumSource(ValidationMode.class)
        void fixturesAreValidInEveryMode(ValidationMode mode) {
            assertThat(validate(Fixtures.read(Fixtures.BASIC_PROMPT), mode).findings()).isEmpty();
            assertThat(validate(Fixtures.read(Fixtures.RICH_PROMPT), mode).findings()).isEmpty();
        }

        @Test
        void basicReportsSchemaViolations() {
            ValidationReport report = validate("{\"messages\": [{\"role\": \"robot\", \"content\": 5}]}",
                    ValidationMode.BASIC);

            assertThat(report.isValid()).isFalse();
            assertThat(report.errors()).extracting(Finding::path).allMatch(path -> path.startsWith("$.messages[0]"));
        }

        @Test
        void basicReportsMissingMessages() {
            ValidationReport report = validate("{\"id\": \"x\"}", ValidationMode.BASIC);

            assertThat(report.errors()).hasSize(1);
            assertThat(report.errors().get(0).message()).contains("messages");
        }

        @Test
        void basicNeverChecksVersionOrCrossReferences() {
            ValidationReport report = validate("""
                    {"messages": [{"role": "user", "content": "Hi"}], "tool_choice": "auto"}
                    """, ValidationMode.BASIC);

            assertThat(report.isValid()).isTrue();
        }

        @Test
        void partialRequiresToolsForToolChoice() {
            ValidationReport report = validate("""
                    {"messages": [{"role": "user", "content": "Hi"}], "tool_choice": "auto"}
                    """, ValidationMode.PARTIAL);

            assertThat(report.errors()).singleElement()
                    .extracting(Finding::message)
                    .isEqualTo("tool_choice requires tools array to be defined and non-empty");
        }

        @Test
        void partialRejectsUndeclaredToolChoice() {
            ValidationReport report = validate("""
                    {"messages": [{"role": "user", "content": "Hi"}],
                     "tools": [{"name": "search"}], "tool_choice": {"name": "lookup"}}
                    """, ValidationMode.PARTIAL);

            assertThat(report.errors()).extracting(Finding::message)
                    .containsExactly("tool_choice references undeclared tool 'lookup'");
        }

        @Test
        void partialWarnsOnNonLeadingSystemMessage() {
            ValidationReport report = validate("""
                    {"messages": [{"role": "user", "content": "Hi"}, {"role": "system", "content": "Late"}]}
                    """, ValidationMode.PARTIAL);

            assertThat(report.isValid()).isTrue();
            assertThat(report.warnings()).extracting(Finding::path).containsExactly("$.messages[1].role");
        }

        @Test
        void partialChecksModelClassRules() {
            ValidationReport report = validate("""
                    {"model_class": "Chat", "messages": [{"role": "user", "content": "Hi"}],
                     "limits": {"reasoning_tokens": 100}, "rag": {"k": 3}}
                    """, ValidationMode.PARTIAL);

            assertThat(report.errors()).extracting(Finding::path)
                    .containsExactly("$.limits.reasoning_tokens", "$.rag");
        }

        @Test
        void partialWarnsOnUnusualSampling() {
            ValidationReport report = validate("""
                    {"messages": [{"role": "user", "content": "Hi"}], "sampling": {"temperature": 3.5}}
                    """, ValidationMode.PARTIAL);

            assertThat(report.isValid()).isTrue();
            assertThat(report.warnings()).extracting(Finding::severity).containsExactly(Severity.WARNING);
        }

        @Test
        void strictRequiresSpecVersion() {
            ValidationReport report = validate("""
                    {"id": "p", "model_class": "Chat", "messages": [{"role": "user", "content": "Hi"}]}
                    """, ValidationMode.STRICT);

            assertThat(report.errors()).singleElement().satisfies(finding -> {
                assertThat(finding.path()).isEqualTo("$.spec_version");
                assertThat(finding.message()).isEqualTo("Required field spec_version is missing");
            });
        }

        @Test
        void strictRejectsUnsupportedSpecVersion() {
            ValidationReport report = validate("""
                    {"spec_version": "2.0.0", "id": "p", "model_class": "Chat",
                     "messages": [{"role": "user", "content": "Hi"}]}
                    """, ValidationMode.STRICT);

            assertThat(report.errors()).extracting(Finding::message)
                    .containsExactly("Unsupported spec_version 2.0.0: supported range is [1.0.0, 2.0.0)");
        }

        @Test
        void strictRejectsMalformedSpecVersion() {
            ValidationReport report = validate("""
                    {"spec_version": "1.0", "id": "p", "model_class": "Chat",
                     "messages": [{"role": "user", "content": "Hi"}]}
                    """, ValidationMode.STRICT);

            assertThat(report.errors()).extracting(Finding::message)
                    .containsExactly("Invalid spec_version '1.0': expected MAJOR.MINOR.PATCH");
        }

        @Test
        void strictRejectsUnknownFields() {
            ValidationReport report = validate("""
                    {"spec_version": "1.0.0", "id": "p", "model_class": "Chat",
                     "messages": [{"role": "user", "content": "Hi"}], "temprature": 0.5}
                    """, ValidationMode.STRICT);

            assertThat(report.errors()).extracting(Finding::message)
                    .containsExactly("Unknown field 'temprature' not allowed in strict mode");
        }

        @Test
        void strictIncludesPartialFindings() {
            ValidationReport report = validate("""
                    {"spec_version": "1.0.0", "id": "p", "model_class": "Chat",
                     "messages": [{"role": "user", "content": "Hi"}], "tool_choice": "auto"}
                    """, ValidationMode.STRICT);

            assertThat(report.errors()).extracting(Finding::path).containsExactly("$.tool_choice");
        }

        @Test
        void configuredVersionRangeIsHonoured() {
            EngineConfig config = EngineConfig.builder()
                    .minSpecVersion(new SemanticVersion(1, 0, 0))
                    .maxSpecVersion(new SemanticVersion(3, 0, 0))
                    .build();
            ValidationReport report = new SpecValidator(config).validate("""
                    {"spec_version": "2.1.0", "id": "p", "model_class": "Chat",
                     "messages": [{"role": "user", "content": "Hi"}]}
                    """, SpecKind.PROMPT_SPEC, ValidationMode.STRICT);

            assertThat(report.isValid()).isTrue();
        }

        @Test
        void sameInputSameReport() {
            String text = "{\"messages\": [{\"role\": 1, \"content\": []}], \"stream\": \"yes\"}";

            assertThat(validate(text, ValidationMode.STRICT)).isEqualTo(validate(text, ValidationMode.STRICT));
        }

        @Test
        void malformedJsonIsNotAReport() {
            assertThatThrownBy(() -> validate("{\"messages\": [", ValidationMode.BASIC))
                    .isInstanceOf(MalformedSpecException.class);
        }

        private ValidationReport validate(String text, ValidationMode mode) {
            return validator.validate(text, SpecKind.PROMPT_SPEC, mode);
        }
    }

    @Nested
    @DisplayName("Provider specs")
    class ProviderSpecs {

        @ParameterizedTest
        @EnumSource(ValidationMode.class)
        void fixturesAreValidInEveryMode(ValidationMode mode) {
            assertThat(validate(Fixtures.read(Fixtures.OPENAI_PROVIDER), mode).findings()).isEmpty();
            assertThat(validate(Fixtures.read(Fixtures.ANTHROPIC_PROVIDER), mode).findings()).isEmpty();
        }

        @Test
        void basicRequiresProviderAndModels() {
            ValidationReport report = validate("{\"provider\": {\"name\": \"p\"}}", ValidationMode.BASIC);

            assertThat(report.errors()).hasSize(2);
        }

        @Test
        void partialRequiresChatCompletion() {
            ValidationReport report = validate("""
                    {"provider": {"name": "p", "base_url": "https://p.example"},
                     "models": [{"id": "m", "endpoints": {
                        "streaming_chat_completion": {"path": "/chat", "protocol": "sse"}}}]}
                    """, ValidationMode.PARTIAL);

            assertThat(report.errors()).extracting(Finding::path, Finding::message)
                    .containsExactly(tuple(
                            "$.models[0].endpoints", "Model must declare a chat_completion endpoint"));
        }

        @Test
        void partialWarnsOnLiteralCredentials() {
            ValidationReport report = validate("""
                    {"provider": {"name": "p", "base_url": "https://p.example",
                                  "headers": {"Authorization": "Bearer sk-literal"}},
                     "models": [{"id": "m", "endpoints": {"chat_completion": {"path": "/chat"}}}]}
                    """, ValidationMode.PARTIAL);

            assertThat(report.isValid()).isTrue();
            assertThat(report.warnings()).extracting(Finding::path)
                    .containsExactly("$.provider.headers.Authorization");
        }

        @Test
        void partialRejectsAliasCollisions() {
            ValidationReport report = validate("""
                    {"provider": {"name": "p", "base_url": "https://p.example"},
                     "models": [
                       {"id": "a", "endpoints": {"chat_completion": {"path": "/chat"}}},
                       {"id": "b", "aliases": ["a"], "endpoints": {"chat_completion": {"path": "/chat"}}}]}
                    """, ValidationMode.PARTIAL);

            assertThat(report.errors()).extracting(Finding::message)
                    .containsExactly("Alias 'a' collides with model id at $.models[0]");
        }

        @Test
        void partialRejectsRelativeBaseUrl() {
            ValidationReport report = validate("""
                    {"provider": {"name": "p", "base_url": "p.example/v1"},
                     "models": [{"id": "m", "endpoints": {"chat_completion": {"path": "chat"}}}]}
                    """, ValidationMode.PARTIAL);

            assertThat(report.errors()).extracting(Finding::path)
                    .containsExactly("$.provider.base_url", "$.models[0].endpoints.chat_completion.path");
        }

        @Test
        void strictRequiresFamilyAndInputModes() {
            ValidationReport report = validate("""
                    {"spec_version": "1.0.0",
                     "provider": {"name": "p", "base_url": "https://p.example"},
                     "models": [{"id": "m", "endpoints": {"chat_completion": {"path": "/chat"}}}]}
                    """, ValidationMode.STRICT);

            assertThat(report.errors()).extracting(Finding::path)
                    .containsExactly("$.models[0].family", "$.models[0].input_modes");
        }

        private ValidationReport validate(String text, ValidationMode mode) {
            return validator.validate(text, SpecKind.PROVIDER_SPEC, mode);
        }
    }
}
