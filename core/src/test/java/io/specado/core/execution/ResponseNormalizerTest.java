package io.specado.core.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.specado.core.Fixtures;
import io.specado.core.capability.CapabilityResolver;
import io.specado.core.capability.ModelCapabilities;
import io.specado.core.error.InvalidSpecException;
import io.specado.core.model.Role;
import io.specado.core.model.UniformResponse;
import io.specado.core.model.Usage;
import io.specado.core.spec.SpecParser;
import io.specado.core.spec.SpecReader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ResponseNormalizerTest {

    private final SpecParser parser = new SpecParser();
    private final ResponseNormalizer normalizer = new ResponseNormalizer();

    @Test
    @DisplayName("Declared paths → content and mapped finish reason")
    void declaredPaths() {
        UniformResponse response = normalize("""
                {"id": "chatcmpl-9", "model": "gpt-4o-2024-08-06",
                 "choices": [{"message": {"role": "assistant", "content": "Sunny"}, "finish_reason": "tool_calls"}],
                 "usage": {"prompt_tokens": 12, "completion_tokens": 3, "total_tokens": 15}}
                """, Fixtures.OPENAI_PROVIDER, "gpt-4o");

        assertThat(response.id()).isEqualTo("chatcmpl-9");
        assertThat(response.model()).isEqualTo("gpt-4o-2024-08-06");
        assertThat(response.role()).isEqualTo(Role.ASSISTANT);
        assertThat(response.content()).isEqualTo("Sunny");
        assertThat(response.finishReason()).isEqualTo("tool_call");
        assertThat(response.usage()).isEqualTo(new Usage(12L, 3L, 15L));
    }

    @Test
    @DisplayName("Anthropic content blocks → joined text, input/output usage")
    void contentBlocks() {
        UniformResponse response = normalize("""
                {"id": "msg_01", "type": "message", "role": "assistant",
                 "content": [{"type": "text", "text": "Hello, "}, {"type": "text", "text": "world"}],
                 "stop_reason": "end_turn", "usage": {"input_tokens": 10, "output_tokens": 2}}
                """, Fixtures.ANTHROPIC_PROVIDER, "claude-3-5-sonnet");

        assertThat(response.content()).isEqualTo("Hello, world");
        assertThat(response.finishReason()).isEqualTo("stop");
        assertThat(response.model()).isEqualTo("claude-3-5-sonnet");
        assertThat(response.usage().totalTokens()).isEqualTo(12L);
    }

    @Test
    @DisplayName("Choices shape without declared paths")
    void choicesShape() {
        UniformResponse response = normalize("""
                {"choices": [{"text": "legacy completion", "finish_reason": "length"}]}
                """, Fixtures.OPENAI_PROVIDER, "gpt-3.5-turbo-instruct");

        assertThat(response.content()).isEqualTo("legacy completion");
        assertThat(response.finishReason()).isEqualTo("length");
        assertThat(response.usage()).isNull();
    }

    @Test
    @DisplayName("Unknown shape → whole document as content")
    void rawFallback() {
        UniformResponse response = normalize("{\"output\": \"x\"}", Fixtures.ANTHROPIC_PROVIDER, "claude-3-5-sonnet");

        assertThat(response.content()).isEqualTo("{\"output\":\"x\"}");
        assertThat(response.finishReason()).isNull();
    }

    @Test
    @DisplayName("Invalid declared path → InvalidSpecException")
    void invalidDeclaredPath() {
        ModelCapabilities model = new CapabilityResolver().resolve(parser.parseProvider("""
                {"provider": {"name": "p", "base_url": "https://p.example"},
                 "models": [{"id": "m", "endpoints": {"chat_completion": {"path": "/chat"}},
                    "response_normalization": {"sync": {"content_path": "$.choices[[0"}}}]}
                """), "m");

        assertThatThrownBy(() -> normalizer.normalize(SpecReader.readJson("{}"), model))
                .isInstanceOf(InvalidSpecException.class)
                .hasMessageContaining("content_path");
    }

    @ParameterizedTest
    @CsvSource({
        "stop, stop",
        "end_turn, stop",
        "stop_sequence, stop",
        "max_tokens, length",
        "tool_use, tool_call",
        "function_call, tool_call",
        "content_filter, content_filter",
        "end_conversation, end_conversation",
        "SAFETY, other"
    })
    void finishReasonVocabulary(String raw, String expected) {
        assertThat(ResponseNormalizer.normalizeFinishReason(raw)).isEqualTo(expected);
    }

    private UniformResponse normalize(String response, String providerFixture, String modelId) {
        ModelCapabilities model =
                new CapabilityResolver().resolve(parser.parseProvider(Fixtures.read(providerFixture)), modelId);
        return normalizer.normalize(SpecReader.readJson(response), model);
    }
}
