package io.specado.core.spec;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.specado.core.model.Capability;
import io.specado.core.model.Diagnostic;
import io.specado.core.model.EndpointDescriptor;
import io.specado.core.model.Finding;
import io.specado.core.model.Protocol;
import io.specado.core.model.ProviderRequest;
import io.specado.core.model.Role;
import io.specado.core.model.SpecKind;
import io.specado.core.model.TranslationMode;
import io.specado.core.model.TranslationResult;
import io.specado.core.model.UniformResponse;
import io.specado.core.model.Usage;
import io.specado.core.model.ValidationMode;
import io.specado.core.model.ValidationReport;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DocumentWriterTest {

    private final DocumentWriter writer = new DocumentWriter();

    @Test
    void translationDocumentIsReadableByRun() {
        ObjectNode body = JsonNodeFactory.instance.objectNode().put("model", "gpt-4o");
        ProviderRequest request = new ProviderRequest(
                "openai",
                "gpt-4o",
                Capability.CHAT_COMPLETION,
                new EndpointDescriptor("POST", "/chat/completions", Protocol.HTTP, Map.of()),
                "https://api.openai.com/v1/chat/completions",
                Map.of("Content-Type", "application/json"),
                body);
        TranslationResult result = new TranslationResult(
                request,
                List.of(new Diagnostic("tools", Diagnostic.Code.DROPPED, "$.tools", "dropped 1 tool definition(s)")),
                TranslationMode.STANDARD);

        String json = writer.write(result);
        ProviderRequest reread = new RequestDocumentParser().parse(json);

        assertThat(reread.url()).isEqualTo(request.url());
        assertThat(reread.provider()).isEqualTo("openai");
        assertThat(reread.body()).isEqualTo(body);
        JsonNode diagnostic = SpecReader.readJson(json).path("diagnostics").path(0);
        assertThat(diagnostic.path("code").asText()).isEqualTo("dropped");
        assertThat(diagnostic.path("feature").asText()).isEqualTo("tools");
    }

    @Test
    void reportCountsErrorsAndWarnings() {
        ValidationReport report = new ValidationReport(
                SpecKind.PROMPT_SPEC,
                ValidationMode.PARTIAL,
                List.of(Finding.error("$.tool_choice", "bad"), Finding.warning("$.messages[2].role", "odd")));

        JsonNode tree = writer.toTree(report);

        assertThat(tree.path("kind").asText()).isEqualTo("prompt_spec");
        assertThat(tree.path("valid").asBoolean()).isFalse();
        assertThat(tree.path("errors").asInt()).isEqualTo(1);
        assertThat(tree.path("warnings").asInt()).isEqualTo(1);
        assertThat(tree.path("findings").path(1).path("severity").asText()).isEqualTo("warning");
    }

    @Test
    void responseWritesExplicitNulls() {
        JsonNode tree = writer.toTree(new UniformResponse(null, "m", Role.ASSISTANT, null, null, null));

        assertThat(tree.has("id")).isFalse();
        assertThat(tree.path("content").isNull()).isTrue();
        assertThat(tree.path("finish_reason").isNull()).isTrue();
        assertThat(tree.has("usage")).isFalse();
    }

    @Test
    void responseUsage() {
        JsonNode tree = writer.toTree(
                new UniformResponse("r1", "m", Role.ASSISTANT, "hi", "stop", Usage.of(3L, 4L, null)));

        assertThat(tree.path("usage").path("total_tokens").asLong()).isEqualTo(7);
        assertThat(tree.path("role").asText()).isEqualTo("assistant");
    }
}
