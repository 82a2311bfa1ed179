package io.specado.core.translate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.specado.core.Fixtures;
import io.specado.core.capability.CapabilityResolver;
import io.specado.core.capability.ModelCapabilities;
import io.specado.core.error.CapabilityMismatchException;
import io.specado.core.model.PromptSpec;
import io.specado.core.model.TranslationMode;
import io.specado.core.spec.SpecParser;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.event.KeyValuePair;

/**
 * Every completed translation logs one {@code translation.completed} entry
 * carrying provider, model, mode, capability and diagnostic count as
 * key-value pairs. Rejected translations log nothing at info level.
 */
@DisplayName("TranslationLoggingTest")
class TranslationLoggingTest {

    private final SpecParser parser = new SpecParser();
    private final Translator translator = new Translator();

    private ListAppender<ILoggingEvent> logAppender;
    private Logger translatorLogger;

    @BeforeEach
    void setUp() {
        translatorLogger = (Logger) LoggerFactory.getLogger(Translator.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        translatorLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        translatorLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    @Test
    @DisplayName("Standard translation → structured entry with diagnostic count")
    void completedTranslationEmitsStructuredLog() {
        translator.translate(prompt(), model("gpt-3.5-turbo-instruct"), TranslationMode.STANDARD);

        List<ILoggingEvent> events = completedEvents();
        assertThat(events).hasSize(1);
        ILoggingEvent event = events.get(0);
        assertThat(event.getLevel()).isEqualTo(Level.INFO);

        Map<String, Object> fields = keyValues(event);
        assertThat(fields)
                .containsEntry("provider", "openai")
                .containsEntry("model", "gpt-3.5-turbo-instruct")
                .containsEntry("mode", "standard")
                .containsEntry("capability", "chat_completion")
                .containsEntry("diagnostics", 5);
    }

    @Test
    @DisplayName("Strict rejection → no completed entry")
    void rejectedTranslationLogsNothing() {
        assertThatThrownBy(() ->
                        translator.translate(prompt(), model("gpt-3.5-turbo-instruct"), TranslationMode.STRICT))
                .isInstanceOf(CapabilityMismatchException.class);

        assertThat(completedEvents()).isEmpty();
    }

    @Test
    @DisplayName("Log entry never carries header values")
    void headerValuesAreNotLogged() {
        translator.translate(prompt(), model("gpt-4o"), TranslationMode.STANDARD);

        assertThat(logAppender.list)
                .extracting(ILoggingEvent::getFormattedMessage)
                .noneMatch(message -> message.contains("OPENAI_API_KEY"));
        assertThat(keyValues(completedEvents().get(0)).values())
                .noneMatch(value -> String.valueOf(value).contains("Bearer"));
    }

    private List<ILoggingEvent> completedEvents() {
        return logAppender.list.stream()
                .filter(e -> e.getMessage().contains("translation.completed"))
                .toList();
    }

    private static Map<String, Object> keyValues(ILoggingEvent event) {
        Map<String, Object> fields = new HashMap<>();
        List<KeyValuePair> pairs = event.getKeyValuePairs();
        if (pairs != null) {
            pairs.forEach(kvp -> fields.put(kvp.key, kvp.value));
        }
        return fields;
    }

    private PromptSpec prompt() {
        return parser.parsePrompt(Fixtures.read(Fixtures.RICH_PROMPT));
    }

    private ModelCapabilities model(String modelId) {
        return new CapabilityResolver().resolve(parser.parseProvider(Fixtures.read(Fixtures.OPENAI_PROVIDER)), modelId);
    }
}
