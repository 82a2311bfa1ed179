package io.specado.core.translate;

import com.fasterxml.jackson.databind.JsonNode;
import io.specado.core.model.ContentPart;
import io.specado.core.model.Message;
import io.specado.core.model.PromptSpec;
import io.specado.core.model.ResponseFormat;
import io.specado.core.model.ToolDefinition;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable working copy of the prompt parts that degradation policies may
 * change. Confined to a single translation call.
 */
final class TranslationDraft {

    final List<Message> messages;
    final List<ContentPart> inputImages;
    final List<ToolDefinition> tools;
    JsonNode toolChoice;
    ResponseFormat responseFormat;
    boolean stream;

    TranslationDraft(PromptSpec prompt) {
        this.messages = new ArrayList<>(prompt.messages());
        this.inputImages = new ArrayList<>(prompt.inputImages());
        this.tools = new ArrayList<>(prompt.tools());
        this.toolChoice = prompt.toolChoice();
        this.responseFormat = prompt.responseFormat();
        this.stream = prompt.stream();
    }

    /** Number of image parts across messages and attached images. */
    int imageCount() {
        int count = inputImages.size();
        for (Message message : messages) {
            count += (int) message.content().stream().filter(ContentPart::isImage).count();
        }
        return count;
    }
}
