package io.specado.core.translate;

import io.specado.core.capability.ModelCapabilities;
import io.specado.core.model.Capability;
import io.specado.core.model.InputMode;
import io.specado.core.model.PromptSpec;

/**
 * Prompt features that need provider support. Declaration order is the
 * evaluation order, which is also the order of emitted diagnostics.
 */
public enum Feature {
    MULTI_TURN_MESSAGES("multi_turn_messages") {
        @Override
        boolean isRequestedBy(PromptSpec prompt) {
            return prompt.isConversation();
        }

        @Override
        boolean isSupportedBy(ModelCapabilities model) {
            return model.supports(InputMode.MESSAGES);
        }
    },
    IMAGES("images") {
        @Override
        boolean isRequestedBy(PromptSpec prompt) {
            return prompt.requestsImages();
        }

        @Override
        boolean isSupportedBy(ModelCapabilities model) {
            return model.supports(InputMode.IMAGES);
        }
    },
    TOOLS("tools") {
        @Override
        boolean isRequestedBy(PromptSpec prompt) {
            return prompt.hasTools();
        }

        @Override
        boolean isSupportedBy(ModelCapabilities model) {
            return model.model().toolsSupported();
        }
    },
    RESPONSE_FORMAT("response_format") {
        @Override
        boolean isRequestedBy(PromptSpec prompt) {
            return prompt.requestsStructuredOutput();
        }

        @Override
        boolean isSupportedBy(ModelCapabilities model) {
            return model.model().jsonNativeParam();
        }
    },
    STREAMING("streaming") {
        @Override
        boolean isRequestedBy(PromptSpec prompt) {
            return prompt.stream();
        }

        @Override
        boolean isSupportedBy(ModelCapabilities model) {
            return model.supports(Capability.STREAMING_CHAT_COMPLETION);
        }
    };

    private final String wireName;

    Feature(String wireName) {
        this.wireName = wireName;
    }

    /** Name used in diagnostics and capability-mismatch errors. */
    public String wireName() {
        return wireName;
    }

    abstract boolean isRequestedBy(PromptSpec prompt);

    abstract boolean isSupportedBy(ModelCapabilities model);
}
