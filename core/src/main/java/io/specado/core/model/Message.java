package io.specado.core.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A role-tagged conversation message.
 *
 * @param role    the speaker
 * @param content ordered content parts, never empty
 * @param name    optional participant name
 */
public record Message(Role role, List<ContentPart> content, String name) {

    public Message {
        Objects.requireNonNull(role, "role must not be null");
        content = content != null ? List.copyOf(content) : List.of();
    }

    /** Creates a plain text message. */
    public static Message of(Role role, String text) {
        return new Message(role, List.of(ContentPart.text(text)), null);
    }

    public boolean hasImages() {
        return content.stream().anyMatch(ContentPart::isImage);
    }

    /** Concatenated text of all text parts, separated by newlines. */
    public String text() {
        return content.stream()
                .filter(p -> !p.isImage())
                .map(ContentPart::text)
                .collect(Collectors.joining("\n"));
    }

    /** Returns a copy of this message with image parts removed. */
    public Message withoutImages() {
        List<ContentPart> textOnly =
                content.stream().filter(p -> !p.isImage()).collect(Collectors.toList());
        return new Message(role, textOnly, name);
    }
}
