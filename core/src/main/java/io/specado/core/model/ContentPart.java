package io.specado.core.model;

import java.util.Objects;

/**
 * One part of a message's content: either text or an image reference.
 *
 * @param type      part type
 * @param text      text content, set for {@link Type#TEXT}
 * @param url       image URL or {@code data:} URI, set for {@link Type#IMAGE}
 * @param mediaType optional image media type (e.g. {@code image/png})
 */
public record ContentPart(Type type, String text, String url, String mediaType) {

    /** Content part discriminator. */
    public enum Type {
        TEXT,
        IMAGE
    }

    public ContentPart {
        Objects.requireNonNull(type, "content part type must not be null");
        if (type == Type.TEXT) {
            Objects.requireNonNull(text, "text part must carry text");
        } else {
            Objects.requireNonNull(url, "image part must carry a url");
        }
    }

    public static ContentPart text(String text) {
        return new ContentPart(Type.TEXT, text, null, null);
    }

    public static ContentPart image(String url, String mediaType) {
        return new ContentPart(Type.IMAGE, null, url, mediaType);
    }

    public boolean isImage() {
        return type == Type.IMAGE;
    }
}
