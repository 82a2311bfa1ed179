package io.specado.core;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Reads test documents from {@code src/test/resources/fixtures}. */
public final class Fixtures {

    public static final String OPENAI_PROVIDER = "openai-provider.json";
    public static final String ANTHROPIC_PROVIDER = "anthropic-provider.json";
    public static final String BASIC_PROMPT = "basic-prompt.json";
    public static final String RICH_PROMPT = "rich-prompt.json";

    private Fixtures() {}

    public static Path path(String filename) {
        return Path.of("src/test/resources/fixtures/" + filename);
    }

    public static String read(String filename) {
        try {
            return Files.readString(path(filename));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
