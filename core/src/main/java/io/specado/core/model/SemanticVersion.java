package io.specado.core.model;

import java.util.Comparator;
import java.util.Optional;

/**
 * {@code MAJOR.MINOR.PATCH} version. A leading {@code v} is accepted;
 * pre-release and build suffixes are ignored when parsing.
 */
public record SemanticVersion(int major, int minor, int patch) implements Comparable<SemanticVersion> {

    private static final Comparator<SemanticVersion> ORDER = Comparator.comparingInt(SemanticVersion::major)
            .thenComparingInt(SemanticVersion::minor)
            .thenComparingInt(SemanticVersion::patch);

    public SemanticVersion {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("version components must not be negative");
        }
    }

    /**
     * Parses a version string.
     *
     * @param text e.g. {@code 1.2.3}, {@code v1.2.3-beta+42}
     * @return the version, or empty if {@code text} is not a three-part
     *         numeric version
     */
    public static Optional<SemanticVersion> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String core = text.trim();
        if (core.startsWith("v") || core.startsWith("V")) {
            core = core.substring(1);
        }
        int cut = indexOfAny(core, '-', '+');
        if (cut >= 0) {
            core = core.substring(0, cut);
        }
        String[] parts = core.split("\\.", -1);
        if (parts.length != 3) {
            return Optional.empty();
        }
        try {
            return Optional.of(new SemanticVersion(
                    parseComponent(parts[0]), parseComponent(parts[1]), parseComponent(parts[2])));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    @Override
    public int compareTo(SemanticVersion other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }

    private static int parseComponent(String part) {
        if (part.isEmpty() || !part.chars().allMatch(Character::isDigit)) {
            throw new IllegalArgumentException("not a numeric version component: " + part);
        }
        return Integer.parseInt(part);
    }

    private static int indexOfAny(String s, char a, char b) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == a || c == b) {
                return i;
            }
        }
        return -1;
    }
}
