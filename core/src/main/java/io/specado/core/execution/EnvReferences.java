package io.specado.core.execution;

import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands {@code ${ENV:NAME}} references in header values.
 */
final class EnvReferences {

    private static final Pattern REFERENCE = Pattern.compile("\\$\\{ENV:([A-Za-z_][A-Za-z0-9_]*)}");

    private EnvReferences() {}

    /**
     * Replaces every reference in {@code value}.
     *
     * @return the expanded value, or empty if any referenced variable is
     *         undefined or blank
     */
    static Optional<String> expand(String value, Function<String, String> envLookup) {
        Matcher matcher = REFERENCE.matcher(value);
        StringBuilder expanded = new StringBuilder();
        while (matcher.find()) {
            String resolved = envLookup.apply(matcher.group(1));
            if (resolved == null || resolved.isBlank()) {
                return Optional.empty();
            }
            matcher.appendReplacement(expanded, Matcher.quoteReplacement(resolved));
        }
        matcher.appendTail(expanded);
        return Optional.of(expanded.toString());
    }

    /** Names of the variables referenced by {@code value}, for diagnostics. */
    static String referencedNames(String value) {
        Matcher matcher = REFERENCE.matcher(value);
        StringBuilder names = new StringBuilder();
        while (matcher.find()) {
            if (names.length() > 0) {
                names.append(", ");
            }
            names.append(matcher.group(1));
        }
        return names.toString();
    }
}
