package io.specado.core.model;

import java.util.List;

/**
 * Request constraints a model imposes on prompts, checked before a prompt is
 * mapped onto the model.
 *
 * @param mutuallyExclusive    groups of prompt fields of which at most one
 *                             may be present
 * @param maxSystemPromptBytes UTF-8 size limit per system message, may be null
 * @param maxToolSchemaBytes   serialized size limit per tool parameter
 *                             schema, may be null
 */
public record ModelConstraints(
        List<List<String>> mutuallyExclusive, Integer maxSystemPromptBytes, Integer maxToolSchemaBytes) {

    public static final ModelConstraints NONE = new ModelConstraints(List.of(), null, null);

    public ModelConstraints {
        mutuallyExclusive = mutuallyExclusive != null
                ? mutuallyExclusive.stream().map(List::copyOf).toList()
                : List.of();
    }
}
