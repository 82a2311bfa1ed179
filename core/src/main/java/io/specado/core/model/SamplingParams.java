package io.specado.core.model;

/**
 * Optional sampling parameters of a prompt. Every component may be
 * {@code null}; only set values are forwarded to the provider.
 */
public record SamplingParams(
        Double temperature,
        Double topP,
        Integer topK,
        Double frequencyPenalty,
        Double presencePenalty,
        Long seed) {

    public static final SamplingParams NONE = new SamplingParams(null, null, null, null, null, null);

    public boolean isEmpty() {
        return temperature == null
                && topP == null
                && topK == null
                && frequencyPenalty == null
                && presencePenalty == null
                && seed == null;
    }
}
