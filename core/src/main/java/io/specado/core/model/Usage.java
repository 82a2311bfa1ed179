package io.specado.core.model;

/** Token accounting reported by a provider. Components are null when not reported. */
public record Usage(Long promptTokens, Long completionTokens, Long totalTokens) {

    /** Builds usage from prompt and completion counts, deriving the total when both are known. */
    public static Usage of(Long promptTokens, Long completionTokens, Long totalTokens) {
        Long total = totalTokens;
        if (total == null && promptTokens != null && completionTokens != null) {
            total = promptTokens + completionTokens;
        }
        return new Usage(promptTokens, completionTokens, total);
    }
}
