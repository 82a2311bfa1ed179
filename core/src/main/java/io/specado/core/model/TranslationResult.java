package io.specado.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Output of a translation: the provider request plus the degradations
 * applied to produce it, in evaluation order.
 */
public record TranslationResult(ProviderRequest request, List<Diagnostic> diagnostics, TranslationMode mode) {

    public TranslationResult {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }

    /** Returns {@code true} if the request carries every requested feature. */
    public boolean isLossless() {
        return diagnostics.isEmpty();
    }
}
