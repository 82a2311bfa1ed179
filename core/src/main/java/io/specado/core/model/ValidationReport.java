package io.specado.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Ordered findings produced by validating one document. The document is
 * accepted for its mode iff no finding has error severity.
 *
 * @param kind     the declared document kind
 * @param mode     the validation mode applied
 * @param findings findings in deterministic order
 */
public record ValidationReport(SpecKind kind, ValidationMode mode, List<Finding> findings) {

    public ValidationReport {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        findings = findings != null ? List.copyOf(findings) : List.of();
    }

    public boolean isValid() {
        return findings.stream().noneMatch(Finding::isError);
    }

    public List<Finding> errors() {
        return findings.stream().filter(Finding::isError).toList();
    }

    public List<Finding> warnings() {
        return findings.stream().filter(f -> !f.isError()).toList();
    }
}
