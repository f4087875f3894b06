package io.github.cyfko.hpl.core.validation;

import io.github.cyfko.hpl.core.api.Diagnostic;
import io.github.cyfko.hpl.core.api.DiagnosticCode;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of validating one property: every diagnostic found, in a deterministic order.
 * <p>
 * Diagnostics are ordered by pass (structural, binding, pattern sanity), then by tree order
 * within a pass. A property is accepted when the report holds no error, or, when warnings are
 * treated as errors, no diagnostic at all.
 * </p>
 *
 * <pre>{@code
 * ValidationReport report = validator.validate(property);
 * if (!report.isAccepted()) {
 *     report.getErrors().forEach(d -> System.err.println(d.message()));
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ValidationReport {

    private final List<Diagnostic> diagnostics;
    private final boolean warningsAsErrors;

    private ValidationReport(List<Diagnostic> diagnostics, boolean warningsAsErrors) {
        this.diagnostics = List.copyOf(diagnostics);
        this.warningsAsErrors = warningsAsErrors;
    }

    public static ValidationReport of(List<Diagnostic> diagnostics, boolean warningsAsErrors) {
        return new ValidationReport(Objects.requireNonNull(diagnostics, "diagnostics are required"), warningsAsErrors);
    }

    public static ValidationReport empty() {
        return new ValidationReport(List.of(), false);
    }

    /**
     * @return every diagnostic, errors and warnings, in report order
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public List<Diagnostic> getErrors() {
        return diagnostics.stream().filter(Diagnostic::isError).toList();
    }

    public List<Diagnostic> getWarnings() {
        return diagnostics.stream().filter(Diagnostic::isWarning).toList();
    }

    public boolean isAccepted() {
        return warningsAsErrors ? diagnostics.isEmpty() : getErrors().isEmpty();
    }

    public boolean isWarningsAsErrors() {
        return warningsAsErrors;
    }

    public boolean hasCode(DiagnosticCode code) {
        return diagnostics.stream().anyMatch(d -> d.code() == code);
    }

    public List<Diagnostic> withCode(DiagnosticCode code) {
        return diagnostics.stream().filter(d -> d.code() == code).toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ValidationReport other)) {
            return false;
        }
        return warningsAsErrors == other.warningsAsErrors && diagnostics.equals(other.diagnostics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(diagnostics, warningsAsErrors);
    }

    @Override
    public String toString() {
        return "ValidationReport[accepted=" + isAccepted()
                + ", errors=" + getErrors().size()
                + ", warnings=" + getWarnings().size()
                + (diagnostics.isEmpty() ? "" : ", diagnostics=" + diagnostics)
                + "]";
    }
}
