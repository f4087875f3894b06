package io.github.cyfko.hpl.core.validation;

import io.github.cyfko.hpl.core.api.Diagnostic;
import io.github.cyfko.hpl.core.api.DiagnosticCode;
import io.github.cyfko.hpl.core.api.NodeId;
import io.github.cyfko.hpl.core.api.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ValidationReport Tests")
class ValidationReportTest {

    private final NodeId node = NodeId.next();
    private final Diagnostic error = Diagnostic.of(DiagnosticCode.UNBOUND_ALIAS, node, "y", "Reference to undefined alias 'y'");
    private final Diagnostic warning = Diagnostic.of(DiagnosticCode.SUSPICIOUS_UNBOUND_RESPONSE, node, "REQUIREMENT", "");

    @Test
    @DisplayName("Should split errors and warnings")
    void testSeverities() {
        ValidationReport report = ValidationReport.of(List.of(warning, error), false);

        assertEquals(List.of(error), report.getErrors());
        assertEquals(List.of(warning), report.getWarnings());
        assertEquals(Severity.WARNING, warning.severity());
        assertFalse(report.isAccepted());
        assertTrue(report.hasCode(DiagnosticCode.UNBOUND_ALIAS));
        assertFalse(report.hasCode(DiagnosticCode.TYPE_MISMATCH));
    }

    @Test
    @DisplayName("Should accept warnings unless they count as errors")
    void testWarningsAsErrors() {
        assertTrue(ValidationReport.of(List.of(warning), false).isAccepted());
        assertFalse(ValidationReport.of(List.of(warning), true).isAccepted());
        assertTrue(ValidationReport.empty().isAccepted());
    }

    @Test
    @DisplayName("Should copy diagnostics on creation")
    void testImmutability() {
        List<Diagnostic> diagnostics = new ArrayList<>(List.of(error));
        ValidationReport report = ValidationReport.of(diagnostics, false);

        diagnostics.add(warning);

        assertEquals(1, report.getDiagnostics().size());
        assertThrows(UnsupportedOperationException.class, () -> report.getDiagnostics().add(warning));
    }

    @Test
    @DisplayName("Should compare reports by content")
    void testEquality() {
        ValidationReport a = ValidationReport.of(List.of(error, warning), false);
        ValidationReport b = ValidationReport.of(List.of(error, warning), false);

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, ValidationReport.of(List.of(warning, error), false));
        assertNotEquals(a, ValidationReport.of(List.of(error, warning), true));
        assertTrue(a.toString().contains("errors=1"));
    }
}
