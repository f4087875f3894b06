package io.github.cyfko.hpl.core.api;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * One problem found while validating a property tree.
 * <p>
 * A diagnostic names the offending node and the alias, channel, function or slot it is about,
 * so that a presentation layer can render an actionable message without walking the tree again.
 * </p>
 *
 * @param code     what went wrong
 * @param severity error or warning, fixed by the code
 * @param node     identity of the offending node
 * @param subject  alias, channel, function or slot name the diagnostic is about
 * @param position zero-based argument position, for function argument diagnostics only
 * @param message  human readable explanation
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Diagnostic(
        DiagnosticCode code,
        Severity severity,
        NodeId node,
        String subject,
        OptionalInt position,
        String message
) {

    public Diagnostic {
        Objects.requireNonNull(code, "code is required");
        Objects.requireNonNull(severity, "severity is required");
        Objects.requireNonNull(node, "node is required");
        Objects.requireNonNull(position, "position is required");
        subject = subject == null ? "" : subject;
        message = message == null ? "" : message;
    }

    /**
     * Creates a diagnostic whose severity is the default one of its code.
     *
     * @param code    what went wrong
     * @param node    identity of the offending node
     * @param subject what the diagnostic is about
     * @param message human readable explanation
     * @return a new diagnostic
     */
    public static Diagnostic of(DiagnosticCode code, NodeId node, String subject, String message) {
        return new Diagnostic(code, code.getSeverity(), node, subject, OptionalInt.empty(), message);
    }

    /**
     * Creates a diagnostic about one argument of a function call.
     *
     * @param code     what went wrong
     * @param node     identity of the offending node
     * @param subject  the function name
     * @param position zero-based argument position
     * @param message  human readable explanation
     * @return a new diagnostic
     */
    public static Diagnostic at(DiagnosticCode code, NodeId node, String subject, int position, String message) {
        return new Diagnostic(code, code.getSeverity(), node, subject, OptionalInt.of(position), message);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public boolean isWarning() {
        return severity == Severity.WARNING;
    }

    @Override
    public String toString() {
        return severity + " " + code + "(" + subject + ") at " + node + ": " + message;
    }
}
