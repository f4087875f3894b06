package io.github.cyfko.hpl.core.exception;

import io.github.cyfko.hpl.core.api.Diagnostic;
import io.github.cyfko.hpl.core.validation.ValidationReport;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Exception thrown when a caller requires a property to be accepted and it is not.
 * <p>
 * Validation itself never throws for authoring mistakes: it accumulates diagnostics in a
 * {@link ValidationReport}. This exception is the hard-failure wrapper used by
 * {@code PropertyValidator#requireAccepted}, for callers that cannot go on with a rejected
 * property (typically a monitor generator).
 * </p>
 *
 * <pre>{@code
 * try {
 *     Property accepted = validator.requireAccepted(property);
 *     backend.generate(accepted);
 * } catch (PropertyValidationException e) {
 *     e.getReport().getErrors().forEach(d -> logger.warning(d.message()));
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class PropertyValidationException extends RuntimeException {

    private final transient ValidationReport report;

    /**
     * @param report the report of the rejected property
     */
    public PropertyValidationException(ValidationReport report) {
        super(summarize(Objects.requireNonNull(report, "report is required")));
        this.report = report;
    }

    /**
     * @return the complete report of the rejected property
     */
    public ValidationReport getReport() {
        return report;
    }

    private static String summarize(ValidationReport report) {
        return "Property rejected with " + report.getErrors().size() + " error(s): "
                + report.getErrors().stream().map(Diagnostic::message).collect(Collectors.joining("; "));
    }
}
