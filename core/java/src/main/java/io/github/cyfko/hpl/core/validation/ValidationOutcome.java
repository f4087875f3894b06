package io.github.cyfko.hpl.core.validation;

import io.github.cyfko.hpl.core.ast.Property;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of {@link PropertyValidator#accept(Property)}.
 *
 * @param report     the diagnostics of the property
 * @param accepted   the frozen property, present only when the report accepts it
 * @param aliasTable the aliases bound by the property
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ValidationOutcome(ValidationReport report, Optional<Property> accepted, AliasTable aliasTable) {

    public ValidationOutcome {
        Objects.requireNonNull(report, "report is required");
        Objects.requireNonNull(accepted, "accepted is required");
        Objects.requireNonNull(aliasTable, "aliasTable is required");
    }

    public boolean isAccepted() {
        return accepted.isPresent();
    }
}
