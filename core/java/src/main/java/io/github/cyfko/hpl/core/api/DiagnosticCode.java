package io.github.cyfko.hpl.core.api;

/**
 * Closed catalog of the problems validation can report.
 * <p>
 * Each code has a fixed {@link Severity}. The subject carried by a {@link Diagnostic} depends on
 * the code: an alias name, a channel name, a function name or a slot name.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum DiagnosticCode {

    /** A mandatory child slot is empty. Subject: slot name. */
    MISSING_CHILD(Severity.ERROR),

    /** An event disjunction has fewer than two disjuncts. */
    INVALID_DISJUNCTION_ARITY(Severity.ERROR),

    /** Two disjuncts of one disjunction listen on the same channel. Subject: channel. */
    NON_UNIQUE_DISJUNCT_CHANNEL(Severity.ERROR),

    /** The same alias is bound twice in one property. Subject: alias. */
    DUPLICATE_ALIAS(Severity.ERROR),

    /** A reference to an alias that is not bound in scope. Subject: alias. */
    UNBOUND_ALIAS(Severity.ERROR),

    /** A call to a function missing from the registry. Subject: function name. */
    UNKNOWN_FUNCTION(Severity.ERROR),

    /** No overload of a function accepts the argument count. Subject: function name. */
    FUNCTION_ARITY_MISMATCH(Severity.ERROR),

    /** An argument kind does not match the function signature. Subject: function name. */
    FUNCTION_ARG_TYPE_MISMATCH(Severity.ERROR),

    /**
     * An operand kind does not match its operator, or one field or variable is used with
     * incompatible kinds. Subject: the operand slot, or the field or variable.
     */
    TYPE_MISMATCH(Severity.ERROR),

    /** A variable read outside of every quantifier binding it. Subject: variable name. */
    UNBOUND_VARIABLE(Severity.ERROR),

    /** A quantifier rebinding a variable of an enclosing quantifier. Subject: variable name. */
    SHADOWED_VARIABLE(Severity.ERROR),

    /** A quantifier whose condition never reads its variable. Subject: variable name. */
    UNUSED_VARIABLE(Severity.WARNING),

    /** A field path that the channel schema does not declare. Subject: the field path. */
    UNKNOWN_FIELD(Severity.ERROR),

    /** A trigger pattern without trigger event. Subject: pattern name. */
    MISSING_TRIGGER(Severity.ERROR),

    /** A trigger event on a pattern that takes none. Subject: pattern name. */
    UNEXPECTED_TRIGGER(Severity.ERROR),

    /** A disjunction in a pattern slot that only accepts atomic events. Subject: slot name. */
    DISJUNCTION_NOT_ALLOWED(Severity.ERROR),

    /** A response that does not depend on the trigger. Subject: pattern name. */
    SUSPICIOUS_UNBOUND_RESPONSE(Severity.WARNING),

    /** A predicate that never reads the message of its own event. Subject: channel. */
    PREDICATE_IGNORES_OWN_MESSAGE(Severity.WARNING),

    /** A schema provider is configured but knows nothing about a channel. Subject: channel. */
    UNKNOWN_CHANNEL_SCHEMA(Severity.WARNING);

    private final Severity severity;

    DiagnosticCode(Severity severity) {
        this.severity = severity;
    }

    public Severity getSeverity() {
        return severity;
    }
}
