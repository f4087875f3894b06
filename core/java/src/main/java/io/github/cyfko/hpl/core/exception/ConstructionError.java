package io.github.cyfko.hpl.core.exception;

/**
 * Local invariants enforced when a node is built or edited.
 * <p>
 * A violation means the caller (a parser or a programmatic builder) is broken, not that the
 * property author made a mistake, which is why these problems are never deferred to validation.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum ConstructionError {

    /** An atomic event without channel. */
    BLANK_CHANNEL,

    /** An alias that is present but blank. */
    BLANK_ALIAS,

    /** A disjunction of fewer than two events. */
    INVALID_DISJUNCTION_ARITY,

    /** Two disjuncts listening on the same channel. */
    NON_UNIQUE_DISJUNCT_CHANNEL,

    /** An {@code and} or {@code or} without operand. */
    EMPTY_CONNECTIVE,

    /** A field access without field path, or with a blank path segment. */
    EMPTY_FIELD_PATH,

    /** A function call without function name. */
    BLANK_FUNCTION_NAME,

    /** A literal whose value is not a number, a string or a boolean. */
    INVALID_LITERAL,

    /** A predicate whose condition can never be boolean. */
    NOT_BOOLEAN,

    /** Scope events that do not match the scope kind. */
    INVALID_SCOPE,

    /** Pattern events that do not match the pattern kind. */
    INVALID_PATTERN_SLOTS,

    /** A negative or inverted time window. */
    INVALID_TIME_WINDOW,

    /** A replacement node of the wrong kind for its slot. */
    INCOMPATIBLE_CHILD,

    /** A node attached below itself, or attached twice to the same parent. */
    CYCLIC_ATTACHMENT,

    /** An operator symbol that is not part of the language. */
    UNKNOWN_OPERATOR,

    /** A quantifier or variable reference without variable name. */
    BLANK_VARIABLE,

    /** An array access whose array is itself an array access. */
    MULTI_DIMENSIONAL_ACCESS
}
