package io.github.cyfko.hpl.core.exception;

import java.util.Objects;

/**
 * Exception thrown when a property tree node cannot be built or edited.
 * <p>
 * Construction only checks invariants local to one node: arity of connectives and
 * disjunctions, non-blank names, slot presence for scopes and patterns. Everything that spans
 * several nodes (alias binding, function signatures, pattern sanity) is deferred to validation
 * so that trees can be built incrementally.
 * </p>
 *
 * <p><strong>Error examples:</strong></p>
 * <pre>{@code
 * new EventDisjunction(List.of(AtomicEvent.on("/scan")));
 * // → INVALID_DISJUNCTION_ARITY: "An event disjunction needs at least 2 events, got 1"
 *
 * new EventDisjunction(List.of(AtomicEvent.on("/scan"), AtomicEvent.on("/scan")));
 * // → NON_UNIQUE_DISJUNCT_CHANNEL: "Channel '/scan' appears multiple times in an event disjunction"
 *
 * AtomicEvent.on("  ");
 * // → BLANK_CHANNEL: "An atomic event needs a channel"
 * }</pre>
 *
 * <p><strong>Handling:</strong></p>
 * <pre>{@code
 * try {
 *     Event event = builder.buildEvent(node);
 * } catch (AstConstructionException e) {
 *     logger.severe("Malformed tree from parser: " + e.getError() + " on " + e.getSubject());
 *     throw e;
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see ConstructionError
 */
public class AstConstructionException extends RuntimeException {

    private final ConstructionError error;
    private final String subject;

    /**
     * Creates an exception for a violated construction invariant.
     *
     * @param error   the violated invariant
     * @param subject the channel, alias, operator or slot concerned, may be empty
     * @param message the description of the violation
     */
    public AstConstructionException(ConstructionError error, String subject, String message) {
        super(message);
        this.error = Objects.requireNonNull(error, "error is required");
        this.subject = subject == null ? "" : subject;
    }

    /**
     * @return the violated invariant
     */
    public ConstructionError getError() {
        return error;
    }

    /**
     * @return the channel, alias, operator or slot concerned
     */
    public String getSubject() {
        return subject;
    }
}
