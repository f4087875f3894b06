package io.github.cyfko.hpl.core.api;

import io.github.cyfko.hpl.core.exception.AstConstructionException;
import io.github.cyfko.hpl.core.exception.ConstructionError;

import java.util.Set;

/**
 * Relational operators allowed in a comparison leaf of a predicate.
 *
 * <p><strong>Operator mappings:</strong></p>
 * <ul>
 *     <li>EQ / =</li>
 *     <li>NE / !=</li>
 *     <li>LT / &lt;</li>
 *     <li>LTE / &lt;=</li>
 *     <li>GT / &gt;</li>
 *     <li>GTE / &gt;=</li>
 *     <li>IN / in</li>
 * </ul>
 *
 * <p>Equality accepts any pair of primitive operands of a common kind, ordering operators
 * require numbers on both sides, and {@code in} tests a primitive value against a set or a
 * range.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum ComparisonOperator {

    /** Equality operator: "=" */
    EQ("=", "EQ"),

    /** Not equal operator: "!=" */
    NE("!=", "NE"),

    /** Less than operator: "&lt;" */
    LT("<", "LT"),

    /** Less than or equal operator: "&lt;=" */
    LTE("<=", "LTE"),

    /** Greater than operator: "&gt;" */
    GT(">", "GT"),

    /** Greater than or equal operator: "&gt;=" */
    GTE(">=", "GTE"),

    /** Membership operator: "in" */
    IN("in", "IN");

    private final String symbol;
    private final String code;

    ComparisonOperator(String symbol, String code) {
        this.symbol = symbol;
        this.code = code;
    }

    /**
     * @return the symbol used when printing a comparison, e.g. {@code "<="}
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * @return the short code of the operator, e.g. {@code "LTE"}
     */
    public String getCode() {
        return code;
    }

    /**
     * @return {@code true} for the operators that order numbers
     */
    public boolean isOrdering() {
        return this == LT || this == LTE || this == GT || this == GTE;
    }

    /**
     * Kinds accepted on the left-hand side.
     *
     * @return accepted left operand kinds
     */
    public Set<ValueType> leftOperandTypes() {
        return isOrdering() ? ValueType.of(ValueType.NUMBER) : ValueType.primitive();
    }

    /**
     * Kinds accepted on the right-hand side.
     *
     * @return accepted right operand kinds
     */
    public Set<ValueType> rightOperandTypes() {
        if (this == IN) {
            return ValueType.of(ValueType.SET, ValueType.RANGE);
        }
        return leftOperandTypes();
    }

    /**
     * Finds an operator by its symbol or code, ignoring case.
     *
     * @param value symbol or code string to search for
     * @return the matching operator
     * @throws AstConstructionException if no operator matches
     * @throws NullPointerException     if {@code value} is {@code null}
     */
    public static ComparisonOperator fromString(String value) {
        String trimmed = value.trim();
        for (ComparisonOperator op : values()) {
            if (op.symbol.equalsIgnoreCase(trimmed) || op.code.equalsIgnoreCase(trimmed)) {
                return op;
            }
        }
        throw new AstConstructionException(ConstructionError.UNKNOWN_OPERATOR, trimmed,
                "Unknown comparison operator '" + trimmed + "'");
    }
}
