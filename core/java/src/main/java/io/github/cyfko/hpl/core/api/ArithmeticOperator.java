package io.github.cyfko.hpl.core.api;

import io.github.cyfko.hpl.core.exception.AstConstructionException;
import io.github.cyfko.hpl.core.exception.ConstructionError;

/**
 * Binary numeric operators usable inside predicate terms.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum ArithmeticOperator {

    ADD("+", true),
    SUBTRACT("-", false),
    MULTIPLY("*", true),
    DIVIDE("/", false),
    POWER("**", false);

    private final String symbol;
    private final boolean commutative;

    ArithmeticOperator(String symbol, boolean commutative) {
        this.symbol = symbol;
        this.commutative = commutative;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isCommutative() {
        return commutative;
    }

    /**
     * Finds an operator by its symbol.
     *
     * @param symbol the operator symbol, e.g. {@code "**"}
     * @return the matching operator
     * @throws AstConstructionException if no operator matches
     */
    public static ArithmeticOperator fromSymbol(String symbol) {
        String trimmed = symbol.trim();
        for (ArithmeticOperator op : values()) {
            if (op.symbol.equals(trimmed)) {
                return op;
            }
        }
        throw new AstConstructionException(ConstructionError.UNKNOWN_OPERATOR, trimmed,
                "Unknown arithmetic operator '" + trimmed + "'");
    }
}
