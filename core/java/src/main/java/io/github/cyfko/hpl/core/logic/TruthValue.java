package io.github.cyfko.hpl.core.logic;

/**
 * Kleene three-valued truth.
 * <p>
 * {@link #UNKNOWN} absorbs nothing: {@code FALSE and UNKNOWN} is {@code FALSE},
 * {@code TRUE or UNKNOWN} is {@code TRUE}, every other combination involving
 * {@code UNKNOWN} stays unknown.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum TruthValue {
    TRUE("True"),
    FALSE("False"),
    UNKNOWN("Unknown");

    private final String symbol;

    TruthValue(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public static TruthValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public TruthValue not() {
        switch (this) {
            case TRUE:
                return FALSE;
            case FALSE:
                return TRUE;
            default:
                return UNKNOWN;
        }
    }

    public TruthValue and(TruthValue other) {
        if (this == FALSE || other == FALSE) {
            return FALSE;
        }
        if (this == TRUE && other == TRUE) {
            return TRUE;
        }
        return UNKNOWN;
    }

    public TruthValue or(TruthValue other) {
        if (this == TRUE || other == TRUE) {
            return TRUE;
        }
        if (this == FALSE && other == FALSE) {
            return FALSE;
        }
        return UNKNOWN;
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }
}
