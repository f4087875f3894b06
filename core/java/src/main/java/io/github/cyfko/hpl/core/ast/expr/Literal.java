package io.github.cyfko.hpl.core.ast.expr;

import io.github.cyfko.hpl.core.api.AstNode;
import io.github.cyfko.hpl.core.api.AstVisitor;
import io.github.cyfko.hpl.core.api.NodeId;
import io.github.cyfko.hpl.core.api.ValueType;
import io.github.cyfko.hpl.core.exception.AstConstructionException;
import io.github.cyfko.hpl.core.exception.ConstructionError;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

/**
 * Number, string or boolean constant.
 * <p>
 * Numbers are compared by value: {@code 1} and {@code 1.0} are structurally equal.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Literal extends Expression {

    private final Object value;

    private Literal(Object value) {
        this.value = value;
    }

    public static Literal of(Number value) {
        if (value == null) {
            throw new AstConstructionException(ConstructionError.INVALID_LITERAL, "null", "A literal needs a value");
        }
        if ((value instanceof Double d && !Double.isFinite(d)) || (value instanceof Float f && !Float.isFinite(f))) {
            throw new AstConstructionException(ConstructionError.INVALID_LITERAL, value.toString(),
                    "Numeric literal must be finite, got " + value);
        }
        return new Literal(value);
    }

    public static Literal of(String value) {
        if (value == null) {
            throw new AstConstructionException(ConstructionError.INVALID_LITERAL, "null", "A literal needs a value");
        }
        return new Literal(value);
    }

    public static Literal of(boolean value) {
        return new Literal(value);
    }

    /**
     * Creates a literal from a value of unknown kind, as produced by a parser.
     *
     * @param value a number, a string or a boolean
     * @return the literal
     * @throws AstConstructionException if the value is of another kind
     */
    public static Literal ofValue(Object value) {
        if (value instanceof Number n) {
            return of(n);
        }
        if (value instanceof String s) {
            return of(s);
        }
        if (value instanceof Boolean b) {
            return of(b.booleanValue());
        }
        String kind = value == null ? "null" : value.getClass().getSimpleName();
        throw new AstConstructionException(ConstructionError.INVALID_LITERAL, kind,
                "A literal must be a number, a string or a boolean, got " + kind);
    }

    public Object value() {
        return value;
    }

    public ValueType type() {
        if (value instanceof Number) {
            return ValueType.NUMBER;
        }
        if (value instanceof String) {
            return ValueType.STRING;
        }
        return ValueType.BOOL;
    }

    @Override
    public Set<ValueType> possibleTypes(TypingContext context) {
        return ValueType.of(type());
    }

    @Override
    public List<AstNode> children() {
        return List.of();
    }

    @Override
    public Literal duplicate() {
        return new Literal(value);
    }

    @Override
    public boolean structurallyEquals(AstNode other) {
        if (!(other instanceof Literal literal)) {
            return false;
        }
        if (value instanceof Number a && literal.value instanceof Number b) {
            return new BigDecimal(a.toString()).compareTo(new BigDecimal(b.toString())) == 0;
        }
        return value.equals(literal.value);
    }

    @Override
    public void replaceChild(NodeId oldId, AstNode newNode) {
        throw notAChild(oldId);
    }

    @Override
    public List<String> missingSlots() {
        return List.of();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public String toString() {
        return value instanceof String ? "'" + value + "'" : String.valueOf(value);
    }
}
