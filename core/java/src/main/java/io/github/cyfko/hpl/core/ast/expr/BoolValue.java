package io.github.cyfko.hpl.core.ast.expr;

import io.github.cyfko.hpl.core.api.AstNode;
import io.github.cyfko.hpl.core.api.AstVisitor;
import io.github.cyfko.hpl.core.api.NodeId;
import io.github.cyfko.hpl.core.api.ValueType;
import io.github.cyfko.hpl.core.logic.TruthValue;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Logic constant: {@code True}, {@code False} or {@code Unknown}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class BoolValue extends Expression {

    private final TruthValue value;

    public BoolValue(TruthValue value) {
        this.value = Objects.requireNonNull(value, "value is required");
    }

    public static BoolValue ofTrue() {
        return new BoolValue(TruthValue.TRUE);
    }

    public static BoolValue ofFalse() {
        return new BoolValue(TruthValue.FALSE);
    }

    public static BoolValue unknown() {
        return new BoolValue(TruthValue.UNKNOWN);
    }

    public static BoolValue of(boolean value) {
        return new BoolValue(TruthValue.of(value));
    }

    public TruthValue value() {
        return value;
    }

    public boolean isTrue() {
        return value == TruthValue.TRUE;
    }

    public boolean isFalse() {
        return value == TruthValue.FALSE;
    }

    @Override
    public Set<ValueType> possibleTypes(TypingContext context) {
        return ValueType.of(ValueType.BOOL);
    }

    @Override
    public List<AstNode> children() {
        return List.of();
    }

    @Override
    public BoolValue duplicate() {
        return new BoolValue(value);
    }

    @Override
    public boolean structurallyEquals(AstNode other) {
        return other instanceof BoolValue b && b.value == value;
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
        return visitor.visitBoolValue(this);
    }

    @Override
    public String toString() {
        return value.getSymbol();
    }
}
