package io.github.cyfko.hpl.core.ast.expr;

import io.github.cyfko.hpl.core.api.AstNode;
import io.github.cyfko.hpl.core.api.AstVisitor;
import io.github.cyfko.hpl.core.api.Diagnostic;
import io.github.cyfko.hpl.core.api.NodeId;
import io.github.cyfko.hpl.core.api.ValueType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Numeric interval {@code [min to max]}, each bound inclusive unless excluded.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class RangeValue extends Expression {

    private Expression min;
    private Expression max;
    private final boolean excludeMin;
    private final boolean excludeMax;

    public RangeValue(Expression min, Expression max, boolean excludeMin, boolean excludeMax) {
        Objects.requireNonNull(min, "min is required");
        Objects.requireNonNull(max, "max is required");
        this.excludeMin = excludeMin;
        this.excludeMax = excludeMax;
        this.min = attach(min, () -> this.min = null);
        this.max = attach(max, () -> this.max = null);
    }

    private RangeValue(RangeValue source) {
        this.excludeMin = source.excludeMin;
        this.excludeMax = source.excludeMax;
        Expression lower = duplicateOrNull(source.min);
        Expression upper = duplicateOrNull(source.max);
        this.min = lower == null ? null : attach(lower, () -> this.min = null);
        this.max = upper == null ? null : attach(upper, () -> this.max = null);
    }

    public static RangeValue closed(Expression min, Expression max) {
        return new RangeValue(min, max, false, false);
    }

    public Expression min() {
        return min;
    }

    public Expression max() {
        return max;
    }

    public boolean excludesMin() {
        return excludeMin;
    }

    public boolean excludesMax() {
        return excludeMax;
    }

    @Override
    public Set<ValueType> possibleTypes(TypingContext context) {
        return ValueType.of(ValueType.RANGE);
    }

    @Override
    public List<Diagnostic> checkOperandTypes(TypingContext context) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        requireOperand(min, ValueType.of(ValueType.NUMBER), "min", "a range", this, context, diagnostics);
        requireOperand(max, ValueType.of(ValueType.NUMBER), "max", "a range", this, context, diagnostics);
        return diagnostics;
    }

    @Override
    public Set<ValueType> acceptedTypes(Expression operand, TypingContext context) {
        return operand == min || operand == max ? ValueType.of(ValueType.NUMBER) : ValueType.any();
    }

    @Override
    public List<AstNode> children() {
        List<AstNode> children = new ArrayList<>(2);
        if (min != null) {
            children.add(min);
        }
        if (max != null) {
            children.add(max);
        }
        return List.copyOf(children);
    }

    @Override
    public RangeValue duplicate() {
        return new RangeValue(this);
    }

    @Override
    public boolean structurallyEquals(AstNode other) {
        return other instanceof RangeValue r
                && r.excludeMin == excludeMin
                && r.excludeMax == excludeMax
                && sameNode(min, r.min)
                && sameNode(max, r.max);
    }

    @Override
    public void replaceChild(NodeId oldId, AstNode newNode) {
        checkMutable();
        if (isNode(min, oldId)) {
            Expression replacement = requireKind(newNode, Expression.class, "min");
            Expression old = min;
            if (old != replacement) {
                min = attach(replacement, () -> this.min = null);
                detach(old);
            }
        } else if (isNode(max, oldId)) {
            Expression replacement = requireKind(newNode, Expression.class, "max");
            Expression old = max;
            if (old != replacement) {
                max = attach(replacement, () -> this.max = null);
                detach(old);
            }
        } else {
            throw notAChild(oldId);
        }
    }

    @Override
    public List<String> missingSlots() {
        List<String> missing = new ArrayList<>(2);
        if (min == null) {
            missing.add("min");
        }
        if (max == null) {
            missing.add("max");
        }
        return missing;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitRangeValue(this);
    }

    @Override
    public String toString() {
        return (excludeMin ? "![" : "[") + min + " to " + max + (excludeMax ? "]!" : "]");
    }
}
