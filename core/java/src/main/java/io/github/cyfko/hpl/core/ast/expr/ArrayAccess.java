package io.github.cyfko.hpl.core.ast.expr;

import io.github.cyfko.hpl.core.api.AstNode;
import io.github.cyfko.hpl.core.api.AstVisitor;
import io.github.cyfko.hpl.core.api.Diagnostic;
import io.github.cyfko.hpl.core.api.NodeId;
import io.github.cyfko.hpl.core.api.ValueType;
import io.github.cyfko.hpl.core.exception.AstConstructionException;
import io.github.cyfko.hpl.core.exception.ConstructionError;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Indexed read of an array, {@code ranges[i]}.
 * <p>
 * The item may be any primitive or a nested message. Arrays of arrays are not part of the
 * language: an array access over another array access fails with
 * {@link ConstructionError#MULTI_DIMENSIONAL_ACCESS}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ArrayAccess extends Expression {

    private Expression array;
    private Expression index;

    public ArrayAccess(Expression array, Expression index) {
        Objects.requireNonNull(array, "array is required");
        Objects.requireNonNull(index, "index is required");
        requireSingleDimension(array, index);
        this.array = attach(array, () -> this.array = null);
        this.index = attach(index, () -> this.index = null);
    }

    private ArrayAccess(ArrayAccess source) {
        Expression a = duplicateOrNull(source.array);
        Expression i = duplicateOrNull(source.index);
        this.array = a == null ? null : attach(a, () -> this.array = null);
        this.index = i == null ? null : attach(i, () -> this.index = null);
    }

    private static void requireSingleDimension(Expression array, Expression index) {
        if (array instanceof ArrayAccess) {
            throw new AstConstructionException(ConstructionError.MULTI_DIMENSIONAL_ACCESS, array.toString(),
                    "Multi-dimensional array access '" + array + "[" + index + "]'");
        }
    }

    public Expression array() {
        return array;
    }

    public Expression index() {
        return index;
    }

    public void setArray(Expression array) {
        checkMutable();
        Objects.requireNonNull(array, "array is required");
        requireSingleDimension(array, index);
        Expression old = this.array;
        if (old == array) {
            return;
        }
        this.array = attach(array, () -> this.array = null);
        detach(old);
    }

    public void setIndex(Expression index) {
        checkMutable();
        Objects.requireNonNull(index, "index is required");
        Expression old = this.index;
        if (old == index) {
            return;
        }
        this.index = attach(index, () -> this.index = null);
        detach(old);
    }

    @Override
    public Set<ValueType> possibleTypes(TypingContext context) {
        return ValueType.item();
    }

    @Override
    public List<Diagnostic> checkOperandTypes(TypingContext context) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        requireOperand(array, ValueType.of(ValueType.ARRAY), "array", "an array access", this, context, diagnostics);
        requireOperand(index, ValueType.of(ValueType.NUMBER), "index", "an array access", this, context, diagnostics);
        return diagnostics;
    }

    @Override
    public Set<ValueType> acceptedTypes(Expression operand, TypingContext context) {
        if (operand == array) {
            return ValueType.of(ValueType.ARRAY);
        }
        return operand == index ? ValueType.of(ValueType.NUMBER) : ValueType.any();
    }

    @Override
    public List<AstNode> children() {
        List<AstNode> children = new ArrayList<>(2);
        if (array != null) {
            children.add(array);
        }
        if (index != null) {
            children.add(index);
        }
        return List.copyOf(children);
    }

    @Override
    public ArrayAccess duplicate() {
        return new ArrayAccess(this);
    }

    @Override
    public boolean structurallyEquals(AstNode other) {
        return other instanceof ArrayAccess a && sameNode(array, a.array) && sameNode(index, a.index);
    }

    @Override
    public void replaceChild(NodeId oldId, AstNode newNode) {
        checkMutable();
        if (isNode(array, oldId)) {
            setArray(requireKind(newNode, Expression.class, "array"));
        } else if (isNode(index, oldId)) {
            setIndex(requireKind(newNode, Expression.class, "index"));
        } else {
            throw notAChild(oldId);
        }
    }

    @Override
    public List<String> missingSlots() {
        List<String> missing = new ArrayList<>(2);
        if (array == null) {
            missing.add("array");
        }
        if (index == null) {
            missing.add("index");
        }
        return missing;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitArrayAccess(this);
    }

    @Override
    public String toString() {
        return array + "[" + index + "]";
    }
}
