package io.github.cyfko.hpl.core.ast.expr;

import io.github.cyfko.hpl.core.api.ArithmeticOperator;
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
 * Binary arithmetic over numbers.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Arithmetic extends Expression {

    private final ArithmeticOperator operator;
    private Expression left;
    private Expression right;

    public Arithmetic(ArithmeticOperator operator, Expression left, Expression right) {
        this.operator = Objects.requireNonNull(operator, "operator is required");
        Objects.requireNonNull(left, "left operand is required");
        Objects.requireNonNull(right, "right operand is required");
        this.left = attach(left, () -> this.left = null);
        this.right = attach(right, () -> this.right = null);
    }

    private Arithmetic(Arithmetic source) {
        this.operator = source.operator;
        Expression l = duplicateOrNull(source.left);
        Expression r = duplicateOrNull(source.right);
        this.left = l == null ? null : attach(l, () -> this.left = null);
        this.right = r == null ? null : attach(r, () -> this.right = null);
    }

    public ArithmeticOperator operator() {
        return operator;
    }

    public Expression left() {
        return left;
    }

    public Expression right() {
        return right;
    }

    @Override
    public Set<ValueType> possibleTypes(TypingContext context) {
        return ValueType.of(ValueType.NUMBER);
    }

    @Override
    public List<Diagnostic> checkOperandTypes(TypingContext context) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        String owner = "'" + operator.getSymbol() + "'";
        requireOperand(left, ValueType.of(ValueType.NUMBER), "left", owner, this, context, diagnostics);
        requireOperand(right, ValueType.of(ValueType.NUMBER), "right", owner, this, context, diagnostics);
        return diagnostics;
    }

    @Override
    public Set<ValueType> acceptedTypes(Expression operand, TypingContext context) {
        return operand == left || operand == right ? ValueType.of(ValueType.NUMBER) : ValueType.any();
    }

    @Override
    public List<AstNode> children() {
        List<AstNode> children = new ArrayList<>(2);
        if (left != null) {
            children.add(left);
        }
        if (right != null) {
            children.add(right);
        }
        return List.copyOf(children);
    }

    @Override
    public Arithmetic duplicate() {
        return new Arithmetic(this);
    }

    @Override
    public boolean structurallyEquals(AstNode other) {
        return other instanceof Arithmetic a
                && a.operator == operator
                && sameNode(left, a.left)
                && sameNode(right, a.right);
    }

    @Override
    public void replaceChild(NodeId oldId, AstNode newNode) {
        checkMutable();
        if (isNode(left, oldId)) {
            Expression replacement = requireKind(newNode, Expression.class, "left");
            Expression old = left;
            if (old == replacement) {
                return;
            }
            left = attach(replacement, () -> this.left = null);
            detach(old);
        } else if (isNode(right, oldId)) {
            Expression replacement = requireKind(newNode, Expression.class, "right");
            Expression old = right;
            if (old == replacement) {
                return;
            }
            right = attach(replacement, () -> this.right = null);
            detach(old);
        } else {
            throw notAChild(oldId);
        }
    }

    @Override
    public List<String> missingSlots() {
        List<String> missing = new ArrayList<>(2);
        if (left == null) {
            missing.add("left");
        }
        if (right == null) {
            missing.add("right");
        }
        return missing;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitArithmetic(this);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.getSymbol() + " " + right + ")";
    }
}
