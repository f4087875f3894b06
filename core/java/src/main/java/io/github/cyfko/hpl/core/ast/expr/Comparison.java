package io.github.cyfko.hpl.core.ast.expr;

import io.github.cyfko.hpl.core.api.AstNode;
import io.github.cyfko.hpl.core.api.AstVisitor;
import io.github.cyfko.hpl.core.api.ComparisonOperator;
import io.github.cyfko.hpl.core.api.Diagnostic;
import io.github.cyfko.hpl.core.api.NodeId;
import io.github.cyfko.hpl.core.api.ValueType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Binary comparison, the atomic condition of predicates.
 * <p>
 * Construction accepts operands of any type. An operand pair that can never be compared
 * (a string against a number, say) is kept and exposed through {@link #deferredDiagnostic()},
 * then reported by validation, so that a parser can build the whole tree before complaining.
 * </p>
 *
 * <pre>{@code
 * Comparison c = new Comparison(ComparisonOperator.LT, FieldAccess.self("speed"), Literal.of(10));
 * c.deferredDiagnostic();  // Optional.empty()
 *
 * Comparison bad = new Comparison(ComparisonOperator.LT, Literal.of("fast"), Literal.of(10));
 * bad.deferredDiagnostic(); // TYPE_MISMATCH on operand 'left'
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Comparison extends Expression {

    private final ComparisonOperator operator;
    private Expression left;
    private Expression right;

    public Comparison(ComparisonOperator operator, Expression left, Expression right) {
        this.operator = Objects.requireNonNull(operator, "operator is required");
        Objects.requireNonNull(left, "left operand is required");
        Objects.requireNonNull(right, "right operand is required");
        this.left = attach(left, () -> this.left = null);
        this.right = attach(right, () -> this.right = null);
    }

    private Comparison(Comparison source) {
        this.operator = source.operator;
        Expression l = duplicateOrNull(source.left);
        Expression r = duplicateOrNull(source.right);
        this.left = l == null ? null : attach(l, () -> this.left = null);
        this.right = r == null ? null : attach(r, () -> this.right = null);
    }

    public ComparisonOperator operator() {
        return operator;
    }

    public Expression left() {
        return left;
    }

    public Expression right() {
        return right;
    }

    public void setLeft(Expression left) {
        checkMutable();
        Objects.requireNonNull(left, "left operand is required");
        Expression old = this.left;
        if (old == left) {
            return;
        }
        this.left = attach(left, () -> this.left = null);
        detach(old);
    }

    public void setRight(Expression right) {
        checkMutable();
        Objects.requireNonNull(right, "right operand is required");
        Expression old = this.right;
        if (old == right) {
            return;
        }
        this.right = attach(right, () -> this.right = null);
        detach(old);
    }

    /**
     * Returns the coarse type mismatch of the current operands, if any.
     * <p>
     * Computed without message schema, on every call, so it follows edits of the operands.
     * </p>
     *
     * @return the first type mismatch of this comparison
     */
    public Optional<Diagnostic> deferredDiagnostic() {
        return checkOperandTypes(TypingContext.structural()).stream().findFirst();
    }

    @Override
    public Set<ValueType> possibleTypes(TypingContext context) {
        return ValueType.of(ValueType.BOOL);
    }

    @Override
    public List<Diagnostic> checkOperandTypes(TypingContext context) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        if (left == null || right == null) {
            return diagnostics;
        }
        String owner = "'" + operator.getSymbol() + "'";
        if (operator == ComparisonOperator.EQ || operator == ComparisonOperator.NE) {
            Set<ValueType> leftTypes = left.possibleTypes(context);
            Set<ValueType> rightTypes = right.possibleTypes(context);
            if (leftTypes.isEmpty() || rightTypes.isEmpty()) {
                return diagnostics;
            }
            Set<ValueType> leftPrimitive = ValueType.intersect(leftTypes, ValueType.primitive());
            Set<ValueType> rightPrimitive = ValueType.intersect(rightTypes, ValueType.primitive());
            if (leftPrimitive.isEmpty()) {
                diagnostics.add(typeMismatch(this, "left", owner, ValueType.primitive(), leftTypes));
            } else if (rightPrimitive.isEmpty()) {
                diagnostics.add(typeMismatch(this, "right", owner, ValueType.primitive(), rightTypes));
            } else if (!ValueType.overlaps(leftPrimitive, rightPrimitive)) {
                diagnostics.add(typeMismatch(this, "right", owner, leftPrimitive, rightTypes));
            }
            return diagnostics;
        }
        requireOperand(left, operator.leftOperandTypes(), "left", owner, this, context, diagnostics);
        requireOperand(right, operator.rightOperandTypes(), "right", owner, this, context, diagnostics);
        return diagnostics;
    }

    /**
     * Equality operands accept the primitive types of the other operand, when it has any.
     */
    @Override
    public Set<ValueType> acceptedTypes(Expression operand, TypingContext context) {
        if (operand != left && operand != right) {
            return ValueType.any();
        }
        if (operator == ComparisonOperator.EQ || operator == ComparisonOperator.NE) {
            Expression other = operand == left ? right : left;
            Set<ValueType> otherTypes = other == null
                    ? Set.of()
                    : ValueType.intersect(other.possibleTypes(context), ValueType.primitive());
            return otherTypes.isEmpty() ? ValueType.primitive() : otherTypes;
        }
        return operand == left ? operator.leftOperandTypes() : operator.rightOperandTypes();
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
    public Comparison duplicate() {
        return new Comparison(this);
    }

    @Override
    public boolean structurallyEquals(AstNode other) {
        return other instanceof Comparison c
                && c.operator == operator
                && sameNode(left, c.left)
                && sameNode(right, c.right);
    }

    @Override
    public void replaceChild(NodeId oldId, AstNode newNode) {
        checkMutable();
        if (isNode(left, oldId)) {
            setLeft(requireKind(newNode, Expression.class, "left"));
        } else if (isNode(right, oldId)) {
            setRight(requireKind(newNode, Expression.class, "right"));
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
        return visitor.visitComparison(this);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.getSymbol() + " " + right + ")";
    }
}
