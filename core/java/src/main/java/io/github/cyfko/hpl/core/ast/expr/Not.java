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
 * Boolean negation.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Not extends Expression {

    private Expression operand;

    public Not(Expression operand) {
        Objects.requireNonNull(operand, "operand is required");
        this.operand = attach(operand, () -> this.operand = null);
    }

    private Not(Not source) {
        Expression copy = duplicateOrNull(source.operand);
        this.operand = copy == null ? null : attach(copy, () -> this.operand = null);
    }

    /**
     * @return the negated expression, {@code null} once it has moved to another parent
     */
    public Expression operand() {
        return operand;
    }

    public void setOperand(Expression operand) {
        checkMutable();
        Objects.requireNonNull(operand, "operand is required");
        Expression old = this.operand;
        if (old == operand) {
            return;
        }
        this.operand = attach(operand, () -> this.operand = null);
        detach(old);
    }

    @Override
    public Set<ValueType> possibleTypes(TypingContext context) {
        return ValueType.of(ValueType.BOOL);
    }

    @Override
    public List<Diagnostic> checkOperandTypes(TypingContext context) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        requireOperand(operand, ValueType.of(ValueType.BOOL), "operand", "'not'", this, context, diagnostics);
        return diagnostics;
    }

    @Override
    public Set<ValueType> acceptedTypes(Expression operand, TypingContext context) {
        return operand == this.operand ? ValueType.of(ValueType.BOOL) : ValueType.any();
    }

    @Override
    public List<AstNode> children() {
        return operand == null ? List.of() : List.of(operand);
    }

    @Override
    public Not duplicate() {
        return new Not(this);
    }

    @Override
    public boolean structurallyEquals(AstNode other) {
        return other instanceof Not not && sameNode(operand, not.operand);
    }

    @Override
    public void replaceChild(NodeId oldId, AstNode newNode) {
        checkMutable();
        if (!isNode(operand, oldId)) {
            throw notAChild(oldId);
        }
        setOperand(requireKind(newNode, Expression.class, "operand"));
    }

    @Override
    public List<String> missingSlots() {
        return operand == null ? List.of("operand") : List.of();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitNot(this);
    }

    @Override
    public String toString() {
        return "not " + operand;
    }
}
