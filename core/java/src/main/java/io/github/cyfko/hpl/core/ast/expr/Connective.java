package io.github.cyfko.hpl.core.ast.expr;

import io.github.cyfko.hpl.core.api.AstNode;
import io.github.cyfko.hpl.core.api.Diagnostic;
import io.github.cyfko.hpl.core.api.NodeId;
import io.github.cyfko.hpl.core.api.ValueType;
import io.github.cyfko.hpl.core.exception.AstConstructionException;
import io.github.cyfko.hpl.core.exception.ConstructionError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * N-ary boolean connective, base of {@link And} and {@link Or}.
 * <p>
 * Operands are ordered: {@code a and b} and {@code b and a} are not structurally equal.
 * A connective is built with at least one operand. Operands may later move to other parents,
 * in which case the empty connective is reported as a missing child by validation.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract sealed class Connective extends Expression permits And, Or {

    private final List<Expression> operands = new ArrayList<>();

    Connective(List<? extends Expression> operands) {
        Objects.requireNonNull(operands, "operands are required");
        if (operands.isEmpty()) {
            throw new AstConstructionException(ConstructionError.EMPTY_CONNECTIVE, keyword(),
                    "'" + keyword() + "' needs at least one operand");
        }
        requireDistinctInstances(operands, "operands");
        // the argument may be a view over another node's slot, which attach mutates
        for (Expression operand : List.copyOf(operands)) {
            addOperand(operand);
        }
    }

    Connective(Connective source) {
        for (Expression operand : source.operands) {
            addOperand(operand.duplicate());
        }
    }

    /**
     * @return the keyword of this connective in the property language
     */
    public abstract String keyword();

    /**
     * @return a read-only view of the operands, in order
     */
    public List<Expression> operands() {
        return Collections.unmodifiableList(operands);
    }

    /**
     * Appends an operand, taking it from its previous parent.
     *
     * @param operand the operand to append
     */
    public void addOperand(Expression operand) {
        checkMutable();
        Objects.requireNonNull(operand, "operand is required");
        attach(operand, removalFrom(operands, operand));
        operands.add(operand);
    }

    @Override
    public Set<ValueType> possibleTypes(TypingContext context) {
        return ValueType.of(ValueType.BOOL);
    }

    @Override
    public List<Diagnostic> checkOperandTypes(TypingContext context) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (int i = 0; i < operands.size(); i++) {
            requireOperand(operands.get(i), ValueType.of(ValueType.BOOL), "operand " + i, "'" + keyword() + "'",
                    this, context, diagnostics);
        }
        return diagnostics;
    }

    @Override
    public Set<ValueType> acceptedTypes(Expression operand, TypingContext context) {
        return operands.contains(operand) ? ValueType.of(ValueType.BOOL) : ValueType.any();
    }

    @Override
    public List<AstNode> children() {
        return List.copyOf(operands);
    }

    @Override
    public boolean structurallyEquals(AstNode other) {
        return other != null && other.getClass() == getClass() && sameNodes(operands, ((Connective) other).operands);
    }

    @Override
    public void replaceChild(NodeId oldId, AstNode newNode) {
        checkMutable();
        if (!replaceIn(operands, oldId, requireKind(newNode, Expression.class, "operand"))) {
            throw notAChild(oldId);
        }
    }

    @Override
    public List<String> missingSlots() {
        return operands.isEmpty() ? List.of("operands") : List.of();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < operands.size(); i++) {
            if (i > 0) {
                sb.append(' ').append(keyword()).append(' ');
            }
            sb.append(operands.get(i));
        }
        return sb.append(')').toString();
    }
}
