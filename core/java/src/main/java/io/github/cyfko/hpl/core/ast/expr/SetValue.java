package io.github.cyfko.hpl.core.ast.expr;

import io.github.cyfko.hpl.core.api.AstNode;
import io.github.cyfko.hpl.core.api.AstVisitor;
import io.github.cyfko.hpl.core.api.Diagnostic;
import io.github.cyfko.hpl.core.api.NodeId;
import io.github.cyfko.hpl.core.api.ValueType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Enumerated set of primitive values, the right operand of {@code in}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class SetValue extends Expression {

    private final List<Expression> elements = new ArrayList<>();

    public SetValue(List<? extends Expression> elements) {
        Objects.requireNonNull(elements, "elements are required");
        requireDistinctInstances(elements, "elements");
        for (Expression element : List.copyOf(elements)) {
            attach(element, removalFrom(this.elements, element));
            this.elements.add(element);
        }
    }

    private SetValue(SetValue source) {
        for (Expression element : source.elements) {
            Expression copy = element.duplicate();
            attach(copy, removalFrom(elements, copy));
            elements.add(copy);
        }
    }

    public List<Expression> elements() {
        return Collections.unmodifiableList(elements);
    }

    @Override
    public Set<ValueType> possibleTypes(TypingContext context) {
        return ValueType.of(ValueType.SET);
    }

    @Override
    public List<Diagnostic> checkOperandTypes(TypingContext context) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (int i = 0; i < elements.size(); i++) {
            requireOperand(elements.get(i), ValueType.primitive(), "element " + i, "a set", this, context, diagnostics);
        }
        return diagnostics;
    }

    @Override
    public Set<ValueType> acceptedTypes(Expression operand, TypingContext context) {
        return elements.contains(operand) ? ValueType.primitive() : ValueType.any();
    }

    @Override
    public List<AstNode> children() {
        return List.copyOf(elements);
    }

    @Override
    public SetValue duplicate() {
        return new SetValue(this);
    }

    @Override
    public boolean structurallyEquals(AstNode other) {
        return other instanceof SetValue set && sameNodes(elements, set.elements);
    }

    @Override
    public void replaceChild(NodeId oldId, AstNode newNode) {
        checkMutable();
        if (!replaceIn(elements, oldId, requireKind(newNode, Expression.class, "element"))) {
            throw notAChild(oldId);
        }
    }

    @Override
    public List<String> missingSlots() {
        return List.of();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitSetValue(this);
    }

    @Override
    public String toString() {
        return elements.stream().map(String::valueOf).collect(Collectors.joining(", ", "{", "}"));
    }
}
