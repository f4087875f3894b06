package io.github.cyfko.hpl.core.ast.expr;

import io.github.cyfko.hpl.core.api.AstNode;
import io.github.cyfko.hpl.core.api.AstVisitor;
import io.github.cyfko.hpl.core.api.NodeId;
import io.github.cyfko.hpl.core.api.ValueType;
import io.github.cyfko.hpl.core.exception.AstConstructionException;
import io.github.cyfko.hpl.core.exception.ConstructionError;

import java.util.List;
import java.util.Set;

/**
 * Read of a quantified variable, written {@code x} in {@code forall x in [0 to 3]: ...}.
 * <p>
 * The reference is bound by the innermost enclosing {@link Quantifier} of the same variable
 * whose condition contains it. Binding is checked by validation, so a reference can be built
 * before its quantifier.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class VariableReference extends Expression {

    private final String name;

    public VariableReference(String name) {
        if (name == null || name.isBlank()) {
            throw new AstConstructionException(ConstructionError.BLANK_VARIABLE, name,
                    "A variable reference needs a variable name");
        }
        this.name = name;
    }

    public static VariableReference of(String name) {
        return new VariableReference(name);
    }

    public String name() {
        return name;
    }

    @Override
    public Set<ValueType> possibleTypes(TypingContext context) {
        return context.variableTypes(this);
    }

    @Override
    public List<AstNode> children() {
        return List.of();
    }

    @Override
    public VariableReference duplicate() {
        return new VariableReference(name);
    }

    @Override
    public boolean structurallyEquals(AstNode other) {
        return other instanceof VariableReference v && v.name.equals(name);
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
        return visitor.visitVariableReference(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
