package io.github.cyfko.hpl.core.ast.expr;

import io.github.cyfko.hpl.core.api.AstNode;
import io.github.cyfko.hpl.core.api.AstVisitor;
import io.github.cyfko.hpl.core.api.NodeId;
import io.github.cyfko.hpl.core.api.ValueType;
import io.github.cyfko.hpl.core.exception.AstConstructionException;
import io.github.cyfko.hpl.core.exception.ConstructionError;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Call of a named function.
 * <p>
 * The name is not resolved at construction: unknown functions and argument mismatches are
 * reported by validation against the {@code FunctionRegistry} in use.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FunctionCall extends Expression {

    private final String name;
    private final List<Expression> arguments = new ArrayList<>();

    public FunctionCall(String name, List<? extends Expression> arguments) {
        if (name == null || name.isBlank()) {
            throw new AstConstructionException(ConstructionError.BLANK_FUNCTION_NAME, name,
                    "A function call needs a function name");
        }
        Objects.requireNonNull(arguments, "arguments are required");
        requireDistinctInstances(arguments, "arguments");
        this.name = name;
        for (Expression argument : List.copyOf(arguments)) {
            addArgument(argument);
        }
    }

    private FunctionCall(FunctionCall source) {
        this.name = source.name;
        for (Expression argument : source.arguments) {
            addArgument(argument.duplicate());
        }
    }

    public static FunctionCall of(String name, Expression... arguments) {
        return new FunctionCall(name, Arrays.asList(arguments));
    }

    public String name() {
        return name;
    }

    public List<Expression> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    public void addArgument(Expression argument) {
        checkMutable();
        Objects.requireNonNull(argument, "argument is required");
        attach(argument, removalFrom(arguments, argument));
        arguments.add(argument);
    }

    @Override
    public Set<ValueType> possibleTypes(TypingContext context) {
        return context.returnTypes(name);
    }

    @Override
    public List<AstNode> children() {
        return List.copyOf(arguments);
    }

    @Override
    public FunctionCall duplicate() {
        return new FunctionCall(this);
    }

    @Override
    public boolean structurallyEquals(AstNode other) {
        return other instanceof FunctionCall call && name.equals(call.name) && sameNodes(arguments, call.arguments);
    }

    @Override
    public void replaceChild(NodeId oldId, AstNode newNode) {
        checkMutable();
        if (!replaceIn(arguments, oldId, requireKind(newNode, Expression.class, "argument"))) {
            throw notAChild(oldId);
        }
    }

    @Override
    public List<String> missingSlots() {
        return List.of();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }

    @Override
    public String toString() {
        return name + arguments.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
    }
}
