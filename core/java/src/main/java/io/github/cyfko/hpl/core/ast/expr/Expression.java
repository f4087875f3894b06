package io.github.cyfko.hpl.core.ast.expr;

import io.github.cyfko.hpl.core.api.AstNode;
import io.github.cyfko.hpl.core.api.Diagnostic;
import io.github.cyfko.hpl.core.api.DiagnosticCode;
import io.github.cyfko.hpl.core.api.ValueType;
import io.github.cyfko.hpl.core.ast.AbstractAstNode;

import java.util.List;
import java.util.Set;

/**
 * Closed family of predicate expressions.
 * <p>
 * Every expression carries a coarse static type: the set of {@link ValueType}s it may evaluate
 * to. The set depends on a {@link TypingContext}, since field types are only known once a message
 * schema is available and function return types come from a function registry.
 * </p>
 *
 * <h2>Local type rules</h2>
 * <ul>
 *   <li>{@code not}, {@code and}, {@code or} operands must possibly be boolean.</li>
 *   <li>{@code =} and {@code !=} need two primitive operands of a common kind.</li>
 *   <li>{@code <}, {@code <=}, {@code >}, {@code >=} need two numbers.</li>
 *   <li>{@code in} needs a primitive on the left and a set or a range on the right.</li>
 *   <li>Arithmetic operands and range bounds are numbers, set elements are primitives.</li>
 *   <li>A quantifier ranges over an array, a set or a range, and its condition is boolean.</li>
 *   <li>An array access reads an array at a numeric index.</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract sealed class Expression extends AbstractAstNode
        permits BoolValue, Not, Connective, Comparison, Literal, FieldAccess, FunctionCall,
                Arithmetic, SetValue, RangeValue, Quantifier, VariableReference, ArrayAccess {

    Expression() {
    }

    /**
     * Computes the types this expression may evaluate to.
     *
     * @param context source of field and function return types
     * @return the possible types, empty when the expression cannot be typed at all
     */
    public abstract Set<ValueType> possibleTypes(TypingContext context);

    /**
     * Computes the types this expression may evaluate to without message schema.
     *
     * @return the possible types
     */
    public final Set<ValueType> possibleTypes() {
        return possibleTypes(TypingContext.structural());
    }

    /**
     * Checks the local type rule of this node against its immediate operands.
     * <p>
     * Empty slots are skipped, they are reported as missing children by validation.
     * </p>
     *
     * @param context source of field and function return types
     * @return {@link DiagnosticCode#TYPE_MISMATCH} diagnostics, empty when the operands fit
     */
    public List<Diagnostic> checkOperandTypes(TypingContext context) {
        return List.of();
    }

    /**
     * Returns the types this node accepts in the slot holding {@code operand}.
     * <p>
     * Validation uses it to check that every read of one field or variable agrees on a type.
     * </p>
     *
     * @param operand an immediate child of this node
     * @param context source of field and function return types
     * @return the accepted types, every type when the slot puts no constraint
     */
    public Set<ValueType> acceptedTypes(Expression operand, TypingContext context) {
        return ValueType.any();
    }

    /**
     * @return {@code true} when this expression may evaluate to a boolean
     */
    public boolean canBeBoolean() {
        return possibleTypes().contains(ValueType.BOOL);
    }

    @Override
    public abstract Expression duplicate();

    static Diagnostic typeMismatch(AstNode node, String slot, String owner,
                                   Set<ValueType> expected, Set<ValueType> actual) {
        return Diagnostic.of(DiagnosticCode.TYPE_MISMATCH, node.id(), slot,
                "Operand '" + slot + "' of " + owner + " expects " + ValueType.describe(expected)
                        + " but got " + ValueType.describe(actual));
    }

    static void requireOperand(Expression operand, Set<ValueType> expected, String slot, String owner,
                               AstNode node, TypingContext context, List<Diagnostic> sink) {
        if (operand == null) {
            return;
        }
        Set<ValueType> actual = operand.possibleTypes(context);
        // an operand that cannot be typed at all is reported as an unknown field
        if (!actual.isEmpty() && !ValueType.overlaps(actual, expected)) {
            sink.add(typeMismatch(node, slot, owner, expected, actual));
        }
    }
}
