package io.github.cyfko.hpl.core.api;

import io.github.cyfko.hpl.core.ast.Predicate;
import io.github.cyfko.hpl.core.ast.Property;
import io.github.cyfko.hpl.core.ast.Scope;
import io.github.cyfko.hpl.core.ast.Specification;
import io.github.cyfko.hpl.core.ast.event.AtomicEvent;
import io.github.cyfko.hpl.core.ast.event.EventDisjunction;
import io.github.cyfko.hpl.core.ast.expr.And;
import io.github.cyfko.hpl.core.ast.expr.ArrayAccess;
import io.github.cyfko.hpl.core.ast.expr.Arithmetic;
import io.github.cyfko.hpl.core.ast.expr.BoolValue;
import io.github.cyfko.hpl.core.ast.expr.Comparison;
import io.github.cyfko.hpl.core.ast.expr.FieldAccess;
import io.github.cyfko.hpl.core.ast.expr.FunctionCall;
import io.github.cyfko.hpl.core.ast.expr.Literal;
import io.github.cyfko.hpl.core.ast.expr.Not;
import io.github.cyfko.hpl.core.ast.expr.Or;
import io.github.cyfko.hpl.core.ast.expr.Quantifier;
import io.github.cyfko.hpl.core.ast.expr.RangeValue;
import io.github.cyfko.hpl.core.ast.expr.SetValue;
import io.github.cyfko.hpl.core.ast.expr.VariableReference;

/**
 * Visitor over the closed set of property tree nodes.
 * <p>
 * Every method defaults to {@link #visitNode(AstNode)}, so an implementation only overrides
 * the node kinds it cares about. Visiting is not recursive: callers decide how to walk the
 * tree, typically through {@code AstWalker}.
 * </p>
 *
 * <pre>{@code
 * long comparisons = AstWalker.preorder(property)
 *     .map(node -> node.accept(new AstVisitor<Integer>() {
 *         public Integer visitNode(AstNode node) { return 0; }
 *         public Integer visitComparison(Comparison node) { return 1; }
 *     }))
 *     .mapToInt(Integer::intValue)
 *     .sum();
 * }</pre>
 *
 * @param <R> the result type of the visit
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface AstVisitor<R> {

    /**
     * Fallback for every node kind that is not overridden.
     *
     * @param node the visited node
     * @return the default result, {@code null} unless overridden
     */
    default R visitNode(AstNode node) {
        return null;
    }

    default R visitSpecification(Specification node) { return visitNode(node); }

    default R visitProperty(Property node) { return visitNode(node); }

    default R visitScope(Scope node) { return visitNode(node); }

    default R visitPredicate(Predicate node) { return visitNode(node); }

    default R visitAtomicEvent(AtomicEvent node) { return visitNode(node); }

    default R visitEventDisjunction(EventDisjunction node) { return visitNode(node); }

    default R visitBoolValue(BoolValue node) { return visitNode(node); }

    default R visitNot(Not node) { return visitNode(node); }

    default R visitAnd(And node) { return visitNode(node); }

    default R visitOr(Or node) { return visitNode(node); }

    default R visitComparison(Comparison node) { return visitNode(node); }

    default R visitLiteral(Literal node) { return visitNode(node); }

    default R visitFieldAccess(FieldAccess node) { return visitNode(node); }

    default R visitFunctionCall(FunctionCall node) { return visitNode(node); }

    default R visitArithmetic(Arithmetic node) { return visitNode(node); }

    default R visitSetValue(SetValue node) { return visitNode(node); }

    default R visitRangeValue(RangeValue node) { return visitNode(node); }

    default R visitQuantifier(Quantifier node) { return visitNode(node); }

    default R visitVariableReference(VariableReference node) { return visitNode(node); }

    default R visitArrayAccess(ArrayAccess node) { return visitNode(node); }
}
