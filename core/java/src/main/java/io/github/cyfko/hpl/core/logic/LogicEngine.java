package io.github.cyfko.hpl.core.logic;

import io.github.cyfko.hpl.core.ast.AstWalker;
import io.github.cyfko.hpl.core.ast.expr.And;
import io.github.cyfko.hpl.core.ast.expr.BoolValue;
import io.github.cyfko.hpl.core.ast.expr.Connective;
import io.github.cyfko.hpl.core.ast.expr.Expression;
import io.github.cyfko.hpl.core.ast.expr.Not;
import io.github.cyfko.hpl.core.ast.expr.Or;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Boolean algebra over predicate expressions.
 * <p>
 * Only {@link BoolValue}, {@link Not}, {@link And} and {@link Or} are interpreted. Every other
 * expression (a comparison, a quantifier, a field read, a function call) is a leaf whose truth
 * is supplied by the caller. Implication and equivalence have no node of their own: they are
 * built from the connectives by {@link #implies} and {@link #iff}.
 * </p>
 * <p>
 * Simplification applies these laws until nothing changes:
 * </p>
 * <ul>
 *   <li>Constant negation: !⊤ → ⊥, !⊥ → ⊤, !? → ?</li>
 *   <li>Double negation: !!A → A</li>
 *   <li>Flattening: A & (B & C) → A & B & C</li>
 *   <li>Identity: A & ⊤ → A, A | ⊥ → A</li>
 *   <li>Annihilation: A & ⊥ → ⊥, A | ⊤ → ⊤</li>
 *   <li>Idempotence: A & A → A, A | A → A</li>
 *   <li>Cancellation: A & !A → ⊥, A | !A → ⊤, unless A holds an unknown constant</li>
 *   <li>Collapse: a connective left with one operand is that operand, with none its identity</li>
 * </ul>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * Expression a = new Comparison(ComparisonOperator.GT, FieldAccess.self("x"), Literal.of(0));
 * Expression e = And.of(BoolValue.ofTrue(), Or.of(a, new Not(a.duplicate())));
 * LogicEngine.simplify(e); // True
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class LogicEngine {

    private static final Logger log = Logger.getLogger(LogicEngine.class.getName());

    static final int MAX_ITERATIONS = 100;

    private LogicEngine() {}

    /**
     * Builds the negation of an expression. The operand is attached to the result.
     */
    public static Expression negate(Expression expression) {
        return new Not(expression);
    }

    /**
     * Builds the conjunction of expressions. The operands are attached to the result.
     */
    public static Expression conjoin(Expression first, Expression... rest) {
        return And.of(first, rest);
    }

    public static Expression conjoin(List<? extends Expression> operands) {
        return new And(operands);
    }

    /**
     * Builds the disjunction of expressions. The operands are attached to the result.
     */
    public static Expression disjoin(Expression first, Expression... rest) {
        return Or.of(first, rest);
    }

    public static Expression disjoin(List<? extends Expression> operands) {
        return new Or(operands);
    }

    /**
     * Builds {@code !a | b}. Both operands are attached to the result.
     */
    public static Expression implies(Expression antecedent, Expression consequent) {
        return new Or(Arrays.asList(new Not(antecedent), consequent));
    }

    /**
     * Builds {@code (!a | b) & (!b | a)}.
     * <p>
     * Both operands are attached to the first implication, the second one holds duplicates.
     * </p>
     */
    public static Expression iff(Expression left, Expression right) {
        Objects.requireNonNull(left, "left operand is required");
        Objects.requireNonNull(right, "right operand is required");
        Expression leftCopy = left.duplicate();
        Expression rightCopy = right.duplicate();
        return new And(Arrays.asList(implies(left, right), implies(rightCopy, leftCopy)));
    }

    /**
     * Simplifies an expression.
     * <p>
     * The input is left untouched: the result is built from a duplicate. The result is
     * equivalent to the input for every assignment of the leaves, and simplifying it again
     * yields a structurally equal tree.
     * </p>
     *
     * @param expression the expression to simplify
     * @return a new, simplified expression
     */
    public static Expression simplify(Expression expression) {
        Objects.requireNonNull(expression, "expression is required");
        Expression current = expression.duplicate();
        for (int i = 0; i < MAX_ITERATIONS; i++) {
            Expression next = simplifyOnce(current.duplicate());
            if (next.structurallyEquals(current)) {
                return next;
            }
            current = next;
        }
        log.warning(() -> String.format("Simplification stopped after %d iterations on %s", MAX_ITERATIONS, expression));
        return current;
    }

    /**
     * Evaluates an expression in Kleene three-valued logic.
     *
     * @param expression the expression to evaluate
     * @param leaves     truth of each leaf, see {@link #isLeaf(Expression)}
     * @return the truth of the expression; an empty slot is unknown
     */
    public static TruthValue evaluate(Expression expression, Function<Expression, TruthValue> leaves) {
        Objects.requireNonNull(leaves, "leaf assignment is required");
        if (expression == null) {
            return TruthValue.UNKNOWN;
        }
        if (expression instanceof BoolValue b) {
            return b.value();
        }
        if (expression instanceof Not not) {
            return evaluate(not.operand(), leaves).not();
        }
        if (expression instanceof And and) {
            TruthValue result = TruthValue.TRUE;
            for (Expression operand : and.operands()) {
                result = result.and(evaluate(operand, leaves));
            }
            return result;
        }
        if (expression instanceof Or or) {
            TruthValue result = TruthValue.FALSE;
            for (Expression operand : or.operands()) {
                result = result.or(evaluate(operand, leaves));
            }
            return result;
        }
        TruthValue value = leaves.apply(expression);
        return value == null ? TruthValue.UNKNOWN : value;
    }

    /**
     * @return {@code true} unless the expression is a constant, a negation or a connective
     */
    public static boolean isLeaf(Expression expression) {
        return !(expression instanceof BoolValue || expression instanceof Not || expression instanceof Connective);
    }

    /**
     * Lists the leaves of an expression, left to right.
     */
    public static List<Expression> leaves(Expression expression) {
        List<Expression> result = new ArrayList<>();
        collectLeaves(expression, result);
        return result;
    }

    private static void collectLeaves(Expression expression, List<Expression> sink) {
        if (expression == null || expression instanceof BoolValue) {
            return;
        }
        if (expression instanceof Not not) {
            collectLeaves(not.operand(), sink);
        } else if (expression instanceof Connective connective) {
            for (Expression operand : connective.operands()) {
                collectLeaves(operand, sink);
            }
        } else {
            sink.add(expression);
        }
    }

    private static Expression simplifyOnce(Expression expression) {
        if (expression instanceof Not not) {
            return simplifyNot(not);
        }
        if (expression instanceof Connective connective) {
            return simplifyConnective(connective);
        }
        return expression;
    }

    private static Expression simplifyNot(Not not) {
        Expression operand = not.operand();
        if (operand == null) {
            return not;
        }
        Expression inner = simplifyOnce(operand);
        if (inner instanceof BoolValue b) {
            return new BoolValue(b.value().not());
        }
        if (inner instanceof Not doubleNegation && doubleNegation.operand() != null) {
            return doubleNegation.operand();
        }
        not.setOperand(inner);
        return not;
    }

    private static Expression simplifyConnective(Connective connective) {
        boolean conjunction = connective instanceof And;
        TruthValue identity = conjunction ? TruthValue.TRUE : TruthValue.FALSE;
        TruthValue annihilator = conjunction ? TruthValue.FALSE : TruthValue.TRUE;

        List<Expression> flat = new ArrayList<>();
        for (Expression operand : List.copyOf(connective.operands())) {
            Expression simplified = simplifyOnce(operand);
            if (simplified.getClass() == connective.getClass()) {
                flat.addAll(((Connective) simplified).operands());
            } else {
                flat.add(simplified);
            }
        }

        List<Expression> kept = new ArrayList<>();
        for (Expression operand : flat) {
            if (operand instanceof BoolValue b) {
                if (b.value() == annihilator) {
                    return new BoolValue(annihilator);
                }
                if (b.value() == identity) {
                    continue;
                }
            }
            if (kept.stream().noneMatch(k -> k.structurallyEquals(operand))) {
                kept.add(operand);
            }
        }

        for (Expression operand : kept) {
            if (operand instanceof Not not && not.operand() != null && !holdsUnknown(not.operand())) {
                Expression complement = not.operand();
                if (kept.stream().anyMatch(k -> k.structurallyEquals(complement))) {
                    return new BoolValue(annihilator);
                }
            }
        }

        if (kept.isEmpty()) {
            return new BoolValue(identity);
        }
        if (kept.size() == 1) {
            return kept.get(0);
        }
        return conjunction ? new And(kept) : new Or(kept);
    }

    private static boolean holdsUnknown(Expression expression) {
        return AstWalker.preorder(expression)
                .anyMatch(node -> node instanceof BoolValue b && b.value() == TruthValue.UNKNOWN);
    }
}
