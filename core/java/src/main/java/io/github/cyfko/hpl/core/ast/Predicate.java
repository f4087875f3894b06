package io.github.cyfko.hpl.core.ast;

import io.github.cyfko.hpl.core.api.AstNode;
import io.github.cyfko.hpl.core.api.AstVisitor;
import io.github.cyfko.hpl.core.api.NodeId;
import io.github.cyfko.hpl.core.api.ValueType;
import io.github.cyfko.hpl.core.ast.expr.BoolValue;
import io.github.cyfko.hpl.core.ast.expr.Expression;
import io.github.cyfko.hpl.core.ast.expr.FieldAccess;
import io.github.cyfko.hpl.core.ast.expr.Not;
import io.github.cyfko.hpl.core.exception.AstConstructionException;
import io.github.cyfko.hpl.core.exception.ConstructionError;
import io.github.cyfko.hpl.core.logic.LogicEngine;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Boolean condition attached to an event, evaluated against the event's message.
 * <p>
 * The condition must possibly be boolean. A predicate is built over any expression whose type
 * set contains {@code BOOL}: comparisons, connectives, constants, but also field reads and
 * function calls, whose exact type is only known with a message schema.
 * </p>
 *
 * <pre>{@code
 * Predicate p = new Predicate(And.of(
 *     new Comparison(ComparisonOperator.GT, FieldAccess.self("speed"), Literal.of(0)),
 *     new Comparison(ComparisonOperator.EQ, FieldAccess.self("id"), FieldAccess.of("cmd", "id"))));
 *
 * p.referencedAliases();   // [cmd]
 * p.readsOwnMessage(null); // true
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Predicate extends AbstractAstNode {

    private Expression condition;

    public Predicate(Expression condition) {
        this.condition = attach(requireBoolean(condition), () -> this.condition = null);
    }

    private Predicate(Predicate source) {
        Expression copy = duplicateOrNull(source.condition);
        this.condition = copy == null ? null : attach(copy, () -> this.condition = null);
    }

    /**
     * @return the predicate that holds for every message
     */
    public static Predicate vacuous() {
        return new Predicate(BoolValue.ofTrue());
    }

    /**
     * @return the condition, {@code null} once it has moved to another parent
     */
    public Expression condition() {
        return condition;
    }

    public void setCondition(Expression condition) {
        checkMutable();
        Expression old = this.condition;
        if (old == condition) {
            return;
        }
        this.condition = attach(requireBoolean(condition), () -> this.condition = null);
        detach(old);
    }

    public boolean isVacuous() {
        return condition instanceof BoolValue b && b.isTrue();
    }

    /**
     * @return {@code true} if the condition is a logic constant
     */
    public boolean isConstant() {
        return condition instanceof BoolValue;
    }

    /**
     * @return the field accesses of the condition, in preorder
     */
    public List<FieldAccess> fieldAccesses() {
        return condition == null ? List.of() : AstWalker.collect(condition, FieldAccess.class);
    }

    /**
     * Collects the aliases read by the condition, in order of first occurrence.
     *
     * @return the referenced aliases, own alias included when used explicitly
     */
    public Set<String> referencedAliases() {
        Set<String> aliases = new LinkedHashSet<>();
        for (FieldAccess access : fieldAccesses()) {
            access.alias().ifPresent(aliases::add);
        }
        return Collections.unmodifiableSet(aliases);
    }

    public boolean references(String alias) {
        return fieldAccesses().stream().anyMatch(access -> access.alias().map(alias::equals).orElse(false));
    }

    /**
     * @param ownAlias alias of the enclosing event, may be {@code null}
     * @return {@code true} if at least one field access reads the enclosing event's message
     */
    public boolean readsOwnMessage(String ownAlias) {
        return fieldAccesses().stream().anyMatch(access -> access.readsOwnMessage(ownAlias));
    }

    /**
     * @return a new predicate holding exactly when this one does not
     */
    public Predicate negate() {
        return new Predicate(LogicEngine.simplify(new Not(requireCondition().duplicate())));
    }

    /**
     * @param other another predicate over the same message
     * @return a new predicate holding when both predicates hold
     */
    public Predicate join(Predicate other) {
        Objects.requireNonNull(other, "other predicate is required");
        return new Predicate(LogicEngine.simplify(
                LogicEngine.conjoin(requireCondition().duplicate(), other.requireCondition().duplicate())));
    }

    private Expression requireCondition() {
        if (condition == null) {
            throw new IllegalStateException("Predicate " + id() + " has no condition");
        }
        return condition;
    }

    private static Expression requireBoolean(Expression condition) {
        Objects.requireNonNull(condition, "condition is required");
        if (!condition.canBeBoolean()) {
            throw new AstConstructionException(ConstructionError.NOT_BOOLEAN, condition.toString(),
                    "Predicate condition must be boolean, got " + ValueType.describe(condition.possibleTypes()));
        }
        return condition;
    }

    @Override
    public List<AstNode> children() {
        return condition == null ? List.of() : List.of(condition);
    }

    @Override
    public Predicate duplicate() {
        return new Predicate(this);
    }

    @Override
    public boolean structurallyEquals(AstNode other) {
        return other instanceof Predicate p && sameNode(condition, p.condition);
    }

    @Override
    public void replaceChild(NodeId oldId, AstNode newNode) {
        checkMutable();
        if (!isNode(condition, oldId)) {
            throw notAChild(oldId);
        }
        setCondition(requireKind(newNode, Expression.class, "condition"));
    }

    @Override
    public List<String> missingSlots() {
        return condition == null ? List.of("condition") : List.of();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitPredicate(this);
    }

    @Override
    public String toString() {
        return "{ " + condition + " }";
    }
}
