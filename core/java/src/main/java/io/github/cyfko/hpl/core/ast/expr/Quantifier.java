package io.github.cyfko.hpl.core.ast.expr;

import io.github.cyfko.hpl.core.api.AstNode;
import io.github.cyfko.hpl.core.api.AstVisitor;
import io.github.cyfko.hpl.core.api.Diagnostic;
import io.github.cyfko.hpl.core.api.NodeId;
import io.github.cyfko.hpl.core.api.QuantifierKind;
import io.github.cyfko.hpl.core.api.ValueType;
import io.github.cyfko.hpl.core.exception.AstConstructionException;
import io.github.cyfko.hpl.core.exception.ConstructionError;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Boolean quantification of a variable over the elements of a domain.
 * <p>
 * The variable is visible in the condition only. Reading it in the domain, rebinding it in a
 * nested quantifier, and never reading it are validation problems, not construction errors.
 * </p>
 *
 * <pre>{@code
 * // forall i in [0 to 3]: ranges[i] > 0.1
 * new Quantifier(QuantifierKind.FORALL, "i", RangeValue.closed(Literal.of(0), Literal.of(3)),
 *     new Comparison(ComparisonOperator.GT,
 *         new ArrayAccess(FieldAccess.self("ranges"), VariableReference.of("i")),
 *         Literal.of(0.1)));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Quantifier extends Expression {

    private final QuantifierKind kind;
    private final String variable;
    private Expression domain;
    private Expression condition;

    public Quantifier(QuantifierKind kind, String variable, Expression domain, Expression condition) {
        this.kind = Objects.requireNonNull(kind, "kind is required");
        if (variable == null || variable.isBlank()) {
            throw new AstConstructionException(ConstructionError.BLANK_VARIABLE, variable,
                    "'" + kind.getKeyword() + "' needs a variable name");
        }
        Objects.requireNonNull(domain, "domain is required");
        Objects.requireNonNull(condition, "condition is required");
        this.variable = variable;
        this.domain = attach(domain, () -> this.domain = null);
        this.condition = attach(condition, () -> this.condition = null);
    }

    private Quantifier(Quantifier source) {
        this.kind = source.kind;
        this.variable = source.variable;
        Expression d = duplicateOrNull(source.domain);
        Expression c = duplicateOrNull(source.condition);
        this.domain = d == null ? null : attach(d, () -> this.domain = null);
        this.condition = c == null ? null : attach(c, () -> this.condition = null);
    }

    public static Quantifier forall(String variable, Expression domain, Expression condition) {
        return new Quantifier(QuantifierKind.FORALL, variable, domain, condition);
    }

    public static Quantifier exists(String variable, Expression domain, Expression condition) {
        return new Quantifier(QuantifierKind.EXISTS, variable, domain, condition);
    }

    public QuantifierKind kind() {
        return kind;
    }

    public boolean isUniversal() {
        return kind == QuantifierKind.FORALL;
    }

    public boolean isExistential() {
        return kind == QuantifierKind.EXISTS;
    }

    public String variable() {
        return variable;
    }

    public Expression domain() {
        return domain;
    }

    public Expression condition() {
        return condition;
    }

    public void setDomain(Expression domain) {
        checkMutable();
        Objects.requireNonNull(domain, "domain is required");
        Expression old = this.domain;
        if (old == domain) {
            return;
        }
        this.domain = attach(domain, () -> this.domain = null);
        detach(old);
    }

    public void setCondition(Expression condition) {
        checkMutable();
        Objects.requireNonNull(condition, "condition is required");
        Expression old = this.condition;
        if (old == condition) {
            return;
        }
        this.condition = attach(condition, () -> this.condition = null);
        detach(old);
    }

    /**
     * Computes the types the variable takes over the domain.
     * <p>
     * A range yields numbers and a set yields the primitive types of its elements. Any other
     * domain, an array field for instance, yields every primitive type.
     * </p>
     *
     * @param context source of field and function return types
     * @return the possible types of the variable
     */
    public Set<ValueType> elementTypes(TypingContext context) {
        if (domain instanceof RangeValue) {
            return ValueType.of(ValueType.NUMBER);
        }
        if (domain instanceof SetValue set && !set.elements().isEmpty()) {
            EnumSet<ValueType> types = EnumSet.noneOf(ValueType.class);
            for (Expression element : set.elements()) {
                types.addAll(element.possibleTypes(context));
            }
            types.retainAll(ValueType.primitive());
            if (!types.isEmpty()) {
                return types;
            }
        }
        return ValueType.primitive();
    }

    /**
     * Lists the references to the variable that this quantifier binds, in preorder.
     * <p>
     * References in the domain are not bound here, and neither are references in the condition
     * of a nested quantifier of the same variable.
     * </p>
     *
     * @return the bound references
     */
    public List<VariableReference> boundReferences() {
        List<VariableReference> references = new ArrayList<>();
        collectReferences(condition, references);
        return references;
    }

    private void collectReferences(AstNode node, List<VariableReference> sink) {
        if (node == null) {
            return;
        }
        if (node instanceof VariableReference reference) {
            if (reference.name().equals(variable)) {
                sink.add(reference);
            }
            return;
        }
        if (node instanceof Quantifier nested && nested.variable.equals(variable)) {
            collectReferences(nested.domain, sink);
            return;
        }
        for (AstNode child : node.children()) {
            collectReferences(child, sink);
        }
    }

    @Override
    public Set<ValueType> possibleTypes(TypingContext context) {
        return ValueType.of(ValueType.BOOL);
    }

    @Override
    public List<Diagnostic> checkOperandTypes(TypingContext context) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        String owner = "'" + kind.getKeyword() + "'";
        requireOperand(domain, ValueType.composite(), "domain", owner, this, context, diagnostics);
        requireOperand(condition, ValueType.of(ValueType.BOOL), "condition", owner, this, context, diagnostics);
        return diagnostics;
    }

    @Override
    public Set<ValueType> acceptedTypes(Expression operand, TypingContext context) {
        if (operand == domain) {
            return ValueType.composite();
        }
        return operand == condition ? ValueType.of(ValueType.BOOL) : ValueType.any();
    }

    @Override
    public List<AstNode> children() {
        List<AstNode> children = new ArrayList<>(2);
        if (domain != null) {
            children.add(domain);
        }
        if (condition != null) {
            children.add(condition);
        }
        return List.copyOf(children);
    }

    @Override
    public Quantifier duplicate() {
        return new Quantifier(this);
    }

    @Override
    public boolean structurallyEquals(AstNode other) {
        return other instanceof Quantifier q
                && q.kind == kind
                && q.variable.equals(variable)
                && sameNode(domain, q.domain)
                && sameNode(condition, q.condition);
    }

    @Override
    public void replaceChild(NodeId oldId, AstNode newNode) {
        checkMutable();
        if (isNode(domain, oldId)) {
            setDomain(requireKind(newNode, Expression.class, "domain"));
        } else if (isNode(condition, oldId)) {
            setCondition(requireKind(newNode, Expression.class, "condition"));
        } else {
            throw notAChild(oldId);
        }
    }

    @Override
    public List<String> missingSlots() {
        List<String> missing = new ArrayList<>(2);
        if (domain == null) {
            missing.add("domain");
        }
        if (condition == null) {
            missing.add("condition");
        }
        return missing;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitQuantifier(this);
    }

    @Override
    public String toString() {
        return "(" + kind.getKeyword() + " " + variable + " in " + domain + ": " + condition + ")";
    }
}
