package io.github.cyfko.hpl.core.validation;

import io.github.cyfko.hpl.core.api.AstNode;
import io.github.cyfko.hpl.core.api.Diagnostic;
import io.github.cyfko.hpl.core.api.DiagnosticCode;
import io.github.cyfko.hpl.core.api.ValueType;
import io.github.cyfko.hpl.core.ast.Predicate;
import io.github.cyfko.hpl.core.ast.Property;
import io.github.cyfko.hpl.core.ast.event.AtomicEvent;
import io.github.cyfko.hpl.core.ast.event.Event;
import io.github.cyfko.hpl.core.ast.expr.Expression;
import io.github.cyfko.hpl.core.ast.expr.FieldAccess;
import io.github.cyfko.hpl.core.ast.expr.Quantifier;
import io.github.cyfko.hpl.core.ast.expr.TypingContext;
import io.github.cyfko.hpl.core.ast.expr.VariableReference;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks that every read of one field, or of one quantified variable, agrees on a type within
 * a predicate.
 * <p>
 * Each read is constrained by the slot holding it: {@code speed > 0} reads a number and
 * {@code speed = "fast"} a string, so a predicate with both reads is reported even though each
 * comparison is fine on its own. A quantified variable is also checked against the elements of
 * its domain.
 * </p>
 */
final class ReferenceTypes {

    private final String ownAlias;
    private final TypingContext context;
    private final Map<Object, Group> groups = new LinkedHashMap<>();

    private ReferenceTypes(String ownAlias, TypingContext context) {
        this.ownAlias = ownAlias;
        this.context = context;
    }

    static void check(Property property, TypingContext context, List<Diagnostic> sink) {
        for (Event event : property.events()) {
            for (AtomicEvent atomic : event.atomicEvents()) {
                Predicate predicate = atomic.predicate();
                if (predicate == null) {
                    continue;
                }
                ReferenceTypes check = new ReferenceTypes(atomic.alias().orElse(null), context);
                check.collect(predicate, null, Map.of());
                for (Group group : check.groups.values()) {
                    group.report(context, sink);
                }
            }
        }
    }

    private void collect(AstNode node, AstNode parent, Map<String, Quantifier> scope) {
        if (node instanceof FieldAccess access) {
            String key = access.readsOwnMessage(ownAlias)
                    ? access.dottedPath()
                    : "@" + access.alias().orElseThrow() + "." + access.dottedPath();
            groups.computeIfAbsent(key, k -> new Group((String) k, access.possibleTypes(context), false))
                    .uses.add(new Use(access, parent));
            return;
        }
        if (node instanceof VariableReference reference) {
            Quantifier binder = scope.get(reference.name());
            if (binder != null) {
                groups.computeIfAbsent(binder, b -> new Group(reference.name(), binder.elementTypes(context), true))
                        .uses.add(new Use(reference, parent));
            }
            return;
        }
        if (node instanceof Quantifier quantifier) {
            if (quantifier.domain() != null) {
                collect(quantifier.domain(), quantifier, scope);
            }
            if (quantifier.condition() != null) {
                Map<String, Quantifier> inner = new HashMap<>(scope);
                inner.put(quantifier.variable(), quantifier);
                collect(quantifier.condition(), quantifier, inner);
            }
            return;
        }
        for (AstNode child : node.children()) {
            collect(child, node, scope);
        }
    }

    private record Use(Expression reference, AstNode parent) {

        Set<ValueType> expected(TypingContext context) {
            if (parent instanceof Expression expression) {
                return expression.acceptedTypes(reference, context);
            }
            return parent instanceof Predicate ? ValueType.of(ValueType.BOOL) : ValueType.any();
        }
    }

    private static final class Group {

        private final String label;
        private final Set<ValueType> base;
        private final boolean variable;
        private final List<Use> uses = new ArrayList<>();

        Group(String label, Set<ValueType> base, boolean variable) {
            this.label = label;
            this.base = base;
            this.variable = variable;
        }

        void report(TypingContext context, List<Diagnostic> sink) {
            Set<ValueType> agreed = base;
            for (Use use : uses) {
                Set<ValueType> expected = use.expected(context);
                if (!ValueType.overlaps(base, expected)) {
                    // a field read that fits no slot type is already reported by its operator
                    if (variable) {
                        sink.add(Diagnostic.of(DiagnosticCode.TYPE_MISMATCH, use.reference().id(), label,
                                "Variable '" + label + "' takes " + ValueType.describe(base)
                                        + " values but is used as " + ValueType.describe(expected)));
                    }
                    continue;
                }
                Set<ValueType> next = ValueType.intersect(agreed, expected);
                if (next.isEmpty()) {
                    sink.add(Diagnostic.of(DiagnosticCode.TYPE_MISMATCH, use.reference().id(), label,
                            "'" + label + "' is used both as " + ValueType.describe(agreed)
                                    + " and as " + ValueType.describe(expected)));
                    return;
                }
                agreed = next;
            }
        }
    }
}
