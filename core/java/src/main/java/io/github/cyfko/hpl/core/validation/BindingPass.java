package io.github.cyfko.hpl.core.validation;

import io.github.cyfko.hpl.core.api.AstNode;
import io.github.cyfko.hpl.core.api.Diagnostic;
import io.github.cyfko.hpl.core.api.DiagnosticCode;
import io.github.cyfko.hpl.core.ast.Property;
import io.github.cyfko.hpl.core.ast.expr.FieldAccess;
import io.github.cyfko.hpl.core.ast.expr.Quantifier;
import io.github.cyfko.hpl.core.ast.expr.VariableReference;
import io.github.cyfko.hpl.core.ast.event.AtomicEvent;
import io.github.cyfko.hpl.core.ast.event.Event;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the alias table of a property and checks every alias reference against it.
 * <p>
 * Events bind in this order: activator, trigger, behaviour, terminator. An event may read the
 * aliases bound before it, except the terminator, which only sees the activator's aliases since
 * it may close the scope before the pattern events ever happen.
 * </p>
 * <p>
 * Quantified variables are checked in the same pass: each read must sit in the condition of a
 * quantifier of that variable, and a nested quantifier may not rebind it.
 * </p>
 */
final class BindingPass {

    private final Property property;
    private final Map<String, Event> bindings = new LinkedHashMap<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    private BindingPass(Property property) {
        this.property = property;
    }

    static BindingPass run(Property property) {
        BindingPass pass = new BindingPass(property);
        pass.walk();
        return pass;
    }

    List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    AliasTable aliasTable() {
        return new AliasTable(bindings);
    }

    private void walk() {
        Optional<Event> activator = Optional.ofNullable(property.scope()).flatMap(scope -> scope.activator());
        Optional<Event> terminator = Optional.ofNullable(property.scope()).flatMap(scope -> scope.terminator());

        activator.ifPresent(event -> {
            checkReferences(event, Set.of());
            bind(event);
        });
        Set<String> scopeAliases = Set.copyOf(bindings.keySet());

        property.trigger().ifPresent(event -> {
            checkReferences(event, bindings.keySet());
            bind(event);
        });
        if (property.behaviour() != null) {
            checkReferences(property.behaviour(), bindings.keySet());
            bind(property.behaviour());
        }
        terminator.ifPresent(event -> {
            checkReferences(event, scopeAliases);
            bind(event);
        });

        for (Event event : property.events()) {
            for (AtomicEvent atomic : event.atomicEvents()) {
                if (atomic.predicate() != null) {
                    checkVariables(atomic.predicate(), Set.of(), Set.of());
                }
            }
        }
    }

    /**
     * @param bound   variables bound by the enclosing quantifier conditions
     * @param domains variables whose quantifier domain encloses the node
     */
    private void checkVariables(AstNode node, Set<String> bound, Set<String> domains) {
        if (node instanceof VariableReference reference) {
            String name = reference.name();
            if (!bound.contains(name)) {
                diagnostics.add(Diagnostic.of(DiagnosticCode.UNBOUND_VARIABLE, reference.id(), name,
                        domains.contains(name)
                                ? "Variable '" + name + "' cannot be read in the domain of its own quantifier"
                                : "Reference to unbound variable '" + name + "'"));
            }
            return;
        }
        if (node instanceof Quantifier quantifier) {
            String variable = quantifier.variable();
            if (bound.contains(variable)) {
                diagnostics.add(Diagnostic.of(DiagnosticCode.SHADOWED_VARIABLE, quantifier.id(), variable,
                        "Variable '" + variable + "' is already bound by an enclosing quantifier in " + quantifier));
            }
            if (quantifier.condition() != null && quantifier.boundReferences().isEmpty()) {
                diagnostics.add(Diagnostic.of(DiagnosticCode.UNUSED_VARIABLE, quantifier.id(), variable,
                        "Quantified variable '" + variable + "' is never used in " + quantifier));
            }
            if (quantifier.domain() != null) {
                checkVariables(quantifier.domain(), bound, with(domains, variable));
            }
            if (quantifier.condition() != null) {
                checkVariables(quantifier.condition(), with(bound, variable), domains);
            }
            return;
        }
        for (AstNode child : node.children()) {
            checkVariables(child, bound, domains);
        }
    }

    private static Set<String> with(Set<String> names, String name) {
        Set<String> extended = new HashSet<>(names);
        extended.add(name);
        return extended;
    }

    private void checkReferences(Event event, Set<String> visible) {
        for (AtomicEvent atomic : event.atomicEvents()) {
            if (atomic.predicate() == null) {
                continue;
            }
            String own = atomic.alias().orElse(null);
            Set<String> reported = new HashSet<>();
            for (FieldAccess access : atomic.predicate().fieldAccesses()) {
                if (access.readsOwnMessage(own)) {
                    continue;
                }
                String alias = access.alias().orElseThrow();
                if (!visible.contains(alias) && reported.add(alias)) {
                    diagnostics.add(Diagnostic.of(DiagnosticCode.UNBOUND_ALIAS, access.id(), alias,
                            "Reference to undefined alias '" + alias + "' in event on '" + atomic.channel() + "'"));
                }
            }
        }
    }

    private void bind(Event event) {
        for (String alias : event.aliases()) {
            List<AtomicEvent> binders = event.atomicEvents().stream()
                    .filter(atomic -> atomic.alias().map(alias::equals).orElse(false))
                    .toList();
            if (bindings.containsKey(alias)) {
                diagnostics.add(Diagnostic.of(DiagnosticCode.DUPLICATE_ALIAS, binders.get(0).id(), alias,
                        "Alias '" + alias + "' is already bound by another event"));
                continue;
            }
            bindings.put(alias, binders.size() == 1 ? binders.get(0) : event);
        }
    }
}
