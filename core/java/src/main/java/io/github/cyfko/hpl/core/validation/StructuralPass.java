package io.github.cyfko.hpl.core.validation;

import io.github.cyfko.hpl.core.api.AstNode;
import io.github.cyfko.hpl.core.api.Diagnostic;
import io.github.cyfko.hpl.core.api.DiagnosticCode;
import io.github.cyfko.hpl.core.ast.AstWalker;
import io.github.cyfko.hpl.core.ast.PatternKind;
import io.github.cyfko.hpl.core.ast.Property;
import io.github.cyfko.hpl.core.ast.event.AtomicEvent;
import io.github.cyfko.hpl.core.ast.event.Event;
import io.github.cyfko.hpl.core.ast.event.EventDisjunction;
import io.github.cyfko.hpl.core.ast.expr.Expression;
import io.github.cyfko.hpl.core.ast.expr.FieldAccess;
import io.github.cyfko.hpl.core.ast.expr.FunctionCall;
import io.github.cyfko.hpl.core.ast.expr.TypingContext;
import io.github.cyfko.hpl.core.config.PatternRules;
import io.github.cyfko.hpl.core.spi.FunctionRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Checks the shape of a property tree: empty slots, disjunctions, operand and argument types,
 * agreement of the reads of one field, pattern slots and, with message schemas, field existence.
 */
final class StructuralPass {

    private StructuralPass() {
    }

    static List<Diagnostic> run(Property property, PatternRules rules, FunctionRegistry registry,
                                TypingContext context, SchemaTypingContext schemas) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        List<AstNode> nodes = AstWalker.preorder(property).toList();
        Set<AstNode> nested = nestedDisjunctions(nodes);

        for (AstNode node : nodes) {
            for (String slot : node.missingSlots()) {
                diagnostics.add(Diagnostic.of(DiagnosticCode.MISSING_CHILD, node.id(), slot,
                        node.getClass().getSimpleName() + " " + node.id() + " has no " + slot));
            }
            if (node instanceof EventDisjunction disjunction) {
                checkDisjunction(disjunction, !nested.contains(disjunction), diagnostics);
            }
            if (node instanceof Expression expression) {
                diagnostics.addAll(expression.checkOperandTypes(context));
            }
            if (node instanceof FunctionCall call) {
                diagnostics.addAll(registry.typecheck(call, context));
            }
            if (schemas != null && node instanceof FieldAccess access && schemas.isUnknownField(access)) {
                diagnostics.add(Diagnostic.of(DiagnosticCode.UNKNOWN_FIELD, access.id(), access.dottedPath(),
                        "Field '" + access.dottedPath() + "' does not exist in the message read by '" + access + "'"));
            }
        }

        ReferenceTypes.check(property, context, diagnostics);
        checkPatternSlots(property, rules, diagnostics);
        if (schemas != null) {
            checkChannelSchemas(property, schemas, diagnostics);
        }
        return diagnostics;
    }

    private static Set<AstNode> nestedDisjunctions(List<AstNode> nodes) {
        Set<AstNode> nested = Collections.newSetFromMap(new IdentityHashMap<>());
        for (AstNode node : nodes) {
            if (node instanceof EventDisjunction disjunction) {
                for (Event event : disjunction.events()) {
                    if (event instanceof EventDisjunction) {
                        nested.add(event);
                    }
                }
            }
        }
        return nested;
    }

    private static void checkDisjunction(EventDisjunction disjunction, boolean outermost, List<Diagnostic> sink) {
        int arity = disjunction.events().size();
        if (arity < 2) {
            sink.add(Diagnostic.of(DiagnosticCode.INVALID_DISJUNCTION_ARITY, disjunction.id(), String.valueOf(arity),
                    "An event disjunction needs at least 2 events, got " + arity));
        }
        // nested disjunctions are covered by the channels of their outermost disjunction
        if (outermost) {
            for (String channel : disjunction.duplicateChannels()) {
                sink.add(Diagnostic.of(DiagnosticCode.NON_UNIQUE_DISJUNCT_CHANNEL, disjunction.id(), channel,
                        "Channel '" + channel + "' appears multiple times in an event disjunction"));
            }
        }
    }

    private static void checkPatternSlots(Property property, PatternRules rules, List<Diagnostic> sink) {
        PatternKind pattern = property.pattern();
        if (pattern.requiresTrigger() && property.trigger().isEmpty()) {
            sink.add(Diagnostic.of(DiagnosticCode.MISSING_TRIGGER, property.id(), pattern.name(),
                    "Pattern " + pattern + " requires a trigger"));
        }
        if (!pattern.requiresTrigger() && property.trigger().isPresent()) {
            sink.add(Diagnostic.of(DiagnosticCode.UNEXPECTED_TRIGGER, property.trigger().get().id(), pattern.name(),
                    "Pattern " + pattern + " does not accept a trigger"));
        }
        property.trigger()
                .filter(trigger -> trigger.isDisjunction() && !rules.allowTriggerDisjunction())
                .ifPresent(trigger -> sink.add(Diagnostic.of(DiagnosticCode.DISJUNCTION_NOT_ALLOWED, trigger.id(),
                        "trigger", "Pattern " + pattern + " does not accept an event disjunction as trigger")));
        Event behaviour = property.behaviour();
        if (behaviour != null && behaviour.isDisjunction() && !rules.allowBehaviourDisjunction()) {
            sink.add(Diagnostic.of(DiagnosticCode.DISJUNCTION_NOT_ALLOWED, behaviour.id(), "behaviour",
                    "Pattern " + pattern + " does not accept an event disjunction as behaviour"));
        }
    }

    private static void checkChannelSchemas(Property property, SchemaTypingContext schemas, List<Diagnostic> sink) {
        for (Event event : property.events()) {
            for (AtomicEvent atomic : event.atomicEvents()) {
                if (schemas.schemaOf(atomic.channel()).isEmpty()) {
                    sink.add(Diagnostic.of(DiagnosticCode.UNKNOWN_CHANNEL_SCHEMA, atomic.id(), atomic.channel(),
                            "No message schema for channel '" + atomic.channel() + "', fields are not checked"));
                }
            }
        }
    }
}
