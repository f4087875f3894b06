package io.github.cyfko.hpl.core.validation;

import io.github.cyfko.hpl.core.api.Diagnostic;
import io.github.cyfko.hpl.core.api.DiagnosticCode;
import io.github.cyfko.hpl.core.ast.Predicate;
import io.github.cyfko.hpl.core.ast.Property;
import io.github.cyfko.hpl.core.ast.event.AtomicEvent;
import io.github.cyfko.hpl.core.ast.event.Event;
import io.github.cyfko.hpl.core.config.PatternRules;

import java.util.ArrayList;
import java.util.List;

/**
 * Warnings about well-formed properties that most likely do not say what their author meant.
 */
final class PatternSanityPass {

    private PatternSanityPass() {
    }

    static List<Diagnostic> run(Property property, PatternRules rules, boolean warnOnIgnoredOwnMessage) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        if (rules.warnOnUnboundResponse()) {
            checkResponseBinding(property, diagnostics);
        }
        if (warnOnIgnoredOwnMessage) {
            checkOwnMessageReads(property, diagnostics);
        }
        return diagnostics;
    }

    private static void checkResponseBinding(Property property, List<Diagnostic> sink) {
        Event behaviour = property.behaviour();
        if (behaviour == null || property.trigger().isEmpty()) {
            return;
        }
        List<String> triggerAliases = property.trigger().get().aliases();
        boolean bound = triggerAliases.stream().anyMatch(behaviour::containsReference);
        if (!bound) {
            sink.add(Diagnostic.of(DiagnosticCode.SUSPICIOUS_UNBOUND_RESPONSE, behaviour.id(), property.pattern().name(),
                    triggerAliases.isEmpty()
                            ? "The trigger binds no alias, the response cannot depend on it"
                            : "The response references none of the trigger aliases " + triggerAliases));
        }
    }

    private static void checkOwnMessageReads(Property property, List<Diagnostic> sink) {
        for (Event event : property.events()) {
            for (AtomicEvent atomic : event.atomicEvents()) {
                Predicate predicate = atomic.predicate();
                if (predicate == null || predicate.isConstant()) {
                    continue;
                }
                if (!predicate.readsOwnMessage(atomic.alias().orElse(null))) {
                    sink.add(Diagnostic.of(DiagnosticCode.PREDICATE_IGNORES_OWN_MESSAGE, predicate.id(), atomic.channel(),
                            "The predicate of the event on '" + atomic.channel() + "' never reads its own message"));
                }
            }
        }
    }
}
