package io.github.cyfko.hpl.core.ast.event;

import io.github.cyfko.hpl.core.ast.AbstractAstNode;

import java.util.List;
import java.util.Set;

/**
 * Something that happens on one or more channels: a single publication or a choice of them.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract sealed class Event extends AbstractAstNode permits AtomicEvent, EventDisjunction {

    Event() {
    }

    /**
     * @return the aliases bound by this event, distinct, in order
     */
    public abstract List<String> aliases();

    /**
     * @return the aliases read by the predicates of this event and not bound by the same atomic event
     */
    public abstract Set<String> externalReferences();

    /**
     * @return the atomic events of this event, left to right
     */
    public abstract List<AtomicEvent> atomicEvents();

    /**
     * @return the channels of the atomic events, left to right, duplicates kept
     */
    public List<String> channels() {
        return atomicEvents().stream().map(AtomicEvent::channel).toList();
    }

    /**
     * @param alias an alias
     * @return {@code true} if a predicate of this event reads that alias explicitly
     */
    public boolean containsReference(String alias) {
        return atomicEvents().stream()
                .anyMatch(event -> event.predicate() != null && event.predicate().references(alias));
    }

    public boolean isDisjunction() {
        return this instanceof EventDisjunction;
    }

    @Override
    public abstract Event duplicate();
}
