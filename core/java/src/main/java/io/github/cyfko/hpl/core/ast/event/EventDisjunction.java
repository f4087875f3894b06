package io.github.cyfko.hpl.core.ast.event;

import io.github.cyfko.hpl.core.api.AstNode;
import io.github.cyfko.hpl.core.api.AstVisitor;
import io.github.cyfko.hpl.core.api.NodeId;
import io.github.cyfko.hpl.core.exception.AstConstructionException;
import io.github.cyfko.hpl.core.exception.ConstructionError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Choice between events: whichever fires first.
 * <p>
 * A disjunction holds at least two events and no channel appears twice among its atomic events,
 * nested disjunctions included. Both rules are checked at construction. Edits made afterwards
 * may break them, which validation then reports.
 * </p>
 * <p>
 * Several disjuncts may bind the same alias: the alias then denotes whichever message fired.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class EventDisjunction extends Event {

    private final List<Event> events = new ArrayList<>();

    public EventDisjunction(List<? extends Event> events) {
        Objects.requireNonNull(events, "events are required");
        if (events.size() < 2) {
            throw new AstConstructionException(ConstructionError.INVALID_DISJUNCTION_ARITY, String.valueOf(events.size()),
                    "An event disjunction needs at least 2 events, got " + events.size());
        }
        requireDistinctInstances(events, "events");
        Set<String> duplicates = duplicateChannels(events.stream()
                .flatMap(event -> event.channels().stream())
                .toList());
        if (!duplicates.isEmpty()) {
            String channel = duplicates.iterator().next();
            throw new AstConstructionException(ConstructionError.NON_UNIQUE_DISJUNCT_CHANNEL, channel,
                    "Channel '" + channel + "' appears multiple times in an event disjunction");
        }
        for (Event event : List.copyOf(events)) {
            attach(event, removalFrom(this.events, event));
            this.events.add(event);
        }
    }

    private EventDisjunction(EventDisjunction source) {
        for (Event event : source.events) {
            Event copy = event.duplicate();
            attach(copy, removalFrom(events, copy));
            events.add(copy);
        }
    }

    public static EventDisjunction of(Event first, Event second, Event... rest) {
        List<Event> all = new ArrayList<>();
        all.add(first);
        all.add(second);
        Collections.addAll(all, rest);
        return new EventDisjunction(all);
    }

    /**
     * @return a read-only view of the disjuncts, in order
     */
    public List<Event> events() {
        return Collections.unmodifiableList(events);
    }

    /**
     * @return the channels listed more than once among the atomic events, in order of first repeat
     */
    public Set<String> duplicateChannels() {
        return duplicateChannels(channels());
    }

    private static Set<String> duplicateChannels(List<String> channels) {
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (String channel : channels) {
            if (!seen.add(channel)) {
                duplicates.add(channel);
            }
        }
        return duplicates;
    }

    @Override
    public List<String> aliases() {
        return events.stream()
                .flatMap(event -> event.aliases().stream())
                .distinct()
                .toList();
    }

    @Override
    public Set<String> externalReferences() {
        Set<String> references = new LinkedHashSet<>();
        for (Event event : events) {
            references.addAll(event.externalReferences());
        }
        return Collections.unmodifiableSet(references);
    }

    @Override
    public List<AtomicEvent> atomicEvents() {
        return events.stream()
                .flatMap(event -> event.atomicEvents().stream())
                .toList();
    }

    @Override
    public List<AstNode> children() {
        return List.copyOf(events);
    }

    @Override
    public EventDisjunction duplicate() {
        return new EventDisjunction(this);
    }

    @Override
    public boolean structurallyEquals(AstNode other) {
        return other instanceof EventDisjunction d && sameNodes(events, d.events);
    }

    @Override
    public void replaceChild(NodeId oldId, AstNode newNode) {
        checkMutable();
        if (!replaceIn(events, oldId, requireKind(newNode, Event.class, "event"))) {
            throw notAChild(oldId);
        }
    }

    @Override
    public List<String> missingSlots() {
        return List.of();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitEventDisjunction(this);
    }

    @Override
    public String toString() {
        return events.stream().map(String::valueOf).collect(Collectors.joining(" or ", "(", ")"));
    }
}
