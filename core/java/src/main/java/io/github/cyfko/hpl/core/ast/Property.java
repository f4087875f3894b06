package io.github.cyfko.hpl.core.ast;

import io.github.cyfko.hpl.core.api.AstNode;
import io.github.cyfko.hpl.core.api.AstVisitor;
import io.github.cyfko.hpl.core.api.NodeId;
import io.github.cyfko.hpl.core.ast.event.Event;
import io.github.cyfko.hpl.core.exception.AstConstructionException;
import io.github.cyfko.hpl.core.exception.ConstructionError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A behavioural property: a pattern instantiated within a scope.
 * <p>
 * The property owns every event of its tree. Patterns with a trigger (response, requirement,
 * prevention) are built with one, patterns without (existence, absence) are built without;
 * the time window bounds how long after the trigger, or after the scope opens, the behaviour
 * is observed.
 * </p>
 *
 * <h2>Building</h2>
 * <pre>{@code
 * Property property = Property.builder(PatternKind.REQUIREMENT)
 *     .scope(Scope.globally())
 *     .trigger(AtomicEvent.on("/cmd", Predicate.vacuous(), "c"))
 *     .behaviour(AtomicEvent.on("/ack", ackPredicate))
 *     .within(0.0, 2.0)
 *     .metadata("id", "ack-after-cmd")
 *     .build();
 * }</pre>
 *
 * <h2>Equality</h2>
 * <p>
 * Structural equality covers the pattern, the time window, the scope and the events.
 * Metadata is descriptive and takes no part in it.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Property extends AbstractAstNode {

    /** Upper bound of a time window without limit. */
    public static final double UNBOUNDED = Double.POSITIVE_INFINITY;

    private final PatternKind pattern;
    private final Map<String, Object> metadata;
    private Scope scope;
    private Event trigger;
    private Event behaviour;
    private double minTime;
    private double maxTime;

    private Property(Builder builder) {
        this.pattern = Objects.requireNonNull(builder.pattern, "pattern is required");
        Objects.requireNonNull(builder.behaviour, "behaviour is required");
        if (pattern.requiresTrigger() != (builder.trigger != null)) {
            throw new AstConstructionException(ConstructionError.INVALID_PATTERN_SLOTS, pattern.name(),
                    "Pattern " + pattern + (pattern.requiresTrigger() ? " requires a trigger" : " does not accept a trigger"));
        }
        checkTimeWindow(builder.minTime, builder.maxTime);
        this.metadata = copyMetadata(builder.metadata);
        this.minTime = builder.minTime;
        this.maxTime = builder.maxTime;
        Scope s = builder.scope == null ? Scope.globally() : builder.scope;
        this.scope = attach(s, () -> this.scope = null);
        if (builder.trigger != null) {
            this.trigger = attach(builder.trigger, () -> this.trigger = null);
        }
        this.behaviour = attach(builder.behaviour, () -> this.behaviour = null);
    }

    private Property(Property source) {
        this.pattern = source.pattern;
        this.metadata = copyMetadata(source.metadata);
        this.minTime = source.minTime;
        this.maxTime = source.maxTime;
        Scope s = duplicateOrNull(source.scope);
        Event t = duplicateOrNull(source.trigger);
        Event b = duplicateOrNull(source.behaviour);
        this.scope = s == null ? null : attach(s, () -> this.scope = null);
        this.trigger = t == null ? null : attach(t, () -> this.trigger = null);
        this.behaviour = b == null ? null : attach(b, () -> this.behaviour = null);
    }

    public static Builder builder(PatternKind pattern) {
        return new Builder(pattern);
    }

    public static Property existence(Scope scope, Event behaviour) {
        return builder(PatternKind.EXISTENCE).scope(scope).behaviour(behaviour).build();
    }

    public static Property absence(Scope scope, Event behaviour) {
        return builder(PatternKind.ABSENCE).scope(scope).behaviour(behaviour).build();
    }

    public static Property response(Scope scope, Event trigger, Event response) {
        return builder(PatternKind.RESPONSE).scope(scope).trigger(trigger).behaviour(response).build();
    }

    public static Property requirement(Scope scope, Event trigger, Event response) {
        return builder(PatternKind.REQUIREMENT).scope(scope).trigger(trigger).behaviour(response).build();
    }

    public static Property prevention(Scope scope, Event trigger, Event forbidden) {
        return builder(PatternKind.PREVENTION).scope(scope).trigger(trigger).behaviour(forbidden).build();
    }

    private static void checkTimeWindow(double minTime, double maxTime) {
        if (Double.isNaN(minTime) || Double.isNaN(maxTime) || minTime < 0.0 || minTime == UNBOUNDED
                || maxTime < minTime) {
            throw new AstConstructionException(ConstructionError.INVALID_TIME_WINDOW, minTime + ".." + maxTime,
                    "Invalid time window [" + minTime + ", " + maxTime + "]");
        }
    }

    public PatternKind pattern() {
        return pattern;
    }

    /**
     * @return the scope, {@code null} once it has moved to another parent
     */
    public Scope scope() {
        return scope;
    }

    public Optional<Event> trigger() {
        return Optional.ofNullable(trigger);
    }

    /**
     * @return the behaviour event, {@code null} once it has moved to another parent
     */
    public Event behaviour() {
        return behaviour;
    }

    public double minTime() {
        return minTime;
    }

    public double maxTime() {
        return maxTime;
    }

    public boolean hasMinTime() {
        return minTime > 0.0;
    }

    public boolean hasMaxTime() {
        return maxTime < UNBOUNDED;
    }

    public boolean isSafety() {
        return pattern.isSafety();
    }

    public boolean isLiveness() {
        return pattern.isLiveness();
    }

    public Map<String, Object> metadata() {
        return Collections.unmodifiableMap(metadata);
    }

    /**
     * @return the {@code id} metadata entry
     */
    public Optional<String> uid() {
        return Optional.ofNullable(metadata.get("id")).map(String::valueOf);
    }

    public void putMetadata(String key, Object value) {
        checkMutable();
        Objects.requireNonNull(key, "metadata key is required");
        if (value == null) {
            metadata.remove(key);
        } else {
            metadata.put(key, copyValue(value));
        }
    }

    private static Map<String, Object> copyMetadata(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, copyValue(value)));
        return copy;
    }

    // Lists, sets and maps are copied recursively so that no two properties share a container.
    private static Object copyValue(Object value) {
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(copyValue(item)));
            return copy;
        }
        if (value instanceof Set<?> set) {
            Set<Object> copy = new LinkedHashSet<>();
            set.forEach(item -> copy.add(copyValue(item)));
            return copy;
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((key, item) -> copy.put(key, copyValue(item)));
            return copy;
        }
        return value;
    }

    public void setTimeWindow(double minTime, double maxTime) {
        checkMutable();
        checkTimeWindow(minTime, maxTime);
        this.minTime = minTime;
        this.maxTime = maxTime;
    }

    public void setScope(Scope scope) {
        checkMutable();
        Objects.requireNonNull(scope, "scope is required");
        Scope old = this.scope;
        if (old != scope) {
            this.scope = attach(scope, () -> this.scope = null);
            detach(old);
        }
    }

    /**
     * Sets the trigger. A trigger on a pattern that takes none is reported by validation.
     */
    public void setTrigger(Event trigger) {
        checkMutable();
        Objects.requireNonNull(trigger, "trigger is required");
        Event old = this.trigger;
        if (old != trigger) {
            this.trigger = attach(trigger, () -> this.trigger = null);
            detach(old);
        }
    }

    public void setBehaviour(Event behaviour) {
        checkMutable();
        Objects.requireNonNull(behaviour, "behaviour is required");
        Event old = this.behaviour;
        if (old != behaviour) {
            this.behaviour = attach(behaviour, () -> this.behaviour = null);
            detach(old);
        }
    }

    /**
     * Lists the top-level events in binding order: activator, trigger, behaviour, terminator.
     *
     * @return the events present in the tree
     */
    public List<Event> events() {
        List<Event> events = new ArrayList<>(4);
        if (scope != null) {
            scope.activator().ifPresent(events::add);
        }
        if (trigger != null) {
            events.add(trigger);
        }
        if (behaviour != null) {
            events.add(behaviour);
        }
        if (scope != null) {
            scope.terminator().ifPresent(events::add);
        }
        return events;
    }

    @Override
    public List<AstNode> children() {
        List<AstNode> children = new ArrayList<>(3);
        if (scope != null) {
            children.add(scope);
        }
        if (trigger != null) {
            children.add(trigger);
        }
        if (behaviour != null) {
            children.add(behaviour);
        }
        return List.copyOf(children);
    }

    @Override
    public Property duplicate() {
        return new Property(this);
    }

    @Override
    public boolean structurallyEquals(AstNode other) {
        return other instanceof Property p
                && p.pattern == pattern
                && Double.compare(p.minTime, minTime) == 0
                && Double.compare(p.maxTime, maxTime) == 0
                && sameNode(scope, p.scope)
                && sameNode(trigger, p.trigger)
                && sameNode(behaviour, p.behaviour);
    }

    @Override
    public void replaceChild(NodeId oldId, AstNode newNode) {
        checkMutable();
        if (isNode(scope, oldId)) {
            setScope(requireKind(newNode, Scope.class, "scope"));
        } else if (isNode(trigger, oldId)) {
            setTrigger(requireKind(newNode, Event.class, "trigger"));
        } else if (isNode(behaviour, oldId)) {
            setBehaviour(requireKind(newNode, Event.class, "behaviour"));
        } else {
            throw notAChild(oldId);
        }
    }

    /**
     * Lists empty mandatory slots. A missing trigger is reported by validation with its own code.
     */
    @Override
    public List<String> missingSlots() {
        List<String> missing = new ArrayList<>(2);
        if (scope == null) {
            missing.add("scope");
        }
        if (behaviour == null) {
            missing.add("behaviour");
        }
        return missing;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitProperty(this);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder().append(scope).append(": ");
        switch (pattern) {
            case EXISTENCE, ABSENCE -> sb.append(pattern.getKeyword()).append(' ').append(behaviour);
            case REQUIREMENT -> sb.append(behaviour).append(" requires ").append(trigger);
            default -> sb.append(trigger).append(' ').append(pattern.getKeyword()).append(' ').append(behaviour);
        }
        if (hasMaxTime()) {
            sb.append(" within ").append(maxTime).append('s');
        }
        return sb.toString();
    }

    /**
     * Builder of {@link Property} instances. The scope defaults to {@code globally} and the time
     * window to {@code [0, +inf)}.
     */
    public static final class Builder {
        private final PatternKind pattern;
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private Scope scope;
        private Event trigger;
        private Event behaviour;
        private double minTime = 0.0;
        private double maxTime = UNBOUNDED;

        private Builder(PatternKind pattern) {
            this.pattern = Objects.requireNonNull(pattern, "pattern is required");
        }

        public Builder scope(Scope scope) {
            this.scope = scope;
            return this;
        }

        public Builder trigger(Event trigger) {
            this.trigger = trigger;
            return this;
        }

        public Builder behaviour(Event behaviour) {
            this.behaviour = behaviour;
            return this;
        }

        public Builder within(double minTime, double maxTime) {
            this.minTime = minTime;
            this.maxTime = maxTime;
            return this;
        }

        public Builder within(double maxTime) {
            return within(0.0, maxTime);
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(Objects.requireNonNull(key, "metadata key is required"), Objects.requireNonNull(value));
            return this;
        }

        public Property build() {
            return new Property(this);
        }
    }
}
