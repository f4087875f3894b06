package io.github.cyfko.hpl.core.ast.event;

import io.github.cyfko.hpl.core.api.AstNode;
import io.github.cyfko.hpl.core.api.AstVisitor;
import io.github.cyfko.hpl.core.api.NodeId;
import io.github.cyfko.hpl.core.ast.Predicate;
import io.github.cyfko.hpl.core.exception.AstConstructionException;
import io.github.cyfko.hpl.core.exception.ConstructionError;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Publication of a message on a channel, filtered by a predicate and optionally bound to an alias.
 *
 * <pre>{@code
 * AtomicEvent.on("/cmd");                                   // any message on /cmd
 * AtomicEvent.on("/cmd", predicate, "c");                   // /cmd { ... } as c
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class AtomicEvent extends Event {

    private final String channel;
    private final String alias;
    private Predicate predicate;

    /**
     * @param channel   the channel, non-blank
     * @param predicate the message filter, {@code null} for the vacuous predicate
     * @param alias     the alias bound to the message, {@code null} when unbound
     */
    public AtomicEvent(String channel, Predicate predicate, String alias) {
        if (channel == null || channel.isBlank()) {
            throw new AstConstructionException(ConstructionError.BLANK_CHANNEL, channel, "An atomic event needs a channel");
        }
        if (alias != null && alias.isBlank()) {
            throw new AstConstructionException(ConstructionError.BLANK_ALIAS, channel,
                    "Alias of an event on '" + channel + "' cannot be blank");
        }
        this.channel = channel;
        this.alias = alias;
        Predicate filter = predicate == null ? Predicate.vacuous() : predicate;
        this.predicate = attach(filter, () -> this.predicate = null);
    }

    private AtomicEvent(AtomicEvent source) {
        this.channel = source.channel;
        this.alias = source.alias;
        Predicate copy = duplicateOrNull(source.predicate);
        this.predicate = copy == null ? null : attach(copy, () -> this.predicate = null);
    }

    public static AtomicEvent on(String channel) {
        return new AtomicEvent(channel, null, null);
    }

    public static AtomicEvent on(String channel, Predicate predicate) {
        return new AtomicEvent(channel, predicate, null);
    }

    public static AtomicEvent on(String channel, Predicate predicate, String alias) {
        return new AtomicEvent(channel, predicate, alias);
    }

    public String channel() {
        return channel;
    }

    public Optional<String> alias() {
        return Optional.ofNullable(alias);
    }

    /**
     * @return the predicate, {@code null} once it has moved to another parent
     */
    public Predicate predicate() {
        return predicate;
    }

    public void setPredicate(Predicate predicate) {
        checkMutable();
        Objects.requireNonNull(predicate, "predicate is required");
        Predicate old = this.predicate;
        if (old == predicate) {
            return;
        }
        this.predicate = attach(predicate, () -> this.predicate = null);
        detach(old);
    }

    @Override
    public List<String> aliases() {
        return alias == null ? List.of() : List.of(alias);
    }

    @Override
    public Set<String> externalReferences() {
        if (predicate == null) {
            return Set.of();
        }
        Set<String> references = new LinkedHashSet<>(predicate.referencedAliases());
        if (alias != null) {
            references.remove(alias);
        }
        return Collections.unmodifiableSet(references);
    }

    @Override
    public List<AtomicEvent> atomicEvents() {
        return List.of(this);
    }

    @Override
    public List<AstNode> children() {
        return predicate == null ? List.of() : List.of(predicate);
    }

    @Override
    public AtomicEvent duplicate() {
        return new AtomicEvent(this);
    }

    @Override
    public boolean structurallyEquals(AstNode other) {
        return other instanceof AtomicEvent e
                && channel.equals(e.channel)
                && Objects.equals(alias, e.alias)
                && sameNode(predicate, e.predicate);
    }

    @Override
    public void replaceChild(NodeId oldId, AstNode newNode) {
        checkMutable();
        if (!isNode(predicate, oldId)) {
            throw notAChild(oldId);
        }
        setPredicate(requireKind(newNode, Predicate.class, "predicate"));
    }

    @Override
    public List<String> missingSlots() {
        return predicate == null ? List.of("predicate") : List.of();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitAtomicEvent(this);
    }

    @Override
    public String toString() {
        return channel + " " + predicate + (alias == null ? "" : " as " + alias);
    }
}
