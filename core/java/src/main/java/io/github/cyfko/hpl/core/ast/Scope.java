package io.github.cyfko.hpl.core.ast;

import io.github.cyfko.hpl.core.api.AstNode;
import io.github.cyfko.hpl.core.api.AstVisitor;
import io.github.cyfko.hpl.core.api.NodeId;
import io.github.cyfko.hpl.core.ast.event.Event;
import io.github.cyfko.hpl.core.exception.AstConstructionException;
import io.github.cyfko.hpl.core.exception.ConstructionError;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Observation window of a property, opened by an activator and closed by a terminator.
 * <p>
 * The kind fixes which events are present: {@code globally} has none, {@code after} an
 * activator, {@code until} a terminator, {@code after-until} both.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Scope extends AbstractAstNode {

    private final ScopeKind kind;
    private Event activator;
    private Event terminator;

    public Scope(ScopeKind kind, Event activator, Event terminator) {
        this.kind = Objects.requireNonNull(kind, "scope kind is required");
        if (kind.hasActivator() != (activator != null) || kind.hasTerminator() != (terminator != null)) {
            throw new AstConstructionException(ConstructionError.INVALID_SCOPE, kind.getKeyword(),
                    "Scope '" + kind.getKeyword() + "' expects "
                            + (kind.hasActivator() ? "an activator" : "no activator") + " and "
                            + (kind.hasTerminator() ? "a terminator" : "no terminator"));
        }
        if (activator != null) {
            this.activator = attach(activator, () -> this.activator = null);
        }
        if (terminator != null) {
            this.terminator = attach(terminator, () -> this.terminator = null);
        }
    }

    private Scope(Scope source) {
        this.kind = source.kind;
        Event a = duplicateOrNull(source.activator);
        Event t = duplicateOrNull(source.terminator);
        this.activator = a == null ? null : attach(a, () -> this.activator = null);
        this.terminator = t == null ? null : attach(t, () -> this.terminator = null);
    }

    public static Scope globally() {
        return new Scope(ScopeKind.GLOBAL, null, null);
    }

    public static Scope after(Event activator) {
        return new Scope(ScopeKind.AFTER, Objects.requireNonNull(activator, "activator is required"), null);
    }

    public static Scope until(Event terminator) {
        return new Scope(ScopeKind.UNTIL, null, Objects.requireNonNull(terminator, "terminator is required"));
    }

    public static Scope afterUntil(Event activator, Event terminator) {
        return new Scope(ScopeKind.AFTER_UNTIL,
                Objects.requireNonNull(activator, "activator is required"),
                Objects.requireNonNull(terminator, "terminator is required"));
    }

    public ScopeKind kind() {
        return kind;
    }

    public Optional<Event> activator() {
        return Optional.ofNullable(activator);
    }

    public Optional<Event> terminator() {
        return Optional.ofNullable(terminator);
    }

    @Override
    public List<AstNode> children() {
        List<AstNode> children = new ArrayList<>(2);
        if (activator != null) {
            children.add(activator);
        }
        if (terminator != null) {
            children.add(terminator);
        }
        return List.copyOf(children);
    }

    @Override
    public Scope duplicate() {
        return new Scope(this);
    }

    @Override
    public boolean structurallyEquals(AstNode other) {
        return other instanceof Scope s
                && s.kind == kind
                && sameNode(activator, s.activator)
                && sameNode(terminator, s.terminator);
    }

    @Override
    public void replaceChild(NodeId oldId, AstNode newNode) {
        checkMutable();
        if (isNode(activator, oldId)) {
            Event replacement = requireKind(newNode, Event.class, "activator");
            Event old = activator;
            if (old != replacement) {
                activator = attach(replacement, () -> this.activator = null);
                detach(old);
            }
        } else if (isNode(terminator, oldId)) {
            Event replacement = requireKind(newNode, Event.class, "terminator");
            Event old = terminator;
            if (old != replacement) {
                terminator = attach(replacement, () -> this.terminator = null);
                detach(old);
            }
        } else {
            throw notAChild(oldId);
        }
    }

    @Override
    public List<String> missingSlots() {
        List<String> missing = new ArrayList<>(2);
        if (kind.hasActivator() && activator == null) {
            missing.add("activator");
        }
        if (kind.hasTerminator() && terminator == null) {
            missing.add("terminator");
        }
        return missing;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitScope(this);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case GLOBAL -> "globally";
            case AFTER -> "after " + activator;
            case UNTIL -> "until " + terminator;
            case AFTER_UNTIL -> "after " + activator + " until " + terminator;
        };
    }
}
