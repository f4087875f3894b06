package io.github.cyfko.hpl.core.ast;

import io.github.cyfko.hpl.core.api.AstNode;
import io.github.cyfko.hpl.core.api.NodeId;
import io.github.cyfko.hpl.core.exception.AstConstructionException;
import io.github.cyfko.hpl.core.exception.ConstructionError;
import io.github.cyfko.hpl.core.exception.NotAChildException;

import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Base class of every property tree node.
 * <p>
 * It implements identity, freezing and the single-owner rule. A parent registers each child
 * through {@link #attach(AstNode, Runnable)} together with a release hook that empties the slot
 * holding the child. Attaching the child somewhere else runs that hook first, so a node is
 * never reachable from two parents. The parent itself is never stored in a form a caller could
 * observe.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class AbstractAstNode implements AstNode {

    private final NodeId id = NodeId.next();
    private boolean frozen;
    private AbstractAstNode owner;
    private Runnable release;

    @Override
    public final NodeId id() {
        return id;
    }

    @Override
    public final boolean isFrozen() {
        return frozen;
    }

    @Override
    public final void freeze() {
        AstWalker.preorder(this).forEach(node -> ((AbstractAstNode) node).frozen = true);
    }

    /**
     * Fails when this node can no longer be modified.
     *
     * @throws IllegalStateException if this node is frozen
     */
    protected final void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("Node " + id + " (" + getClass().getSimpleName() + ") is frozen");
        }
    }

    /**
     * Takes ownership of a child.
     * <p>
     * The child is released from its previous parent, whose slot is emptied by the hook that
     * parent registered. {@code onRelease} is the hook this node registers in turn.
     * </p>
     *
     * @param child     the node to own
     * @param onRelease empties the slot holding {@code child} when it moves elsewhere
     * @param <T>       child type
     * @return {@code child}
     * @throws AstConstructionException if the child is foreign, already owned by this node or
     *                                  an ancestor of this node
     * @throws IllegalStateException    if the child is frozen
     */
    protected final <T extends AstNode> T attach(T child, Runnable onRelease) {
        Objects.requireNonNull(child, "child is required");
        if (!(child instanceof AbstractAstNode)) {
            throw new AstConstructionException(ConstructionError.INCOMPATIBLE_CHILD, child.getClass().getName(),
                    "Unsupported node implementation: " + child.getClass().getName());
        }
        AbstractAstNode node = (AbstractAstNode) child;
        if (node.frozen) {
            throw new IllegalStateException("Node " + node.id + " is frozen and cannot change parent");
        }
        if (node.owner == this) {
            throw new AstConstructionException(ConstructionError.CYCLIC_ATTACHMENT, node.id.toString(),
                    "Node " + node.id + " is already a child of node " + id);
        }
        if (node == this || AstWalker.preorder(node).anyMatch(n -> n == this)) {
            throw new AstConstructionException(ConstructionError.CYCLIC_ATTACHMENT, node.id.toString(),
                    "Node " + node.id + " cannot be attached below itself");
        }
        if (node.release != null) {
            node.owner.checkMutable();
            node.release.run();
        }
        node.owner = this;
        node.release = onRelease;
        return child;
    }

    /**
     * Gives up ownership of a child that was replaced.
     *
     * @param child the former child, may be {@code null}
     */
    protected final void detach(AstNode child) {
        if (child instanceof AbstractAstNode) {
            AbstractAstNode node = (AbstractAstNode) child;
            if (node.owner == this) {
                node.owner = null;
                node.release = null;
            }
        }
    }

    /**
     * Replaces the element of a list slot whose identity is {@code oldId}.
     *
     * @return {@code false} if no element has that identity
     */
    protected final <T extends AstNode> boolean replaceIn(List<T> slot, NodeId oldId, T replacement) {
        T old = null;
        for (T element : slot) {
            if (element.id().equals(oldId)) {
                old = element;
                break;
            }
        }
        if (old == null) {
            return false;
        }
        if (old == replacement) {
            return true;
        }
        attach(replacement, removalFrom(slot, replacement));
        for (int i = 0; i < slot.size(); i++) {
            if (slot.get(i) == old) {
                slot.set(i, replacement);
                break;
            }
        }
        detach(old);
        return true;
    }

    /**
     * @return a release hook removing {@code node} from a list slot
     */
    protected static Runnable removalFrom(List<? extends AstNode> slot, AstNode node) {
        return () -> slot.removeIf(element -> element == node);
    }

    /**
     * Rejects collections holding the same instance twice.
     */
    protected static void requireDistinctInstances(Collection<? extends AstNode> nodes, String slot) {
        Set<AstNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (AstNode node : nodes) {
            Objects.requireNonNull(node, slot + " cannot contain null");
            if (!seen.add(node)) {
                throw new AstConstructionException(ConstructionError.CYCLIC_ATTACHMENT, slot,
                        "Node " + node.id() + " appears twice in " + slot);
            }
        }
    }

    /**
     * Checks that a replacement fits a slot.
     *
     * @throws AstConstructionException with {@link ConstructionError#INCOMPATIBLE_CHILD}
     */
    protected static <T extends AstNode> T requireKind(AstNode node, Class<T> kind, String slot) {
        Objects.requireNonNull(node, "replacement node is required");
        if (!kind.isInstance(node)) {
            throw new AstConstructionException(ConstructionError.INCOMPATIBLE_CHILD, slot,
                    "Slot '" + slot + "' expects " + kind.getSimpleName() + " but got " + node.getClass().getSimpleName());
        }
        return kind.cast(node);
    }

    protected static boolean isNode(AstNode node, NodeId id) {
        return node != null && node.id().equals(id);
    }

    protected final NotAChildException notAChild(NodeId oldId) {
        return new NotAChildException(id, oldId);
    }

    protected static boolean sameNode(AstNode a, AstNode b) {
        return a == null ? b == null : a.structurallyEquals(b);
    }

    protected static boolean sameNodes(List<? extends AstNode> a, List<? extends AstNode> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (!a.get(i).structurallyEquals(b.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Null-safe duplication of an optional slot.
     */
    @SuppressWarnings("unchecked")
    protected static <T extends AstNode> T duplicateOrNull(T node) {
        return node == null ? null : (T) node.duplicate();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + id;
    }
}
