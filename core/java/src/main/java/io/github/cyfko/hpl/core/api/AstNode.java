package io.github.cyfko.hpl.core.api;

import io.github.cyfko.hpl.core.exception.AstConstructionException;
import io.github.cyfko.hpl.core.exception.NotAChildException;

import java.util.List;

/**
 * Read and edit contract shared by every node of a property tree.
 * <p>
 * A property tree is built bottom-up by a parser or a programmatic builder. Each node owns its
 * children exclusively: attaching a node to a new parent detaches it from its previous parent,
 * and nodes never expose a reference to their parent. Cross-tree relations such as alias
 * bindings are computed on demand by the validation engine instead of being stored in nodes.
 * </p>
 *
 * <h2>Equality</h2>
 * <p>
 * {@link #structurallyEquals(AstNode)} compares the node kind, the node attributes and the
 * children, recursively and in order. Identity ({@link #id()}) never takes part in it.
 * {@code equals} keeps reference semantics because nodes are mutable.
 * </p>
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>Construction enforces local invariants only and fails fast with
 *       {@link AstConstructionException}.</li>
 *   <li>Cross-tree invariants are checked by an explicit validation call.</li>
 *   <li>Once a property is accepted, its whole tree is {@linkplain #freeze() frozen} and every
 *       mutator throws {@link IllegalStateException}.</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface AstNode {

    /**
     * @return the identity of this node
     */
    NodeId id();

    /**
     * Returns the immediate sub-nodes of this node, in grammar order.
     * <p>
     * Empty optional slots are skipped. The returned list is a read-only snapshot.
     * </p>
     *
     * @return the ordered children of this node
     */
    List<AstNode> children();

    /**
     * Produces a deep copy of this node.
     * <p>
     * The copy shares no mutable sub-structure with this node, is never frozen, and is
     * structurally equal to this node.
     * </p>
     *
     * @return an independent copy
     */
    AstNode duplicate();

    /**
     * Compares this node with another one, ignoring identities.
     *
     * @param other the node to compare with, may be {@code null}
     * @return {@code true} if both nodes have the same kind, attributes and children
     */
    boolean structurallyEquals(AstNode other);

    /**
     * Replaces one of the children of this node in place.
     *
     * @param oldId   identity of the child to replace
     * @param newNode the replacement node, detached from its previous parent if any
     * @throws NotAChildException        if no current child has the given identity
     * @throws AstConstructionException  if the replacement does not fit the child slot
     * @throws IllegalStateException     if this node is frozen
     */
    void replaceChild(NodeId oldId, AstNode newNode);

    /**
     * Lists the mandatory slots of this node that are currently empty.
     * <p>
     * A slot becomes empty when its child is moved to another parent. Validation reports
     * every missing slot.
     * </p>
     *
     * @return names of the empty mandatory slots, empty when the node is complete
     */
    List<String> missingSlots();

    /**
     * Marks this node and all its descendants as immutable.
     */
    void freeze();

    /**
     * @return {@code true} if this node can no longer be modified
     */
    boolean isFrozen();

    /**
     * Dispatches this node to the matching visitor method.
     *
     * @param visitor the visitor
     * @param <R>     visitor result type
     * @return the visitor result
     */
    <R> R accept(AstVisitor<R> visitor);
}
