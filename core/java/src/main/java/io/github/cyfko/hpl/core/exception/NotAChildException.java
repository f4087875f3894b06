package io.github.cyfko.hpl.core.exception;

import io.github.cyfko.hpl.core.api.NodeId;

/**
 * Exception thrown by {@code replaceChild} when the node to replace is not a current child.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class NotAChildException extends RuntimeException {

    private final NodeId parent;
    private final NodeId child;

    /**
     * @param parent identity of the node asked to replace a child
     * @param child  identity that matched none of its children
     */
    public NotAChildException(NodeId parent, NodeId child) {
        super("Node " + child + " is not a child of node " + parent);
        this.parent = parent;
        this.child = child;
    }

    public NodeId getParent() {
        return parent;
    }

    public NodeId getChild() {
        return child;
    }
}
