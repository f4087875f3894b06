package io.github.cyfko.hpl.core.api;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Identity of an {@link AstNode}.
 * <p>
 * Identifiers are allocated from a process-wide sequence when a node is created, so two nodes
 * never share an identifier, whichever tree they end up in. A duplicated node receives a fresh
 * identifier: identity is never part of structural equality.
 * </p>
 *
 * @param value the sequence number backing this identifier
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record NodeId(long value) implements Comparable<NodeId> {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    /**
     * Allocates the next identifier.
     *
     * @return a new, process-unique identifier
     */
    public static NodeId next() {
        return new NodeId(SEQUENCE.incrementAndGet());
    }

    @Override
    public int compareTo(NodeId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return "#" + value;
    }
}
