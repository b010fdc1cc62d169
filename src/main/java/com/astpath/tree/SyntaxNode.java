package com.astpath.tree;

import java.util.List;

/**
 * The capability a tree provider has to offer for its nodes to be queried. Implementations
 * wrap whatever a front end produces; the query engine never looks past this interface and
 * never mutates a node.
 * <p>
 * Parent and child links must agree: every node returned by {@link #children()} answers this
 * node from {@link #parent()}.
 */
public interface SyntaxNode {

    /** Kind tag such as {@code class}, {@code method} or {@code if-statement}. */
    String kind();

    /**
     * Whether this node should match the given kind in a node test. Providers that expose a
     * coarse category next to the precise kind (an {@code if-statement} that is also a
     * {@code statement}) override this.
     */
    default boolean isKind(String kind) {
        return kind().equals(kind);
    }

    /** Declared name, or {@code null} when the node declares nothing. */
    String name();

    List<? extends SyntaxNode> children();

    /** Enclosing node, {@code null} at the root. */
    SyntaxNode parent();

    /** Raw source text covered by this node. */
    String text();

    Span span();

    /** Attribute exposed under {@code key}, or {@code null} when absent. */
    AttributeValue attribute(String key);
}
