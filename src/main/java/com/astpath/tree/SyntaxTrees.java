package com.astpath.tree;

import java.util.List;

public final class SyntaxTrees {

    private SyntaxTrees() {
    }

    public static SyntaxNode root(SyntaxNode node) {
        SyntaxNode current = node;
        while (current.parent() != null) {
            current = current.parent();
        }
        return current;
    }

    /**
     * Position of {@code node} among its parent's children, by identity. Returns -1 for the
     * root or when the provider's links disagree.
     */
    public static int indexInParent(SyntaxNode node) {
        SyntaxNode parent = node.parent();
        if (parent == null) {
            return -1;
        }
        List<? extends SyntaxNode> siblings = parent.children();
        for (int i = 0; i < siblings.size(); i++) {
            if (siblings.get(i) == node) {
                return i;
            }
        }
        return -1;
    }

    public static int depth(SyntaxNode node) {
        int depth = 0;
        for (SyntaxNode current = node.parent(); current != null; current = current.parent()) {
            depth++;
        }
        return depth;
    }
}
