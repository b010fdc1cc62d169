package com.astpath.query;

import com.astpath.tree.SyntaxNode;
import com.astpath.tree.SyntaxTrees;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Sorts nodes of one tree into document (pre-order) order.
 */
final class DocumentOrder {

    private DocumentOrder() {
    }

    static void sort(MutableList<SyntaxNode> nodes) {
        if (nodes.size() < 2) {
            return;
        }
        Map<SyntaxNode, int[]> keys = new IdentityHashMap<>();
        nodes.each(node -> keys.put(node, childIndexPath(node)));
        nodes.sortThis((a, b) -> compare(keys.get(a), keys.get(b)));
    }

    /** Child indexes leading from the root down to {@code node}. */
    private static int[] childIndexPath(SyntaxNode node) {
        MutableList<Integer> indexes = Lists.mutable.empty();
        for (SyntaxNode current = node; current.parent() != null; current = current.parent()) {
            indexes.add(SyntaxTrees.indexInParent(current));
        }
        int[] path = new int[indexes.size()];
        for (int i = 0; i < path.length; i++) {
            path[i] = indexes.get(path.length - 1 - i);
        }
        return path;
    }

    // an ancestor's path is a prefix of its descendants' paths and sorts first
    private static int compare(int[] a, int[] b) {
        int common = Math.min(a.length, b.length);
        for (int i = 0; i < common; i++) {
            if (a[i] != b[i]) {
                return Integer.compare(a[i], b[i]);
            }
        }
        return Integer.compare(a.length, b.length);
    }
}
