package com.astpath.query;

import com.astpath.tree.SyntaxNode;
import com.astpath.tree.SyntaxTrees;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Expands a node along an axis. Forward axes list nodes in document order, reverse axes
 * nearest first. Nothing here mutates or caches tree state.
 */
public final class AxisNavigator {

    private AxisNavigator() {
    }

    public static MutableList<SyntaxNode> expand(SyntaxNode node, Axis axis) {
        return expand(node, axis, new EvaluationBudget(Integer.MAX_VALUE, Integer.MAX_VALUE));
    }

    static MutableList<SyntaxNode> expand(SyntaxNode node, Axis axis, EvaluationBudget budget) {
        MutableList<SyntaxNode> out = Lists.mutable.empty();
        Sink sink = new Sink(out, budget);
        switch (axis) {
            case SELF -> sink.add(node);
            case CHILD -> node.children().forEach(sink::add);
            case DESCENDANT -> descendants(node, sink);
            case DESCENDANT_OR_SELF -> {
                sink.add(node);
                descendants(node, sink);
            }
            case PARENT -> {
                if (node.parent() != null) {
                    sink.add(node.parent());
                }
            }
            case ANCESTOR -> ancestors(node.parent(), sink);
            case ANCESTOR_OR_SELF -> ancestors(node, sink);
            case FOLLOWING_SIBLING -> {
                List<? extends SyntaxNode> siblings = siblings(node);
                for (int i = SyntaxTrees.indexInParent(node) + 1; i < siblings.size(); i++) {
                    sink.add(siblings.get(i));
                }
            }
            case PRECEDING_SIBLING -> {
                List<? extends SyntaxNode> siblings = siblings(node);
                for (int i = SyntaxTrees.indexInParent(node) - 1; i >= 0; i--) {
                    sink.add(siblings.get(i));
                }
            }
            case FOLLOWING -> following(node, sink);
            case PRECEDING -> preceding(node, sink);
        }
        return out;
    }

    private static void ancestors(SyntaxNode from, Sink sink) {
        for (SyntaxNode current = from; current != null; current = current.parent()) {
            sink.add(current);
        }
    }

    private static void descendants(SyntaxNode node, Sink sink) {
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        pushChildren(node, stack);
        while (!stack.isEmpty()) {
            SyntaxNode next = stack.pop();
            sink.add(next);
            pushChildren(next, stack);
        }
    }

    /** The node and its descendants in document order, without charging the budget. */
    private static MutableList<SyntaxNode> subtree(SyntaxNode node) {
        MutableList<SyntaxNode> nodes = Lists.mutable.empty();
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(node);
        while (!stack.isEmpty()) {
            SyntaxNode next = stack.pop();
            nodes.add(next);
            pushChildren(next, stack);
        }
        return nodes;
    }

    private static void pushChildren(SyntaxNode node, Deque<SyntaxNode> stack) {
        List<? extends SyntaxNode> children = node.children();
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
        }
    }

    private static void following(SyntaxNode node, Sink sink) {
        for (SyntaxNode current = node; current.parent() != null; current = current.parent()) {
            List<? extends SyntaxNode> siblings = current.parent().children();
            for (int i = SyntaxTrees.indexInParent(current) + 1; i > 0 && i < siblings.size(); i++) {
                SyntaxNode sibling = siblings.get(i);
                sink.add(sibling);
                descendants(sibling, sink);
            }
        }
    }

    private static void preceding(SyntaxNode node, Sink sink) {
        for (SyntaxNode current = node; current.parent() != null; current = current.parent()) {
            List<? extends SyntaxNode> siblings = current.parent().children();
            for (int i = SyntaxTrees.indexInParent(current) - 1; i >= 0; i--) {
                subtree(siblings.get(i)).reverseThis().each(sink::add);
            }
        }
    }

    private static List<? extends SyntaxNode> siblings(SyntaxNode node) {
        return node.parent() == null ? List.of() : node.parent().children();
    }

    private static final class Sink {
        private final MutableList<SyntaxNode> out;
        private final EvaluationBudget budget;

        Sink(MutableList<SyntaxNode> out, EvaluationBudget budget) {
            this.out = out;
            this.budget = budget;
        }

        void add(SyntaxNode node) {
            budget.visit();
            out.add(node);
        }
    }
}
