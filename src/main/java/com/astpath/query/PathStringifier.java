package com.astpath.query;

import com.astpath.tree.SyntaxNode;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Renders a node as an absolute path that selects exactly that node from its root, e.g.
 * {@code /namespace[Shop]/class[OrderService]/method[Place]/block/if-statement[2]}.
 * Declared names are preferred over positions so the path survives edits elsewhere in the
 * tree; positions are used for unnamed nodes and to tell same-named siblings apart.
 */
public class PathStringifier {

    public String toPathString(SyntaxNode node) {
        if (node.parent() == null) {
            return "/.";
        }
        Deque<String> segments = new ArrayDeque<>();
        for (SyntaxNode current = node; current.parent() != null; current = current.parent()) {
            segments.push(segment(current));
        }
        return "/" + String.join("/", segments);
    }

    private String segment(SyntaxNode node) {
        String test = PathSyntax.isPlainName(node.kind()) ? node.kind() : "*";
        NodeTest nodeTest = NodeTest.of(test);
        MutableList<SyntaxNode> sameKind = Lists.mutable.<SyntaxNode>withAll(node.parent().children())
                .select(nodeTest::matches);
        String name = node.name();
        if (name != null) {
            String namePredicate = PathSyntax.isPlainName(name) ? name : PathSyntax.quote(name);
            MutableList<SyntaxNode> sameName = sameKind.select(sibling -> name.equals(sibling.name()));
            if (sameName.size() == 1) {
                return test + "[" + namePredicate + "]";
            }
            return test + "[" + namePredicate + "][" + (indexOf(sameName, node) + 1) + "]";
        }
        if (sameKind.size() == 1) {
            return test;
        }
        return test + "[" + (indexOf(sameKind, node) + 1) + "]";
    }

    private static int indexOf(MutableList<SyntaxNode> nodes, SyntaxNode node) {
        return nodes.detectIndex(candidate -> candidate == node);
    }
}
