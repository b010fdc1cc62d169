package com.astpath.output;

import com.astpath.tree.SyntaxNode;

/**
 * A query result together with the stable path that selects it again.
 */
public record NodeMatch(SyntaxNode node, String path) {
}
