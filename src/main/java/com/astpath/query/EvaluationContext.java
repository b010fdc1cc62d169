package com.astpath.query;

import com.astpath.tree.SyntaxNode;

/**
 * What a predicate sees about the candidate it is testing.
 *
 * @param candidate the node under test
 * @param position  1-based ordinal of the candidate among the nodes still in the step's
 *                  candidate list for the same context node
 * @param size      length of that list
 * @param root      node absolute paths start from
 * @param depth     nesting level, 0 for the top level path
 * @param budget    work limits of the whole evaluation
 */
public record EvaluationContext(SyntaxNode candidate, int position, int size, SyntaxNode root,
                                int depth, EvaluationBudget budget) {

    EvaluationContext at(SyntaxNode candidate, int position, int size) {
        return new EvaluationContext(candidate, position, size, root, depth, budget);
    }

    /** Context for a nested path rooted at the current candidate, one level deeper. */
    EvaluationContext nested() {
        budget.checkDepth(depth + 1);
        return new EvaluationContext(candidate, 1, 1, candidate, depth + 1, budget);
    }
}
