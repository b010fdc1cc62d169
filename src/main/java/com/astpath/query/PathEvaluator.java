package com.astpath.query;

import com.astpath.tree.SyntaxNode;
import com.astpath.tree.SyntaxTrees;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.block.factory.HashingStrategies;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.set.strategy.mutable.UnifiedSetWithHashingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the steps of a {@link PathExpression} left to right. A step expands every context
 * node along its axis, keeps the nodes passing the node test, and filters the de-duplicated
 * union through each predicate in turn, positions being recounted after every predicate.
 * Each step hands its result to the next in document order.
 */
public class PathEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(PathEvaluator.class);

    private final PathParser parser;
    private final PathCache cache;
    private final EngineOptions options;
    private final PredicateEvaluator predicates;

    public PathEvaluator(PathParser parser, PathCache cache, EngineOptions options) {
        this.parser = parser;
        this.cache = cache;
        this.options = options;
        this.predicates = new PredicateEvaluator(this);
    }

    public MutableList<SyntaxNode> evaluate(PathExpression expression, SyntaxNode start) {
        EvaluationBudget budget = EvaluationBudget.of(options);
        EvaluationContext ctx = new EvaluationContext(start, 1, 1, SyntaxTrees.root(start), 0, budget);
        MutableList<SyntaxNode> result = evaluate(expression, ctx);
        logger.debug("'{}' matched {} nodes, {} visited", expression, result.size(), budget.visits());
        return result;
    }

    MutableList<SyntaxNode> evaluate(PathExpression expression, EvaluationContext ctx) {
        MutableList<SyntaxNode> current = Lists.mutable.with(expression.absolute() ? ctx.root() : ctx.candidate());
        for (Step step : expression.steps()) {
            current = step(step, current, ctx);
            if (current.isEmpty()) {
                break;
            }
        }
        return current;
    }

    /** Evaluates a nested path from the candidate; true when it selects anything. */
    boolean matchesNested(Predicate.NestedPath nested, EvaluationContext ctx) {
        PathExpression expression;
        try {
            expression = cache.get(nested.path(), parser::parse);
        } catch (LexException | ParseException e) {
            throw new EvaluationException(EvaluationException.Reason.MALFORMED_NESTED_PATH,
                    "Malformed nested path '" + nested.path() + "': " + e.getMessage(), e);
        }
        return evaluate(expression, ctx.nested()).notEmpty();
    }

    /**
     * Candidates of one step are the union of every context node's expansion, kept once each
     * and ordered by proximity: document order for forward axes, reverse document order for
     * reverse axes. Predicates then filter that single list, so {@code //class/method[1]} is
     * the first method of the whole tree.
     */
    private MutableList<SyntaxNode> step(Step step, MutableList<SyntaxNode> contexts, EvaluationContext ctx) {
        MutableSet<SyntaxNode> seen = UnifiedSetWithHashingStrategy.newSet(HashingStrategies.identityStrategy());
        MutableList<SyntaxNode> candidates = Lists.mutable.empty();
        for (SyntaxNode context : contexts) {
            AxisNavigator.expand(context, step.axis(), ctx.budget()).each(node -> {
                if (step.nodeTest().matches(node) && seen.add(node)) {
                    candidates.add(node);
                }
            });
        }
        boolean reverse = step.axis().isReverse();
        if (contexts.size() > 1) {
            DocumentOrder.sort(candidates);
            if (reverse) {
                candidates.reverseThis();
            }
        }
        MutableList<SyntaxNode> result = candidates;
        for (Predicate predicate : step.predicates()) {
            result = filter(result, predicate, ctx);
        }
        return reverse ? result.reverseThis() : result;
    }

    private MutableList<SyntaxNode> filter(MutableList<SyntaxNode> candidates, Predicate predicate, EvaluationContext ctx) {
        MutableList<SyntaxNode> kept = Lists.mutable.empty();
        int size = candidates.size();
        for (int i = 0; i < size; i++) {
            SyntaxNode candidate = candidates.get(i);
            if (predicates.evaluate(predicate, ctx.at(candidate, i + 1, size))) {
                kept.add(candidate);
            }
        }
        return kept;
    }
}
