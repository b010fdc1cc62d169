package com.astpath.query;

import com.astpath.tree.SyntaxNode;
import org.eclipse.collections.api.list.MutableList;

/**
 * Entry point of the query engine: parse a path, evaluate it against a start node, and turn a
 * node back into a path. An engine is safe to share between threads; every evaluation gets its
 * own budget and the only shared state is the parse cache.
 *
 * <pre>
 * PathEngine engine = new PathEngine();
 * MutableList&lt;SyntaxNode&gt; throwing = engine.evaluate("//if-statement[.//throw-statement]", root);
 * String path = engine.toPathString(throwing.getFirst());
 * </pre>
 */
public class PathEngine {

    private final PathParser parser = new PathParser();
    private final PathCache cache;
    private final PathEvaluator evaluator;
    private final PathStringifier stringifier = new PathStringifier();

    public PathEngine() {
        this(EngineOptions.defaults());
    }

    public PathEngine(EngineOptions options) {
        this(options, options.cacheSize() == 0 ? PathCache.none() : PathCache.bounded(options.cacheSize()));
    }

    public PathEngine(EngineOptions options, PathCache cache) {
        this.cache = cache;
        this.evaluator = new PathEvaluator(parser, cache, options);
    }

    /**
     * @throws LexException   when the path contains an illegal character or unterminated literal
     * @throws ParseException when the path does not follow the grammar
     */
    public PathExpression parse(String path) {
        return cache.get(path, parser::parse);
    }

    /**
     * @return matching nodes in document order, each once
     * @throws EvaluationException when a budget is exceeded or a nested path is malformed
     */
    public MutableList<SyntaxNode> evaluate(PathExpression expression, SyntaxNode start) {
        return evaluator.evaluate(expression, start);
    }

    public MutableList<SyntaxNode> evaluate(String path, SyntaxNode start) {
        return evaluate(parse(path), start);
    }

    public String toPathString(SyntaxNode node) {
        return stringifier.toPathString(node);
    }

    public PathCache cache() {
        return cache;
    }
}
