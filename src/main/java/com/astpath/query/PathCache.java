package com.astpath.query;

import java.util.function.Function;

/**
 * Read-through cache of parsed paths, keyed by path text. Entries are immutable
 * {@link PathExpression}s, so one cache can be shared by concurrent callers.
 */
public interface PathCache {

    /**
     * Returns the cached expression for {@code path}, parsing it with {@code parser} and
     * storing the result when absent. Parse failures propagate and are not cached.
     */
    PathExpression get(String path, Function<String, PathExpression> parser);

    /** Number of entries currently held. */
    long size();

    /** A cache that keeps nothing and parses on every call. */
    static PathCache none() {
        return new PathCache() {
            @Override
            public PathExpression get(String path, Function<String, PathExpression> parser) {
                return parser.apply(path);
            }

            @Override
            public long size() {
                return 0;
            }
        };
    }

    static PathCache bounded(long maximumSize) {
        return new BoundedPathCache(maximumSize);
    }
}
