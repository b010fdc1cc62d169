package com.astpath.query;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * {@link PathCache} holding at most a fixed number of expressions, least recently used
 * evicted first. Two threads missing on the same path may both parse it; the first insert
 * wins and both see an equal expression.
 */
public class BoundedPathCache implements PathCache {

    private static final Logger logger = LoggerFactory.getLogger(BoundedPathCache.class);

    private final Cache<String, PathExpression> cache;

    public BoundedPathCache(long maximumSize) {
        this.cache = CacheBuilder.newBuilder().maximumSize(maximumSize).build();
    }

    @Override
    public PathExpression get(String path, Function<String, PathExpression> parser) {
        PathExpression cached = cache.getIfPresent(path);
        if (cached != null) {
            return cached;
        }
        logger.debug("path cache miss: {}", path);
        PathExpression parsed = parser.apply(path);
        PathExpression raced = cache.asMap().putIfAbsent(path, parsed);
        return raced != null ? raced : parsed;
    }

    @Override
    public long size() {
        return cache.size();
    }
}
