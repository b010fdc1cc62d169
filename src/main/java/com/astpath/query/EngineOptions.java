package com.astpath.query;

/**
 * Limits and sizing for a {@link PathEngine}.
 *
 * @param maxDepth  deepest allowed nesting of path predicates inside path predicates
 * @param maxVisits most nodes a single evaluation may expand before it is aborted
 * @param cacheSize number of parsed paths kept by the default cache
 */
public record EngineOptions(int maxDepth, int maxVisits, int cacheSize) {

    public static final int DEFAULT_MAX_DEPTH = 32;
    public static final int DEFAULT_MAX_VISITS = 1_000_000;
    public static final int DEFAULT_CACHE_SIZE = 1024;

    public EngineOptions {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1: " + maxDepth);
        }
        if (maxVisits < 1) {
            throw new IllegalArgumentException("maxVisits must be at least 1: " + maxVisits);
        }
        if (cacheSize < 0) {
            throw new IllegalArgumentException("cacheSize must not be negative: " + cacheSize);
        }
    }

    public static EngineOptions defaults() {
        return new EngineOptions(DEFAULT_MAX_DEPTH, DEFAULT_MAX_VISITS, DEFAULT_CACHE_SIZE);
    }

    public EngineOptions withMaxDepth(int maxDepth) {
        return new EngineOptions(maxDepth, maxVisits, cacheSize);
    }

    public EngineOptions withMaxVisits(int maxVisits) {
        return new EngineOptions(maxDepth, maxVisits, cacheSize);
    }

    public EngineOptions withCacheSize(int cacheSize) {
        return new EngineOptions(maxDepth, maxVisits, cacheSize);
    }
}
