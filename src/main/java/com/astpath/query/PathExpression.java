package com.astpath.query;

import org.eclipse.collections.api.list.ImmutableList;

/**
 * A parsed path. It holds no reference to any tree, so one instance can be cached and
 * evaluated against any number of trees and start nodes.
 *
 * @param source   the path text this expression was parsed from
 * @param absolute whether evaluation starts at the root of the start node's tree
 * @param steps    steps applied left to right
 */
public record PathExpression(String source, boolean absolute, ImmutableList<Step> steps) {

    /** Fully expanded form, every step with its explicit axis. */
    public String toCanonicalString() {
        String body = steps.collect(Step::toString).makeString("/");
        return absolute ? "/" + body : body;
    }

    @Override
    public String toString() {
        return source;
    }
}
