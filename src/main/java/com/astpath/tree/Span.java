package com.astpath.tree;

/**
 * Source location of a node, 1-based lines and columns.
 */
public record Span(int startLine, int startColumn, int endLine, int endColumn) {

    public static final Span NONE = new Span(0, 0, 0, 0);

    public static Span of(int startLine, int startColumn, int endLine, int endColumn) {
        return new Span(startLine, startColumn, endLine, endColumn);
    }

    public boolean isKnown() {
        return startLine > 0;
    }

    @Override
    public String toString() {
        return startLine + ":" + startColumn + "-" + endLine + ":" + endColumn;
    }
}
