package com.astpath.output;

import com.astpath.tree.Span;
import com.astpath.tree.SyntaxNode;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.tuple.Pair;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.tuple.Tuples;

/**
 * Writes matches as JSON objects, one per match, either indented or on a single line.
 */
public class OutputFormatter {
    private final boolean prettyPrint;
    private final boolean includeText;

    // StringBuilder pool for performance
    private static final ThreadLocal<StringBuilder> STRING_BUILDER_POOL =
        ThreadLocal.withInitial(() -> new StringBuilder(512));

    public OutputFormatter(boolean prettyPrint) {
        this(prettyPrint, false);
    }

    public OutputFormatter(boolean prettyPrint, boolean includeText) {
        this.prettyPrint = prettyPrint;
        this.includeText = includeText;
    }

    public String format(NodeMatch match) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0); // Clear the builder

        MutableList<Pair<String, String>> fields = fields(match);
        sb.append('{');
        boolean first = true;
        for (Pair<String, String> field : fields) {
            if (!first) {
                sb.append(',');
            }
            first = false;
            if (prettyPrint) {
                sb.append("\n  ");
            }
            sb.append('"').append(field.getOne()).append("\":");
            if (prettyPrint) {
                sb.append(' ');
            }
            if (field.getTwo() == null) {
                sb.append("null");
            } else {
                sb.append('"').append(escapeString(field.getTwo())).append('"');
            }
        }
        if (prettyPrint) {
            sb.append('\n');
        }
        sb.append('}');

        return sb.toString();
    }

    private MutableList<Pair<String, String>> fields(NodeMatch match) {
        SyntaxNode node = match.node();
        Span span = node.span();
        MutableList<Pair<String, String>> fields = Lists.mutable.with(
            Tuples.pair("kind", node.kind()),
            Tuples.pair("name", node.name()),
            Tuples.pair("path", match.path()),
            Tuples.pair("location", span.isKnown() ? span.toString() : null));
        if (includeText) {
            fields.add(Tuples.pair("text", node.text()));
        }
        return fields;
    }

    private String escapeString(String s) {
        // Fast path: if no escaping needed, return original
        boolean needsEscaping = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' || c == '"' || c < 0x20) {
                needsEscaping = true;
                break;
            }
        }

        if (!needsEscaping) {
            return s;
        }

        StringBuilder result = new StringBuilder(s.length() + 16);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> result.append("\\\\");
                case '"'  -> result.append("\\\"");
                case '\n' -> result.append("\\n");
                case '\r' -> result.append("\\r");
                case '\t' -> result.append("\\t");
                default   -> {
                    if (c < 0x20) {
                        result.append(String.format("\\u%04x", (int) c));
                    } else {
                        result.append(c);
                    }
                }
            }
        }
        return result.toString();
    }
}
