package com.astpath.query;

import java.util.Set;

/**
 * Helpers for writing path text back out.
 */
final class PathSyntax {

    private static final Set<String> KEYWORDS = Set.of("and", "or", "not");

    private PathSyntax() {
    }

    /** Whether {@code name} reads back as a single identifier token inside a predicate. */
    static boolean isPlainName(String name) {
        if (name.isEmpty() || KEYWORDS.contains(name)) {
            return false;
        }
        char first = name.charAt(0);
        if (!(Character.isLetter(first) || first == '_' || first == '$')) {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            char ch = name.charAt(i);
            if (Character.isLetterOrDigit(ch) || ch == '_' || ch == '$') {
                continue;
            }
            if (ch == '-' && i + 1 < name.length() && name.charAt(i + 1) != '-') {
                continue;
            }
            return false;
        }
        return !name.endsWith("-");
    }

    static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('\'');
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (ch == '\'' || ch == '\\') {
                sb.append('\\');
            }
            sb.append(ch);
        }
        return sb.append('\'').toString();
    }
}
