package com.astpath.query;

/**
 * A lexeme of a path string. For string literals {@code text} holds the unescaped value.
 */
public record Token(TokenType type, String text, int offset) {

    public boolean is(TokenType type) {
        return this.type == type;
    }

    /** Identifiers and patterns, the tokens that can name a kind or a declaration. */
    public boolean isWord() {
        return type == TokenType.IDENTIFIER || type == TokenType.PATTERN;
    }
}
