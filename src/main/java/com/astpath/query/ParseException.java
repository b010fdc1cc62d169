package com.astpath.query;

public class ParseException extends PathException {

    private final String expected;
    private final String found;

    public ParseException(String expected, Token found) {
        this(expected, describe(found), found.offset());
    }

    public ParseException(String expected, String found, int position) {
        super("Expected " + expected + " but found " + found + " at position " + position, position);
        this.expected = expected;
        this.found = found;
    }

    public String getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }

    private static String describe(Token token) {
        if (token.type() == TokenType.EOF) {
            return "end of path";
        }
        return switch (token.type()) {
            case IDENTIFIER, PATTERN, STRING, NUMBER -> token.type() + " '" + token.text() + "'";
            default -> "'" + token.text() + "'";
        };
    }
}
