package com.astpath.query;

public enum TokenType {

    SLASH("/"),
    DOUBLE_SLASH("//"),
    DOT("."),
    DOT_DOT(".."),
    LEFT_BRACKET("["),
    RIGHT_BRACKET("]"),
    LEFT_PAREN("("),
    RIGHT_PAREN(")"),
    COMMA(","),
    AT("@"),
    AXIS_SEPARATOR("::"),
    EQUALS("="),
    NOT_EQUALS("!="),
    TOKEN_CONTAINS("~="),
    LESS_THAN("<"),
    LESS_OR_EQUAL("<="),
    GREATER_THAN(">"),
    GREATER_OR_EQUAL(">="),
    MINUS("-"),
    AND("and"),
    OR("or"),
    NOT("not"),
    IDENTIFIER("identifier"),
    PATTERN("wildcard pattern"),
    STRING("string literal"),
    NUMBER("number"),
    EOF("end of path");

    private final String display;

    TokenType(String display) {
        this.display = display;
    }

    public boolean isComparator() {
        return switch (this) {
            case EQUALS, NOT_EQUALS, TOKEN_CONTAINS, LESS_THAN, LESS_OR_EQUAL, GREATER_THAN, GREATER_OR_EQUAL -> true;
            default -> false;
        };
    }

    @Override
    public String toString() {
        return display;
    }
}
