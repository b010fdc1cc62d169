package com.astpath.query;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Splits a path string into tokens. The lexer keeps track of predicate brackets: inside them
 * {@code and}, {@code or} and {@code not} are keywords and {@code -} is an operator, outside
 * they are plain identifier text. A run of identifier characters containing {@code *} or
 * {@code ?} is always a single {@link TokenType#PATTERN} token, so {@code Get*User} and
 * {@code *-statement} never fall apart into pieces.
 */
public class PathLexer {

    private final String input;
    private final MutableList<Token> tokens = Lists.mutable.empty();
    private int pos;
    private int bracketDepth;

    private PathLexer(String input) {
        this.input = input;
    }

    public static ImmutableList<Token> tokenize(String input) {
        PathLexer lexer = new PathLexer(input);
        lexer.run();
        return lexer.tokens.toImmutable();
    }

    private void run() {
        while (true) {
            skipWhitespace();
            if (pos >= input.length()) {
                break;
            }
            tokens.add(nextToken());
        }
        tokens.add(new Token(TokenType.EOF, "", input.length()));
    }

    private Token nextToken() {
        char ch = peek(0);
        switch (ch) {
            case '/':
                return peek(1) == '/' ? symbol(TokenType.DOUBLE_SLASH, 2) : symbol(TokenType.SLASH, 1);
            case '.':
                return peek(1) == '.' ? symbol(TokenType.DOT_DOT, 2) : symbol(TokenType.DOT, 1);
            case '[':
                bracketDepth++;
                return symbol(TokenType.LEFT_BRACKET, 1);
            case ']':
                if (bracketDepth > 0) {
                    bracketDepth--;
                }
                return symbol(TokenType.RIGHT_BRACKET, 1);
            case '(':
                return symbol(TokenType.LEFT_PAREN, 1);
            case ')':
                return symbol(TokenType.RIGHT_PAREN, 1);
            case ',':
                return symbol(TokenType.COMMA, 1);
            case '@':
                return symbol(TokenType.AT, 1);
            case '=':
                return symbol(TokenType.EQUALS, 1);
            case ':':
                if (peek(1) == ':') {
                    return symbol(TokenType.AXIS_SEPARATOR, 2);
                }
                throw new LexException("Single ':' is not allowed, axis separator is '::'", pos);
            case '!':
                if (peek(1) == '=') {
                    return symbol(TokenType.NOT_EQUALS, 2);
                }
                throw new LexException("Unexpected character '!'", pos);
            case '~':
                if (peek(1) == '=') {
                    return symbol(TokenType.TOKEN_CONTAINS, 2);
                }
                throw new LexException("Unexpected character '~'", pos);
            case '<':
                return peek(1) == '=' ? symbol(TokenType.LESS_OR_EQUAL, 2) : symbol(TokenType.LESS_THAN, 1);
            case '>':
                return peek(1) == '=' ? symbol(TokenType.GREATER_OR_EQUAL, 2) : symbol(TokenType.GREATER_THAN, 1);
            case '-':
                if (inPredicate()) {
                    return symbol(TokenType.MINUS, 1);
                }
                throw new LexException("Unexpected character '-' outside of a predicate", pos);
            case '"':
            case '\'':
                return readString(ch);
            default:
                if (Character.isDigit(ch)) {
                    return readNumber();
                }
                if (isWordStart(ch)) {
                    return readWord();
                }
                throw new LexException("Unexpected character '" + ch + "'", pos);
        }
    }

    private Token readWord() {
        int start = pos;
        boolean wildcard = false;
        while (pos < input.length()) {
            char ch = peek(0);
            if (isWordPart(ch)) {
                wildcard |= ch == '*' || ch == '?';
                pos++;
            } else if (ch == '-' && pos > start && isWordPart(peek(1))) {
                // inner hyphen, as in if-statement
                pos++;
            } else {
                break;
            }
        }
        String text = input.substring(start, pos);
        if (wildcard) {
            return new Token(TokenType.PATTERN, text, start);
        }
        if (inPredicate()) {
            switch (text) {
                case "and":
                    return new Token(TokenType.AND, text, start);
                case "or":
                    return new Token(TokenType.OR, text, start);
                case "not":
                    return new Token(TokenType.NOT, text, start);
                default:
                    break;
            }
        }
        return new Token(TokenType.IDENTIFIER, text, start);
    }

    private Token readString(char quote) {
        int start = pos;
        pos++;
        StringBuilder value = new StringBuilder();
        while (pos < input.length()) {
            char ch = peek(0);
            if (ch == quote) {
                pos++;
                return new Token(TokenType.STRING, value.toString(), start);
            }
            if (ch == '\\') {
                if (pos + 1 >= input.length()) {
                    break;
                }
                value.append(input.charAt(pos + 1));
                pos += 2;
                continue;
            }
            value.append(ch);
            pos++;
        }
        throw new LexException("Unterminated string literal", start);
    }

    private Token readNumber() {
        int start = pos;
        while (pos < input.length() && Character.isDigit(peek(0))) {
            pos++;
        }
        if (peek(0) == '.' && Character.isDigit(peek(1))) {
            pos++;
            while (pos < input.length() && Character.isDigit(peek(0))) {
                pos++;
            }
        }
        if (pos < input.length() && isWordStart(peek(0))) {
            throw new LexException("Unexpected character '" + peek(0) + "' after number", pos);
        }
        return new Token(TokenType.NUMBER, input.substring(start, pos), start);
    }

    private Token symbol(TokenType type, int length) {
        Token token = new Token(type, input.substring(pos, pos + length), pos);
        pos += length;
        return token;
    }

    private boolean inPredicate() {
        return bracketDepth > 0;
    }

    private char peek(int offset) {
        int index = pos + offset;
        return index < input.length() ? input.charAt(index) : '\0';
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }

    private static boolean isWordStart(char ch) {
        return Character.isLetter(ch) || ch == '_' || ch == '$' || ch == '*' || ch == '?';
    }

    private static boolean isWordPart(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_' || ch == '$' || ch == '*' || ch == '?';
    }
}
