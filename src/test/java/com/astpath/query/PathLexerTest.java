package com.astpath.query;

import org.eclipse.collections.api.list.ImmutableList;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PathLexerTest {

    private List<TokenType> types(String path) {
        return PathLexer.tokenize(path).collect(Token::type).castToList();
    }

    @Test
    public void testStepsWithPattern() {
        ImmutableList<Token> tokens = PathLexer.tokenize("//method[Get*]/block");

        assertEquals(List.of(
                new Token(TokenType.DOUBLE_SLASH, "//", 0),
                new Token(TokenType.IDENTIFIER, "method", 2),
                new Token(TokenType.LEFT_BRACKET, "[", 8),
                new Token(TokenType.PATTERN, "Get*", 9),
                new Token(TokenType.RIGHT_BRACKET, "]", 13),
                new Token(TokenType.SLASH, "/", 14),
                new Token(TokenType.IDENTIFIER, "block", 15),
                new Token(TokenType.EOF, "", 20)), tokens.castToList());
    }

    @Test
    public void testHyphenatedKindsAndPatterns() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.EOF), types("if-statement"));
        assertEquals(List.of(TokenType.PATTERN, TokenType.EOF), types("*-statement"));
        assertEquals(List.of(TokenType.PATTERN, TokenType.EOF), types("if-*"));
        assertEquals("?et_$User", PathLexer.tokenize("?et_$User").getFirst().text());
    }

    @Test
    public void testKeywordsOnlyInsidePredicates() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.LEFT_BRACKET, TokenType.AND, TokenType.OR,
                TokenType.NOT, TokenType.RIGHT_BRACKET, TokenType.SLASH, TokenType.IDENTIFIER, TokenType.EOF),
                types("and[and or not]/not"));
    }

    @Test
    public void testMinusInsidePredicate() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.LEFT_BRACKET, TokenType.IDENTIFIER,
                TokenType.LEFT_PAREN, TokenType.RIGHT_PAREN, TokenType.MINUS, TokenType.NUMBER,
                TokenType.RIGHT_BRACKET, TokenType.EOF), types("a[last()-1]"));
    }

    @Test
    public void testOperators() {
        assertEquals(List.of(TokenType.AT, TokenType.IDENTIFIER, TokenType.EQUALS, TokenType.NOT_EQUALS,
                TokenType.TOKEN_CONTAINS, TokenType.LESS_THAN, TokenType.LESS_OR_EQUAL, TokenType.GREATER_THAN,
                TokenType.GREATER_OR_EQUAL, TokenType.COMMA, TokenType.EOF), types("@k = != ~= < <= > >= ,"));
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.AXIS_SEPARATOR, TokenType.IDENTIFIER,
                TokenType.SLASH, TokenType.DOT_DOT, TokenType.SLASH, TokenType.DOT, TokenType.EOF),
                types("ancestor::class/../."));
    }

    @Test
    public void testStringLiterals() {
        Token single = PathLexer.tokenize("['it\\'s']").get(1);
        assertEquals(TokenType.STRING, single.type());
        assertEquals("it's", single.text());
        assertEquals(1, single.offset());

        assertEquals("Generic<T>", PathLexer.tokenize("[\"Generic<T>\"]").get(1).text());
        assertEquals("a\\b", PathLexer.tokenize("['a\\\\b']").get(1).text());
    }

    @Test
    public void testNumbers() {
        assertEquals("12", PathLexer.tokenize("[12]").get(1).text());
        assertEquals("1.5", PathLexer.tokenize("[@x > 1.5]").get(4).text());
    }

    @Test
    public void testWhitespaceIsSkipped() {
        assertEquals(types("a[@x='1']"), types("  a [ @x = '1' ]  "));
        assertEquals(List.of(TokenType.EOF), types("   "));
    }

    @Test
    public void testUnterminatedString() {
        LexException e = assertThrows(LexException.class, () -> PathLexer.tokenize("[@x='abc]"));
        assertEquals(4, e.getPosition());
        assertEquals("Unterminated string literal", e.getReason());
    }

    @Test
    public void testIllegalCharacters() {
        assertEquals(6, assertThrows(LexException.class, () -> PathLexer.tokenize("method#")).getPosition());
        assertEquals(1, assertThrows(LexException.class, () -> PathLexer.tokenize("a-")).getPosition());
        assertEquals(1, assertThrows(LexException.class, () -> PathLexer.tokenize("a:b")).getPosition());
        assertEquals(3, assertThrows(LexException.class, () -> PathLexer.tokenize("[@x!y]")).getPosition());
        assertEquals(2, assertThrows(LexException.class, () -> PathLexer.tokenize("[2abc]")).getPosition());
    }

    @Test
    public void testErrorMessageNamesPosition() {
        LexException e = assertThrows(LexException.class, () -> PathLexer.tokenize("a~b"));
        assertEquals("Unexpected character '~' at position 1", e.getMessage());
    }
}
