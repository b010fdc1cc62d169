package com.astpath.query;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class WildcardPatternTest {

    @ParameterizedTest
    @CsvSource({
        "Get*,       GetUser,      true",
        "Get*,       Get,          true",
        "Get*,       getUser,      false",
        "*User,      SetUser,      true",
        "*User,      UserService,  false",
        "Get*User*,  GetUserById,  true",
        "*Us*Id,     GetUserById,  true",
        "?etUser,    SetUser,      true",
        "?etUser,    etUser,       false",
        "*,          '',           true",
        "a*b*c,      aXbYbZc,      true",
        "a*b*c,      aXbYbZ,       false",
        "**,         anything,     true"
    })
    public void testMatches(String pattern, String text, boolean expected) {
        assertEquals(expected, WildcardPattern.matches(pattern, text));
    }

    @ParameterizedTest
    @CsvSource({"Get*, true", "?x, true", "GetUser, false", "if-statement, false"})
    public void testIsPattern(String text, boolean expected) {
        assertEquals(expected, WildcardPattern.isPattern(text));
    }
}
