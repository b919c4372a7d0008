package com.cubloc.playground.analysis;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class BasicTokenizerTest {

    private static List<String> texts(String line) {
        return BasicTokenizer.tokenize(line).stream().map(Token::text).toList();
    }

    @Test
    void testKeywordsAreUpperCasedWithOriginalOffsets() {
        List<Token> tokens = BasicTokenizer.tokenize("for i=1 to 10");
        assertEquals(List.of(
                new Token("FOR", 0, 3),
                new Token("I", 4, 1),
                new Token("TO", 8, 2)), tokens);
    }

    @Test
    void testNumbersAndOperatorsAreSkipped() {
        assertEquals(List.of("X1_Y", "A"), texts("x1_y = 2 * (a + 3)"));
        assertEquals(List.of("_TMP"), texts("_tmp=1"));
    }

    @Test
    void testStringContentsAreNotTokens() {
        assertEquals(List.of("PRINT"), texts("PRINT \"IF x THEN\""));
        assertEquals(List.of("X", "Y"), texts("x = \"say \"\"hi\"\" NEXT\" + y"));
    }

    @Test
    void testUnterminatedStringRunsToEndOfLine() {
        assertEquals(List.of("PRINT"), texts("PRINT \"abc NEXT"));
    }

    @Test
    void testApostropheStartsComment() {
        assertEquals(List.of("PRINT"), texts("PRINT \"it's\" ' NEXT"));
        assertEquals(List.of(), texts("' FOR i = 1 TO 3"));
    }

    @Test
    void testRemStartsCommentAndIsNotAToken() {
        assertEquals(List.of(), texts("rem this is FOR"));
        assertEquals(List.of("A"), texts("a = 1 REM FOR"));
        assertEquals(List.of("REMARK"), texts("Remark = 1"));
    }

    @Test
    void testEmptyLine() {
        assertTrue(BasicTokenizer.tokenize("").isEmpty());
        assertTrue(BasicTokenizer.tokenize("   \t ").isEmpty());
    }

    @Test
    void testUpperCasingIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertEquals(List.of("IF", "I", "THEN"), texts("if i then"));
        } finally {
            Locale.setDefault(previous);
        }
    }
}
