package com.issueq.query;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ScannerTest {

    // ============================================================
    // Test Infrastructure
    // ============================================================

    private List<Token> scan(String text) {
        Scanner scanner = new Scanner();
        scanner.reset(text);
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = scanner.next();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return tokens;
    }

    private List<TokenType> types(String text) {
        return scan(text).stream().map(Token::type).collect(Collectors.toList());
    }

    // ============================================================
    // Token shapes
    // ============================================================

    @Test
    public void testQualifiedValue() {
        List<Token> tokens = scan("label:bug");

        assertEquals(List.of(
                new Token(TokenType.LITERAL, 0, 5),
                new Token(TokenType.COLON, 5, 6),
                new Token(TokenType.LITERAL, 6, 9),
                new Token(TokenType.EOF, 9, 9)), tokens);
    }

    @Test
    public void testNegatedQualifiedValue() {
        assertEquals(List.of(TokenType.DASH, TokenType.LITERAL, TokenType.COLON, TokenType.LITERAL, TokenType.EOF),
                types("-label:bug"));
    }

    @Test
    public void testDateRange() {
        List<Token> tokens = scan("2020-01-01..2020-02-01");

        assertEquals(List.of(
                new Token(TokenType.DATE, 0, 10),
                new Token(TokenType.RANGE, 10, 12),
                new Token(TokenType.DATE, 12, 22),
                new Token(TokenType.EOF, 22, 22)), tokens);
    }

    @Test
    public void testOpenRanges() {
        assertEquals(List.of(TokenType.RANGE_FIXED_END, TokenType.NUMBER, TokenType.EOF), types("*..10"));
        assertEquals(List.of(TokenType.NUMBER, TokenType.RANGE_FIXED_START, TokenType.EOF), types("10..*"));
    }

    @ParameterizedTest
    @CsvSource({
        "<5, LESS_THAN",
        "<=5, LESS_THAN_EQUAL",
        ">5, GREATER_THAN",
        ">=5, GREATER_THAN_EQUAL"
    })
    public void testComparators(String text, TokenType expected) {
        assertEquals(List.of(expected, TokenType.NUMBER, TokenType.EOF), types(text));
    }

    @Test
    public void testDateTime() {
        List<Token> tokens = scan(">=2020-01-01T10:00:00Z");

        assertEquals(TokenType.GREATER_THAN_EQUAL, tokens.get(0).type());
        assertEquals(new Token(TokenType.DATE_TIME, 2, 22), tokens.get(1));
    }

    @Test
    public void testVariableDefinition() {
        List<Token> tokens = scan("${user}=foo");

        assertEquals(new Token(TokenType.VARIABLE_NAME, 0, 7), tokens.get(0));
        assertEquals(new Token(TokenType.EQUALS, 7, 8), tokens.get(1));
        assertEquals(new Token(TokenType.LITERAL, 8, 11), tokens.get(2));
    }

    @Test
    public void testDollarWithoutBracesIsLiteral() {
        assertEquals(List.of(TokenType.LITERAL, TokenType.EOF), types("$user"));
    }

    @Test
    public void testSortKeywords() {
        assertEquals(new Token(TokenType.SORT_ASC_BY, 0, 8), scan("sort-by:created").get(0));
        assertEquals(new Token(TokenType.SORT_ASC_BY, 0, 12), scan("sort-asc-by:created").get(0));
        assertEquals(new Token(TokenType.SORT_DESC_BY, 0, 13), scan("sort-desc-by:created").get(0));
    }

    @Test
    public void testOrIsAWholeWord() {
        assertEquals(List.of(TokenType.LITERAL, TokenType.WHITESPACE, TokenType.OR, TokenType.WHITESPACE,
                TokenType.LITERAL, TokenType.EOF), types("a OR b"));
        assertEquals(List.of(TokenType.LITERAL, TokenType.EOF), types("ORANGE"));
        assertEquals(new Token(TokenType.OR, 2, 4), scan("a OR").get(2));
    }

    @Test
    public void testShaNeedsDigitsAndLetters() {
        assertEquals(TokenType.SHA, types("abc1234").get(0));
        assertEquals(TokenType.NUMBER, types("1234567").get(0));
        assertEquals(TokenType.LITERAL, types("deadbeef").get(0));
    }

    @Test
    public void testQuotedLiterals() {
        assertEquals(List.of(new Token(TokenType.QUOTED_LITERAL, 0, 13), Token.eof(13)), scan("\"hello world\""));
        // unterminated quotes run to the end of the line
        assertEquals(List.of(new Token(TokenType.QUOTED_LITERAL, 0, 4), new Token(TokenType.NEW_LINE, 4, 5),
                new Token(TokenType.LITERAL, 5, 6), Token.eof(6)), scan("\"abc\nx"));
    }

    @Test
    public void testCommentsAndNewLines() {
        List<Token> tokens = scan("a // comment\r\nb");

        assertEquals(List.of(
                new Token(TokenType.LITERAL, 0, 1),
                new Token(TokenType.WHITESPACE, 1, 2),
                new Token(TokenType.LINE_COMMENT, 2, 12),
                new Token(TokenType.NEW_LINE, 12, 14),
                new Token(TokenType.LITERAL, 14, 15),
                Token.eof(15)), tokens);
    }

    // ============================================================
    // Scanner contract
    // ============================================================

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "@#$%^&*()", "a:b:c", "\"\"\"", "=:-<>", "..*..*", "\t\r\n\r", "${", "x}{y"})
    public void testTokensCoverTheWholeInput(String text) {
        List<Token> tokens = scan(text);

        int expectedStart = 0;
        for (Token token : tokens) {
            assertEquals(expectedStart, token.start(), "gap before " + token);
            assertTrue(token.end() >= token.start());
            expectedStart = token.end();
        }
        assertEquals(text.length(), expectedStart);
        for (Token token : tokens.subList(0, tokens.size() - 1)) {
            assertTrue(token.length() > 0, "empty token " + token);
        }
    }

    @Test
    public void testEofRepeats() {
        Scanner scanner = new Scanner();
        scanner.reset("a");

        scanner.next();
        assertEquals(Token.eof(1), scanner.next());
        assertEquals(Token.eof(1), scanner.next());
    }

    @Test
    public void testResetPositionRescansSameToken() {
        Scanner scanner = new Scanner();
        scanner.reset("label:bug stars:>10");
        scanner.next();
        Token colon = scanner.next();
        scanner.next();
        scanner.next();

        scanner.resetPosition(colon);
        assertEquals(colon, scanner.next());
        assertEquals(new Token(TokenType.LITERAL, 6, 9), scanner.next());

        scanner.resetPosition(null);
        assertEquals(new Token(TokenType.LITERAL, 0, 5), scanner.next());
    }

    @Test
    public void testValue() {
        Scanner scanner = new Scanner();
        scanner.reset("-label:\"good first issue\"");

        scanner.next();
        assertEquals("label", scanner.value(scanner.next()));
        scanner.next();
        assertEquals("\"good first issue\"", scanner.value(scanner.next()));
    }
}
