package com.issueq.query;

/**
 * A scanned token covering {@code [start, end)} of the input.
 */
public record Token(TokenType type, int start, int end) {

    public static Token eof(int offset) {
        return new Token(TokenType.EOF, offset, offset);
    }

    public int length() {
        return end - start;
    }
}
