package com.issueq.query;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits query text into tokens.
 *
 * <p>Rules are tried in declaration order and the first one matching at the cursor wins,
 * so the more specific shapes (dates, numbers, sort keywords) must come before the
 * catch-all literal rule. Every character of the input ends up in some token.
 *
 * <p>The scanner can be rewound to any token it produced before; scanning again from
 * that point yields the same tokens.
 */
public class Scanner {

    private record Rule(TokenType type, Pattern pattern) {
        static Rule of(TokenType type, String regex) {
            return new Rule(type, Pattern.compile(regex));
        }
    }

    private static final List<Rule> RULES = List.of(
        Rule.of(TokenType.LINE_COMMENT, "//[^\\r\\n]*"),
        Rule.of(TokenType.NEW_LINE, "\\r\\n|\\r|\\n"),
        Rule.of(TokenType.WHITESPACE, "[^\\S\\r\\n]+"),
        Rule.of(TokenType.DATE_TIME, "\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}(?::\\d{2})?(?:Z|[+-]\\d{2}:\\d{2})?\\b"),
        Rule.of(TokenType.DATE, "\\d{4}-\\d{2}-\\d{2}\\b"),
        Rule.of(TokenType.NUMBER, "\\d+(?:\\.\\d+)?\\b"),
        // at least one digit and one letter, otherwise it is a number or a word
        Rule.of(TokenType.SHA, "(?=[a-fA-F]*\\d)(?=\\d*[a-fA-F])[a-fA-F0-9]{7,40}\\b"),
        Rule.of(TokenType.QUOTED_LITERAL, "\"[^\"\\r\\n]*\"?"),
        Rule.of(TokenType.SORT_ASC_BY, "sort-asc-by:|sort-by:"),
        Rule.of(TokenType.SORT_DESC_BY, "sort-desc-by:"),
        Rule.of(TokenType.OR, "OR(?=\\s|$)"),
        Rule.of(TokenType.VARIABLE_NAME, "\\$\\{[_a-zA-Z][_a-zA-Z0-9]*}"),
        Rule.of(TokenType.RANGE_FIXED_START, "\\.\\.\\*"),
        Rule.of(TokenType.RANGE_FIXED_END, "\\*\\.\\."),
        Rule.of(TokenType.RANGE, "\\.\\."),
        Rule.of(TokenType.LESS_THAN_EQUAL, "<="),
        Rule.of(TokenType.LESS_THAN, "<"),
        Rule.of(TokenType.GREATER_THAN_EQUAL, ">="),
        Rule.of(TokenType.GREATER_THAN, ">"),
        Rule.of(TokenType.COLON, ":"),
        Rule.of(TokenType.EQUALS, "="),
        Rule.of(TokenType.DASH, "-"),
        Rule.of(TokenType.LITERAL, "[^\\s:\"=]+")
    );

    private String text = "";
    private Matcher[] matchers = new Matcher[0];
    private int pos;

    public void reset(String text) {
        this.text = text == null ? "" : text;
        this.pos = 0;
        this.matchers = new Matcher[RULES.size()];
        for (int i = 0; i < matchers.length; i++) {
            Matcher matcher = RULES.get(i).pattern().matcher(this.text);
            // let \b and lookaheads see past the region start and end
            matcher.useTransparentBounds(true);
            matcher.useAnchoringBounds(false);
            matchers[i] = matcher;
        }
    }

    public Token next() {
        if (pos >= text.length()) {
            return Token.eof(text.length());
        }
        for (int i = 0; i < matchers.length; i++) {
            Matcher matcher = matchers[i];
            matcher.region(pos, text.length());
            if (matcher.lookingAt() && matcher.end() > pos) {
                Token token = new Token(RULES.get(i).type(), pos, matcher.end());
                pos = matcher.end();
                return token;
            }
        }
        // the literal rule accepts every non-space character and the
        // whitespace rules the rest, so this only guards progress
        Token token = new Token(TokenType.LITERAL, pos, pos + 1);
        pos++;
        return token;
    }

    /**
     * Moves the cursor back to the start of a previously returned token.
     */
    public void resetPosition(Token token) {
        pos = token == null ? 0 : token.start();
    }

    public String value(Token token) {
        return text.substring(token.start(), token.end());
    }
}
