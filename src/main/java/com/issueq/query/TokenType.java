package com.issueq.query;

public enum TokenType {
    LITERAL,
    QUOTED_LITERAL,
    NUMBER,
    DATE,
    DATE_TIME,
    WHITESPACE,
    NEW_LINE,
    LINE_COMMENT,
    OR,
    SORT_ASC_BY,
    SORT_DESC_BY,
    LESS_THAN,
    LESS_THAN_EQUAL,
    GREATER_THAN,
    GREATER_THAN_EQUAL,
    RANGE,              // ..
    RANGE_FIXED_START,  // ..*
    RANGE_FIXED_END,    // *..
    DASH,
    COLON,
    EQUALS,
    VARIABLE_NAME,      // ${name}
    SHA,
    EOF
}
