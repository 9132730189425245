package com.scanprev.script.parser;

public enum TokenType {
    // Single-character tokens
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE, LEFT_BRACKET, RIGHT_BRACKET,
    COMMA, SEMICOLON, AT,
    PLUS, MINUS, STAR, SLASH, PERCENT,

    // One or two character tokens
    DOUBLE_STAR,
    BANG, BANG_EQUAL,
    EQUAL, EQUAL_EQUAL,
    GREATER, GREATER_EQUAL,
    LESS, LESS_EQUAL,
    AND_AND, OR_OR,

    // Literals
    IDENTIFIER, STRING, NUMBER,

    // Keywords
    LET, IF, ELSE, WHILE, FOR, IN, TRUE, FALSE, NULL, FUNCTION, RETURN, BREAK,

    EOF
}
