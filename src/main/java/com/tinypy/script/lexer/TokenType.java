package com.tinypy.script.lexer;

public enum TokenType {
    // Structure
    EOF, NEWLINE, INDENT, DEDENT,

    // Literals
    STRING, NUMBER, NAME,

    // Operators
    ASSIGN, PLUS_ASSIGN, MINUS_ASSIGN,
    LESS, LESS_EQ, EQUAL,
    LPAREN, RPAREN, COLON,
    PLUS, MINUS, TIMES, INT_DIV, MOD,

    // Keywords
    AND, OR, NOT, IF, WHILE,
    PRINT, PASS, INPUT, INT_TYPE, STR_TYPE,
    TRUE, FALSE, NONE;

    /** True for tokens synthesized from line structure rather than matched text. */
    public boolean isStructural() {
        return this == NEWLINE || this == INDENT || this == DEDENT || this == EOF;
    }
}
