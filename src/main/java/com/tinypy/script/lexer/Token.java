package com.tinypy.script.lexer;

public class Token {
    private final TokenType type;
    private final String lexeme;
    private final Object literal;
    private final Location location;

    Token(TokenType type, String lexeme, Object literal, Location location) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.location = location;
    }

    public TokenType type() { return type; }

    /** Exact source text of the token; empty for INDENT, DEDENT and EOF. */
    public String lexeme() { return lexeme; }

    /** Integer for NUMBER, decoded text for STRING, the name for NAME, otherwise null. */
    public Object literal() { return literal; }

    public Location location() { return location; }

    public boolean is(TokenType t) { return type == t; }

    public int intValue() {
        if (!(literal instanceof Integer)) {
            throw new IllegalStateException(type + " token has no integer value");
        }
        return (Integer) literal;
    }

    public String stringValue() {
        if (!(literal instanceof String)) {
            throw new IllegalStateException(type + " token has no string value");
        }
        return (String) literal;
    }

    @Override
    public String toString() {
        String head = (literal == null) ? type.name() : type + "(" + literal + ")";
        return head + "@" + location.line() + ":" + location.column();
    }
}
