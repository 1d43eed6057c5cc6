package com.tinypy.script.lexer;

/**
 * Fatal lexical diagnostic. Scanning does not recover; the lexer that raised this keeps
 * rethrowing it on every later call.
 */
public class LexError extends RuntimeException {
    private final Location location;
    private final String detail;

    LexError(Location location, String detail) {
        this(location, detail, null);
    }

    LexError(Location location, String detail, Throwable cause) {
        super(location + ": " + detail, cause);
        this.location = location;
        this.detail = detail;
    }

    public Location location() { return location; }

    /** The message without the location prefix, e.g. {@code "Bad indentation."}. */
    public String detail() { return detail; }
}
