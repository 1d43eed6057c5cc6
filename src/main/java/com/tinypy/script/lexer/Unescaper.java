package com.tinypy.script.lexer;

/** Decodes the interior of a string literal (the text between the quotes). */
@FunctionalInterface
public interface Unescaper {
    /**
     * @throws IllegalArgumentException if {@code raw} contains an escape the language does not accept
     */
    String unescape(String raw);
}
