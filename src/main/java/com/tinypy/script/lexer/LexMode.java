package com.tinypy.script.lexer;

/** Which rules the lexer applies to the next input. */
enum LexMode {
    /** Start of a logical line: blank lines are skipped and indentation is measured. */
    LINE_START,
    /** Body of a logical line: ordinary tokens up to the line break. */
    IN_LINE,
    /** Indentation dropped; one DEDENT per call until the stack top matches it. */
    DEDENT_RESOLUTION
}
