package com.tinypy.script.lexer;

/**
 * Read position over the source text with line/column bookkeeping.
 *
 * Every consumed character goes through {@link #advanceColumn}: a newline starts the next
 * line at column 1, a tab jumps to the next tab stop, a carriage return leaves the column
 * alone and everything else moves one column. The last consumed character can be pushed
 * back once with {@link #unread()}.
 */
final class SourceCursor {
    static final int TAB_WIDTH = 8;

    private final String source;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    // state before the last advance(), for unread()
    private boolean canUnread = false;
    private int prevCurrent;
    private int prevLine;
    private int prevColumn;

    SourceCursor(String source) {
        this.source = source;
    }

    int line() { return line; }
    int column() { return column; }

    boolean isAtEnd() { return current >= source.length(); }

    boolean isAtEnd(int ahead) { return current + ahead >= source.length(); }

    char peek() { return peek(0); }

    char peek(int ahead) {
        int i = current + ahead;
        return (i < source.length()) ? source.charAt(i) : '\0';
    }

    char advance() {
        if (isAtEnd()) throw new IllegalStateException("advance past end of input");
        prevCurrent = current;
        prevLine = line;
        prevColumn = column;
        canUnread = true;

        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column = advanceColumn(column, c);
        }
        return c;
    }

    /** Pushes back the character returned by the last {@link #advance()}. */
    void unread() {
        if (!canUnread) throw new IllegalStateException("nothing to unread");
        current = prevCurrent;
        line = prevLine;
        column = prevColumn;
        canUnread = false;
    }

    /** Consumes {@code count} characters and returns them. */
    String take(int count) {
        int from = current;
        for (int i = 0; i < count; i++) advance();
        return source.substring(from, current);
    }

    /** The next {@code count} characters, without consuming them. */
    String lookahead(int count) {
        return source.substring(current, Math.min(source.length(), current + count));
    }

    /** Column reached after consuming {@code c} at {@code column}. Newlines are handled by the caller. */
    static int advanceColumn(int column, char c) {
        switch (c) {
            case '\t': return column + TAB_WIDTH - ((column - 1) % TAB_WIDTH);
            case '\r': return column;
            default: return column + 1;
        }
    }

    /**
     * Column that a run of indentation whitespace ends on, starting from column 1.
     * Spaces count one, tabs go to the next multiple of 8, carriage returns count nothing.
     */
    static int indentColumn(CharSequence run) {
        int total = 0;
        for (int i = 0; i < run.length(); i++) {
            char c = run.charAt(i);
            if (c == ' ') total++;
            else if (c == '\t') total += TAB_WIDTH - (total % TAB_WIDTH);
        }
        return total + 1;
    }
}
