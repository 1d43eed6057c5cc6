package com.tinypy.script.lexer;

import java.util.Objects;

/**
 * Start position of a piece of source text. Lines and columns are 1-based; columns
 * count tab stops, not characters. Only the lexer creates these.
 */
public final class Location {
    private final String sourceName;
    private final int line;
    private final int column;

    Location(String sourceName, int line, int column) {
        this.sourceName = sourceName;
        this.line = line;
        this.column = column;
    }

    public String sourceName() { return sourceName; }
    public int line() { return line; }
    public int column() { return column; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Location)) return false;
        Location other = (Location) o;
        return line == other.line && column == other.column && sourceName.equals(other.sourceName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceName, line, column);
    }

    @Override
    public String toString() {
        return sourceName + ":" + line + ":" + column;
    }
}
