package com.tinypy.script.lexer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SourceCursorTest {

    @Test
    void indentColumn_spacesOnly_isCountPlusOne() {
        for (int n = 0; n < 40; n++) {
            assertEquals(n + 1, SourceCursor.indentColumn(" ".repeat(n)), "spaces: " + n);
        }
    }

    @Test
    void indentColumn_tabsJumpToNextStop() {
        assertEquals(9, SourceCursor.indentColumn("\t"));
        assertEquals(9, SourceCursor.indentColumn("   \t"));
        assertEquals(9, SourceCursor.indentColumn("       \t"));
        assertEquals(17, SourceCursor.indentColumn("        \t"));
        assertEquals(17, SourceCursor.indentColumn("\t\t"));
        assertEquals(11, SourceCursor.indentColumn("\t  "));
    }

    @Test
    void indentColumn_ignoresCarriageReturn() {
        assertEquals(5, SourceCursor.indentColumn("\r    "));
    }

    @Test
    void advance_tracksTabStopsAndLines() {
        SourceCursor c = new SourceCursor("a\tb\nc");
        c.advance();
        assertEquals(2, c.column());
        c.advance(); // tab from column 2
        assertEquals(9, c.column());
        c.advance();
        assertEquals(10, c.column());
        c.advance(); // newline
        assertEquals(2, c.line());
        assertEquals(1, c.column());
        assertEquals('c', c.advance());
        assertTrue(c.isAtEnd());
    }

    @Test
    void carriageReturn_doesNotMoveColumn() {
        SourceCursor c = new SourceCursor("x\r\ny");
        c.take(2);
        assertEquals(1, c.line());
        assertEquals(2, c.column());
        c.advance();
        assertEquals(2, c.line());
        assertEquals(1, c.column());
    }

    @Test
    void unread_restoresPositionOnce() {
        SourceCursor c = new SourceCursor("ab\ncd");
        c.take(2);
        c.advance(); // newline
        assertEquals(2, c.line());

        c.unread();
        assertEquals(1, c.line());
        assertEquals(3, c.column());
        assertEquals('\n', c.peek());

        assertThrows(IllegalStateException.class, c::unread);
    }

    @Test
    void peek_pastEnd_returnsNul() {
        SourceCursor c = new SourceCursor("a");
        assertEquals('a', c.peek());
        assertEquals('\0', c.peek(1));
        assertTrue(c.isAtEnd(1));
        assertFalse(c.isAtEnd(0));
        assertEquals("a", c.lookahead(5));
    }
}
