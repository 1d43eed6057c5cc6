package com.tinypy.script.lexer;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.tinypy.script.lexer.TokenType.*;
import static org.junit.jupiter.api.Assertions.*;

public class LexerTokenTest {

    @Test
    void keywords_winOverNames() {
        String src = "and or not if while print pass input int str True False None\n";
        assertEquals(List.of(AND, OR, NOT, IF, WHILE, PRINT, PASS, INPUT, INT_TYPE, STR_TYPE,
                TRUE, FALSE, NONE, NEWLINE, EOF), types(src));
    }

    @Test
    void orAndPlusAssign_areDistinct() {
        assertEquals(List.of(NAME, OR, NAME, PLUS_ASSIGN, NUMBER, NEWLINE, EOF), types("a or b += 1\n"));
    }

    @Test
    void keywordPrefixes_areNames() {
        List<Token> ts = tokens("iffy true none _x x1 printer\n");
        for (int i = 0; i < 6; i++) assertEquals(NAME, ts.get(i).type(), ts.get(i).lexeme());
        assertEquals("printer", ts.get(5).stringValue());
    }

    @Test
    void operators() {
        assertEquals(List.of(NAME, PLUS_ASSIGN, NAME, MINUS_ASSIGN, NAME, LESS_EQ, NAME, EQUAL, NAME, NEWLINE, EOF),
                types("a += b -= c <= d == e\n"));
        assertEquals(List.of(ASSIGN, PLUS, MINUS, TIMES, LESS, LPAREN, RPAREN, INT_DIV, MOD, COLON, NEWLINE, EOF),
                types("= + - * < ( ) // % :\n"));
    }

    @Test
    void operators_withoutSpaces() {
        assertEquals(List.of(NAME, ASSIGN, LPAREN, NAME, PLUS, NUMBER, RPAREN, INT_DIV, NUMBER, MOD, NUMBER, NEWLINE, EOF),
                types("x=(y+1)//2%3\n"));
    }

    @Test
    void numbers() {
        List<Token> ts = tokens("0 7 42 2147483647\n");
        assertEquals(0, ts.get(0).intValue());
        assertEquals(7, ts.get(1).intValue());
        assertEquals(42, ts.get(2).intValue());
        assertEquals(Integer.MAX_VALUE, ts.get(3).intValue());
    }

    @Test
    void leadingZero_isItsOwnLiteral() {
        List<Token> ts = tokens("007\n");
        assertEquals(List.of(NUMBER, NUMBER, NUMBER, NEWLINE, EOF), types(ts));
        assertEquals(0, ts.get(0).intValue());
        assertEquals(0, ts.get(1).intValue());
        assertEquals(7, ts.get(2).intValue());
    }

    @Test
    void numberOverflow_isFatal() {
        LexError e = assertThrows(LexError.class, () -> tokens("x = 99999999999\n"));
        assertEquals("Integer literal out of range: 99999999999", e.detail());
        assertEquals(5, e.location().column());
        assertInstanceOf(NumberFormatException.class, e.getCause());
    }

    @Test
    void strings_areUnescaped() {
        List<Token> ts = tokens("print \"a\\tb\" 'it''s'\n");
        assertEquals(STRING, ts.get(1).type());
        assertEquals("a\tb", ts.get(1).stringValue());
        assertEquals("\"a\\tb\"", ts.get(1).lexeme());
        assertEquals("it", ts.get(2).stringValue());
        assertEquals("s", ts.get(3).stringValue());
        assertEquals("", tokens("''\n").get(0).stringValue());
    }

    @Test
    void otherQuote_isPlainContent() {
        assertEquals("say 'hi'", tokens("\"say 'hi'\"\n").get(0).stringValue());
    }

    @Test
    void customUnescaper_isUsed() {
        Lexer lx = new Lexer("\"abc\"\n", "t.py", raw -> raw.toUpperCase());
        assertEquals("ABC", lx.nextToken().stringValue());
    }

    @Test
    void unterminatedString_isUnexpectedQuote() {
        LexError e = assertThrows(LexError.class, () -> tokens("x = \"abc\n"));
        assertEquals("Unexpected character: \"", e.detail());
        assertEquals(1, e.location().line());
        assertEquals(5, e.location().column());
    }

    @Test
    void tabInsideString_isRejected() {
        LexError e = assertThrows(LexError.class, () -> tokens("'a\tb'\n"));
        assertEquals("Unexpected character: '", e.detail());
    }

    @Test
    void badEscape_reportsStringStart() {
        LexError e = assertThrows(LexError.class, () -> tokens("  print \"\\q\"\n"));
        assertTrue(e.detail().startsWith("Bad string literal:"), e.detail());
        assertEquals(9, e.location().column());
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
    }

    @Test
    void unexpectedCharacter() {
        LexError e = assertThrows(LexError.class, () -> tokens("x = 1\ny = 2 $ 3\n"));
        assertEquals("Unexpected character: $", e.detail());
        assertEquals(2, e.location().line());
        assertEquals(7, e.location().column());
        assertEquals("t.py:2:7: Unexpected character: $", e.getMessage());
    }

    @Test
    void singleSlash_isUnexpected() {
        LexError e = assertThrows(LexError.class, () -> tokens("a / b\n"));
        assertEquals("Unexpected character: /", e.detail());
        assertEquals(3, e.location().column());
    }

    @Test
    void failedSession_rethrowsSameError() {
        Lexer lx = new Lexer("a ? b\n", "t.py");
        assertEquals(NAME, lx.nextToken().type());
        LexError first = assertThrows(LexError.class, lx::nextToken);
        LexError second = assertThrows(LexError.class, lx::nextToken);
        assertSame(first, second);
        assertFalse(lx.isFinished());
    }

    @Test
    void comments_endTheLine() {
        List<Token> ts = tokens("x = 1  # set x\ny\n");
        assertEquals(List.of(NAME, ASSIGN, NUMBER, NEWLINE, NAME, NEWLINE, EOF), types(ts));
        assertEquals(15, ts.get(3).location().column());
        assertEquals(List.of(NAME, EOF), types("x # no newline"));
    }

    @Test
    void locations_followTabStops() {
        List<Token> ts = tokens("a\tb  c\n");
        assertEquals(1, ts.get(0).location().column());
        assertEquals(9, ts.get(1).location().column());
        assertEquals(12, ts.get(2).location().column());
        assertEquals(13, ts.get(3).location().column());
    }

    @Test
    void lexemes_reproduceSignificantText() {
        String src = String.join("\n",
                "# header",
                "n = int(input())",
                "while n < 10:",
                "    n += 1",
                "",
                "    if not n % 2 == 0 and True:",
                "        print \"odd\"  # trailing",
                "print n // 3",
                "");
        StringBuilder sb = new StringBuilder();
        for (Token t : tokens(src)) {
            if (t.is(NEWLINE)) sb.append('\n');
            else if (!t.type().isStructural()) {
                if (sb.length() > 0 && sb.charAt(sb.length() - 1) != '\n') sb.append(' ');
                sb.append(t.lexeme());
            }
        }
        assertEquals(String.join("\n",
                "n = int ( input ( ) )",
                "while n < 10 :",
                "n += 1",
                "if not n % 2 == 0 and True :",
                "print \"odd\"",
                "print n // 3",
                ""), sb.toString());
    }

    @Test
    void nullSourceName_defaultsToInput() {
        Lexer lx = new Lexer("x\n", null);
        assertEquals("<input>", lx.sourceName());
        assertEquals("<input>", lx.nextToken().location().sourceName());
        assertEquals("main.py", new Lexer("", "main.py").sourceName());
        assertThrows(IllegalArgumentException.class, () -> new Lexer(null, "t.py"));
    }

    private static List<Token> tokens(String src) {
        return new Lexer(src, "t.py").tokenize();
    }

    private static List<TokenType> types(String src) {
        return types(tokens(src));
    }

    private static List<TokenType> types(List<Token> ts) {
        List<TokenType> out = new ArrayList<>();
        for (Token t : ts) out.add(t.type());
        return out;
    }
}
