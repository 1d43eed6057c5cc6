package com.tinypy.script.lexer;

import com.tinypy.debug.Debug;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Pull lexer for the indentation-sensitive teaching language.
 *
 * Each {@link #nextToken()} call returns exactly one token. Block structure is reported with
 * synthetic NEWLINE / INDENT / DEDENT tokens; every INDENT is closed by one DEDENT, at the latest
 * right before EOF. Once EOF has been returned it is returned again on every call.
 *
 * Usage:
 *   Lexer lexer = new Lexer(source, "main.py");
 *   for (Token t = lexer.nextToken(); !t.is(TokenType.EOF); t = lexer.nextToken()) { ... }
 *
 * Any lexical error is fatal and raised as {@link LexError}; the same error is rethrown by
 * later calls.
 */
public class Lexer {
    private static final String TAG = "tinypy.lexer";

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("and", TokenType.AND);
        map.put("or", TokenType.OR);
        map.put("not", TokenType.NOT);
        map.put("if", TokenType.IF);
        map.put("while", TokenType.WHILE);
        map.put("print", TokenType.PRINT);
        map.put("pass", TokenType.PASS);
        map.put("input", TokenType.INPUT);
        map.put("int", TokenType.INT_TYPE);
        map.put("str", TokenType.STR_TYPE);
        map.put("True", TokenType.TRUE);
        map.put("False", TokenType.FALSE);
        map.put("None", TokenType.NONE);
        keywords = Collections.unmodifiableMap(map);
    }

    private final String sourceName;
    private final Unescaper unescaper;
    private final SourceCursor cursor;
    private final IndentStack indents = new IndentStack();
    private LexMode mode = LexMode.LINE_START;

    private Token eofToken = null;
    private LexError failure = null;

    public Lexer(String source, String sourceName) {
        this(source, sourceName, StandardUnescaper.INSTANCE);
    }

    public Lexer(String source, String sourceName, Unescaper unescaper) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        if (unescaper == null) throw new IllegalArgumentException("unescaper must not be null");
        this.cursor = new SourceCursor(source);
        this.sourceName = (sourceName == null) ? "<input>" : sourceName;
        this.unescaper = unescaper;
    }

    // ===================== PUBLIC API =====================

    public Token nextToken() {
        if (failure != null) throw failure;
        if (eofToken != null) return eofToken;

        try {
            while (true) {
                Token t;
                switch (mode) {
                    case LINE_START: t = lineStart(); break;
                    case DEDENT_RESOLUTION: t = resolveDedent(); break;
                    case IN_LINE: t = inLine(); break;
                    default: throw new IllegalStateException("mode " + mode);
                }
                if (t != null) return t;
            }
        } catch (LexError e) {
            failure = e;
            Debug.get().d(TAG, "session failed: " + e.getMessage());
            throw e;
        }
    }

    /** Pulls tokens up to and including EOF. */
    public List<Token> tokenize() {
        List<Token> out = new ArrayList<>();
        Token t;
        do {
            t = nextToken();
            out.add(t);
        } while (!t.is(TokenType.EOF));
        return Collections.unmodifiableList(out);
    }

    /** Location of the next unconsumed character. */
    public Location locate() {
        return new Location(sourceName, cursor.line(), cursor.column());
    }

    public String sourceName() { return sourceName; }

    /** Number of blocks currently open. */
    public int indentDepth() { return indents.depth(); }

    public boolean isFinished() { return eofToken != null; }

    // ===================== LINE START =====================

    private Token lineStart() {
        int run = indentRunLength();

        if (cursor.isAtEnd(run)) {
            cursor.take(run);
            return endOfInput();
        }

        char first = cursor.peek(run);
        if (first == '\n' || first == '#') {
            skipBlankLine();
            return null;
        }

        int level = SourceCursor.indentColumn(cursor.lookahead(run));
        int last = indents.top();

        if (level == last) {
            cursor.take(run);
            enter(LexMode.IN_LINE);
            return null;
        }

        if (level > last) {
            Location at = locate();
            cursor.take(run);
            indents.push(level);
            trace("INDENT to column " + level + ", stack " + indents);
            enter(LexMode.IN_LINE);
            return new Token(TokenType.INDENT, "", null, at);
        }

        // Checked up front so a bad dedent fails before any DEDENT of that line is handed out.
        if (!indents.contains(level)) {
            throw fail("Bad indentation.");
        }
        enter(LexMode.DEDENT_RESOLUTION);
        return null;
    }

    private void skipBlankLine() {
        while (!cursor.isAtEnd() && cursor.peek() != '\n') cursor.advance();
        if (!cursor.isAtEnd()) consumeLineBreak();
    }

    /** Leading spaces, tabs and carriage returns at the cursor. */
    private int indentRunLength() {
        int n = 0;
        while (true) {
            char c = cursor.peek(n);
            if (c != ' ' && c != '\t' && c != '\r') break;
            n++;
        }
        return n;
    }

    // ===================== DEDENT RESOLUTION =====================

    private Token resolveDedent() {
        int run = indentRunLength();
        int target = SourceCursor.indentColumn(cursor.lookahead(run));
        int top = indents.top();

        // lineStart() already rejected targets missing from the stack, so top >= target here.
        if (top > target) {
            indents.pop();
            trace("DEDENT from column " + top + ", stack " + indents);
            return new Token(TokenType.DEDENT, "", null, locate());
        }

        cursor.take(run);
        enter(LexMode.IN_LINE);
        return null;
    }

    // ===================== END OF INPUT =====================

    private Token endOfInput() {
        Location at = locate();
        if (indents.depth() > 0) {
            int level = indents.pop();
            trace("EOF flush: DEDENT from column " + level);
            return new Token(TokenType.DEDENT, "", null, at);
        }
        trace("EOF at " + at);
        eofToken = new Token(TokenType.EOF, "", null, at);
        return eofToken;
    }

    // ===================== IN LINE =====================

    private Token inLine() {
        if (cursor.isAtEnd()) return endOfInput();

        Location start = locate();
        char c = cursor.peek();

        switch (c) {
            case ' ':
            case '\t':
                cursor.advance();
                return null;
            case '\r':
                if (cursor.peek(1) == '\n') return newline(start);
                cursor.advance();
                return null;
            case '\n':
                return newline(start);
            case '#':
                while (!cursor.isAtEnd() && cursor.peek() != '\n') cursor.advance();
                return null;
            case '"':
            case '\'':
                return string(start, c);
            default:
                if (isDigit(c)) return number(start);
                if (isAlpha(c)) return word(start);
                return operator(start, c);
        }
    }

    private Token newline(Location start) {
        String text = consumeLineBreak();
        enter(LexMode.LINE_START);
        return new Token(TokenType.NEWLINE, text, null, start);
    }

    /** Consumes one line break: {@code \n}, {@code \r\n} or {@code \n\r}. */
    private String consumeLineBreak() {
        int n = 0;
        if (cursor.peek(n) == '\r') n++;
        n++; // '\n'
        if (cursor.peek(n) == '\r' && !cursor.isAtEnd(n)) n++;
        return cursor.take(n);
    }

    private Token string(Location start, char quote) {
        int n = 1;
        while (!cursor.isAtEnd(n)) {
            char c = cursor.peek(n);
            if (c == quote || c == '\n' || c == '\r' || c == '\t') break;
            n++;
        }
        if (cursor.isAtEnd(n) || cursor.peek(n) != quote) {
            throw fail(start, "Unexpected character: " + quote);
        }

        String text = cursor.take(n + 1);
        String raw = text.substring(1, text.length() - 1);
        String value;
        try {
            value = unescaper.unescape(raw);
        } catch (IllegalArgumentException e) {
            throw fail(start, "Bad string literal: " + e.getMessage(), e);
        }
        return new Token(TokenType.STRING, text, value, start);
    }

    private Token number(Location start) {
        int n = 1;
        // no leading zeros: "0" is a literal of its own
        if (cursor.peek() != '0') {
            while (!cursor.isAtEnd(n) && isDigit(cursor.peek(n))) n++;
        }
        String text = cursor.take(n);
        int value;
        try {
            value = Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw fail(start, "Integer literal out of range: " + text, e);
        }
        return new Token(TokenType.NUMBER, text, value, start);
    }

    private Token word(Location start) {
        int n = 1;
        while (!cursor.isAtEnd(n) && isAlphaNumeric(cursor.peek(n))) n++;
        String text = cursor.take(n);
        TokenType kw = keywords.get(text);
        if (kw != null) return new Token(kw, text, null, start);
        return new Token(TokenType.NAME, text, text, start);
    }

    private Token operator(Location start, char c) {
        switch (c) {
            case '+': return withEquals(start, TokenType.PLUS_ASSIGN, TokenType.PLUS);
            case '-': return withEquals(start, TokenType.MINUS_ASSIGN, TokenType.MINUS);
            case '<': return withEquals(start, TokenType.LESS_EQ, TokenType.LESS);
            case '=': return withEquals(start, TokenType.EQUAL, TokenType.ASSIGN);
            case '*': return single(start, TokenType.TIMES);
            case '%': return single(start, TokenType.MOD);
            case '(': return single(start, TokenType.LPAREN);
            case ')': return single(start, TokenType.RPAREN);
            case ':': return single(start, TokenType.COLON);
            case '/':
                cursor.advance();
                if (cursor.peek() == '/' && !cursor.isAtEnd()) {
                    cursor.advance();
                    return new Token(TokenType.INT_DIV, "//", null, start);
                }
                cursor.unread();
                throw fail("Unexpected character: /");
            default:
                throw fail("Unexpected character: " + c);
        }
    }

    private Token withEquals(Location start, TokenType pair, TokenType alone) {
        if (cursor.peek(1) == '=' && !cursor.isAtEnd(1)) {
            return new Token(pair, cursor.take(2), null, start);
        }
        return single(start, alone);
    }

    private Token single(Location start, TokenType type) {
        return new Token(type, cursor.take(1), null, start);
    }

    // ===================== HELPERS =====================

    private static boolean isDigit(char c) { return c >= '0' && c <= '9'; }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isAlphaNumeric(char c) { return isAlpha(c) || isDigit(c); }

    private void enter(LexMode next) {
        if (next != mode) trace(mode + " -> " + next + " at " + locate());
        mode = next;
    }

    private void trace(String msg) {
        Debug d = Debug.get();
        if (d.isEnabled()) d.t(TAG, msg);
    }

    private LexError fail(String msg) {
        return fail(locate(), msg, null);
    }

    private LexError fail(Location at, String msg) {
        return fail(at, msg, null);
    }

    private LexError fail(Location at, String msg, Throwable cause) {
        return new LexError(at, msg, cause);
    }
}
