package com.tinypy.script;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.tinypy.debug.Debug;
import com.tinypy.debug.DebugLevel;
import com.tinypy.debug.StreamDebugSink;
import com.tinypy.script.lexer.LexError;
import com.tinypy.script.lexer.Lexer;
import com.tinypy.script.lexer.Token;
import com.tinypy.script.lexer.TokenType;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Prints the token stream of a source file.
 *
 *   TinyPyLexCli [--json] [--debug[=TRACE|DEBUG|INFO|WARN|ERROR]] [file | -]
 *
 * Exit codes: 0 ok, 1 lexical error, 2 usage, 3 I/O failure.
 */
public final class TinyPyLexCli {

    static final int EXIT_OK = 0;
    static final int EXIT_LEX_ERROR = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_IO = 3;

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    static int run(String[] args, InputStream stdin, PrintStream out, PrintStream err) {
        Map<String, String> flags = new HashMap<>();
        List<String> positional = new ArrayList<>();
        parseArgs(args, flags, positional);

        if (positional.size() > 1 || flags.containsKey("help")) {
            err.println("Usage: TinyPyLexCli [--json] [--debug[=LEVEL]] [file | -]");
            return EXIT_USAGE;
        }

        if (flags.containsKey("debug")) {
            String lv = flags.get("debug");
            Debug.get().setSink(new StreamDebugSink(err,
                    "true".equals(lv) ? DebugLevel.TRACE : DebugLevel.parse(lv, DebugLevel.TRACE)));
        }

        final String name = positional.isEmpty() ? "-" : positional.get(0);
        final String source;
        try {
            source = "-".equals(name)
                    ? new String(stdin.readAllBytes(), StandardCharsets.UTF_8)
                    : Files.readString(Path.of(name), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Failed to read source: " + name);
            Debug.get().e("tinypy.cli", "read failed: " + name, e);
            return EXIT_IO;
        }

        boolean json = flags.containsKey("json");
        Lexer lexer = new Lexer(source, "-".equals(name) ? "<stdin>" : name);
        List<Token> tokens = new ArrayList<>();
        try {
            Token t;
            do {
                t = lexer.nextToken();
                tokens.add(t);
                if (!json) out.println(t);
            } while (!t.is(TokenType.EOF));
        } catch (LexError e) {
            if (json) {
                ArrayNode arr = TokenJson.toJson(tokens);
                arr.add(TokenJson.toJson(e));
                out.println(TokenJson.pretty(arr));
            }
            err.println(e.getMessage());
            return EXIT_LEX_ERROR;
        }

        if (json) out.println(TokenJson.pretty(TokenJson.toJson(tokens)));
        return EXIT_OK;
    }

    /**
     * Minimal arg parser:
     *   --json --debug=TRACE path/to/file.py
     */
    private static void parseArgs(String[] args, Map<String, String> flags, List<String> positional) {
        for (String a : args) {
            if (a.startsWith("--") && a.contains("=")) {
                int i = a.indexOf('=');
                flags.put(a.substring(2, i), a.substring(i + 1));
            } else if (a.startsWith("--")) {
                flags.put(a.substring(2), "true");
            } else {
                positional.add(a);
            }
        }
    }

    private TinyPyLexCli() {}
}
