package com.tinypy.script;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tinypy.script.lexer.LexError;
import com.tinypy.script.lexer.Location;
import com.tinypy.script.lexer.Token;

import java.util.List;

/** JSON view of lexer output, used by the command-line dumper. */
public final class TokenJson {

    private static final ObjectMapper om = new ObjectMapper();

    public static ArrayNode toJson(List<Token> tokens) {
        ArrayNode arr = om.createArrayNode();
        for (Token t : tokens) arr.add(toJson(t));
        return arr;
    }

    public static ObjectNode toJson(Token t) {
        ObjectNode n = om.createObjectNode();
        n.put("type", t.type().name());
        n.put("lexeme", t.lexeme());
        putLocation(n, t.location());

        Object v = t.literal();
        if (v instanceof Integer) n.put("value", (Integer) v);
        else if (v instanceof String) n.put("value", (String) v);
        return n;
    }

    public static ObjectNode toJson(LexError e) {
        ObjectNode n = om.createObjectNode();
        n.put("error", e.detail());
        putLocation(n, e.location());
        return n;
    }

    public static String pretty(Object node) {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (Exception e) {
            throw new IllegalStateException("JSON rendering failed: " + e.getMessage(), e);
        }
    }

    private static void putLocation(ObjectNode n, Location loc) {
        n.put("line", loc.line());
        n.put("column", loc.column());
        n.put("source", loc.sourceName());
    }

    private TokenJson() {}
}
