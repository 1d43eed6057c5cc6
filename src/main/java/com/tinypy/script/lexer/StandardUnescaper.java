package com.tinypy.script.lexer;

/**
 * Backslash escapes: {@code \\ \" \' \n \t \r \0}. Anything else after a backslash is rejected.
 */
public final class StandardUnescaper implements Unescaper {

    public static final StandardUnescaper INSTANCE = new StandardUnescaper();

    private StandardUnescaper() {}

    @Override
    public String unescape(String raw) {
        if (raw.indexOf('\\') < 0) return raw;

        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (i + 1 >= raw.length()) {
                throw new IllegalArgumentException("dangling backslash");
            }
            char e = raw.charAt(++i);
            switch (e) {
                case '\\': sb.append('\\'); break;
                case '"': sb.append('"'); break;
                case '\'': sb.append('\''); break;
                case 'n': sb.append('\n'); break;
                case 't': sb.append('\t'); break;
                case 'r': sb.append('\r'); break;
                case '0': sb.append('\0'); break;
                default:
                    throw new IllegalArgumentException("unknown escape \\" + e);
            }
        }
        return sb.toString();
    }
}
