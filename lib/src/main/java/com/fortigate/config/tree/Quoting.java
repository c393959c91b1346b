package com.fortigate.config.tree;

import java.util.Objects;

/** Double-quote handling for identifiers and values, using backslash escapes. */
public final class Quoting {

    private Quoting() {}

    /** Wraps {@code value} in double quotes, escaping backslashes and quotes. */
    public static String quote(String value) {
        Objects.requireNonNull(value, "value");
        return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }

    /**
     * Removes surrounding double quotes and unescapes the content. Tokens that are not
     * quoted are returned unchanged.
     */
    public static String unquote(String token) {
        Objects.requireNonNull(token, "token");
        if (!isQuoted(token)) {
            return token;
        }
        String body = token.substring(1, token.length() - 1);
        StringBuilder out = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                char next = body.charAt(i + 1);
                if (next == '\\' || next == '"') {
                    out.append(next);
                    i++;
                    continue;
                }
            }
            out.append(c);
        }
        return out.toString();
    }

    public static boolean isQuoted(String token) {
        return token.length() >= 2 && token.charAt(0) == '"' && token.charAt(token.length() - 1) == '"';
    }

    /** Quotes identifiers that would not survive as a bare word. */
    public static String quoteIfNeeded(String value) {
        Objects.requireNonNull(value, "value");
        if (value.isEmpty()) {
            return quote(value);
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isWhitespace(c) || c == '"' || c == '\\' || c == '#') {
                return quote(value);
            }
        }
        return value;
    }
}
