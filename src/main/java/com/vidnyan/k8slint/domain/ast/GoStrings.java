package com.vidnyan.k8slint.domain.ast;

/**
 * Go string literal quoting.
 */
public final class GoStrings {

    private GoStrings() {
    }

    /**
     * Content of an interpreted ({@code "..."}) or raw ({@code `...`}) string literal.
     * Malformed escapes are kept verbatim.
     */
    public static String unquote(String literal) {
        if (literal == null || literal.length() < 2) {
            return literal;
        }
        char quote = literal.charAt(0);
        String body = literal.substring(1, literal.length() - 1);
        if (quote == '`') {
            return body.replace("\r", "");
        }
        if (quote != '"' && quote != '\'') {
            return literal;
        }
        StringBuilder out = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                out.append(c);
                continue;
            }
            char next = body.charAt(++i);
            switch (next) {
                case 'n' -> out.append('\n');
                case 't' -> out.append('\t');
                case 'r' -> out.append('\r');
                case 'a' -> out.append('\u0007');
                case 'b' -> out.append('\b');
                case 'f' -> out.append('\f');
                case 'v' -> out.append('\u000B');
                case '\\', '"', '\'' -> out.append(next);
                case 'x' -> i = appendCodePoint(body, i - 1, i + 1, 2, 16, out);
                case 'u' -> i = appendCodePoint(body, i - 1, i + 1, 4, 16, out);
                case 'U' -> i = appendCodePoint(body, i - 1, i + 1, 8, 16, out);
                default -> {
                    if (next >= '0' && next <= '7') {
                        i = appendCodePoint(body, i - 1, i, 3, 8, out);
                    } else {
                        out.append('\\').append(next);
                    }
                }
            }
        }
        return out.toString();
    }

    /**
     * Interpreted string literal for {@code text}.
     */
    public static String quote(String text) {
        StringBuilder out = new StringBuilder(text.length() + 2).append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\t' -> out.append("\\t");
                case '\r' -> out.append("\\r");
                default -> out.append(c);
            }
        }
        return out.append('"').toString();
    }

    // Returns the index of the last consumed char.
    private static int appendCodePoint(String body, int backslash, int from, int digits, int radix,
                                       StringBuilder out) {
        int to = from + digits;
        if (to > body.length()) {
            out.append(body, backslash, body.length());
            return body.length() - 1;
        }
        try {
            out.appendCodePoint(Integer.parseInt(body.substring(from, to), radix));
        } catch (IllegalArgumentException e) {
            out.append(body, backslash, to);
        }
        return to - 1;
    }
}
