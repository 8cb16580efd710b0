package io.rtfde.core.tree;

import java.util.Objects;

/**
 * Lexical leaf produced by the RTF parser, carrying its text value and source position.
 */
public record Token(String type, String value, int line, int endLine, int startPos, int endPos) {

    public Token {
        Objects.requireNonNull(type, "type");
    }

    public static Token of(String type, String value) {
        return new Token(type, value, 0, 0, 0, 0);
    }

    /**
     * Stable debug form including positional metadata, used by structural diffs.
     */
    public String debugString() {
        return "Token('" + type + "', " + quote(value) + ", line=" + line + ", end_line=" + endLine
                + ", start_pos=" + startPos + ", end_pos=" + endPos + ")";
    }

    private static String quote(String text) {
        if (text == null) {
            return "null";
        }
        return "'" + text.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }
}
