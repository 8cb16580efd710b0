package io.rtfde.core.encoding;

import java.util.Objects;

/**
 * Canonical encodings used when rewriting content back into escaped RTF.
 */
public final class RtfEncoding {

    static final String ESCAPED_BACKSLASH = "\\'5c";
    static final String ESCAPED_OPEN_BRACE = "\\'7b";
    static final String ESCAPED_CLOSE_BRACE = "\\'7d";

    private static final int HEX_TOKEN_WIDTH = 6;

    private RtfEncoding() {
    }

    /**
     * Hex encodes a control parameter as {@code 0x} plus lower-case digits, zero padded to a total width of six
     * characters. Wider values are not truncated.
     *
     * @param value the numeric control parameter
     * @return the hex token, for example {@code 0x000a} for 10
     */
    public static String encodeControlParameter(long value) {
        String sign = value < 0 ? "-" : "";
        String digits = value == Long.MIN_VALUE
                ? Long.toHexString(value)
                : Long.toHexString(Math.abs(value));
        StringBuilder builder = new StringBuilder(HEX_TOKEN_WIDTH + 2);
        builder.append(sign).append("0x");
        for (int i = sign.length() + 2 + digits.length(); i < HEX_TOKEN_WIDTH; i++) {
            builder.append('0');
        }
        return builder.append(digits).toString();
    }

    /**
     * Parses a decimal control parameter and hex encodes it.
     *
     * @param value decimal digits with an optional sign; surrounding whitespace is ignored
     * @return the hex token
     * @throws InvalidParameterException if {@code value} is null or not an integer
     */
    public static String encodeControlParameter(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidParameterException(value);
        }
        try {
            return encodeControlParameter(Long.parseLong(value.strip()));
        } catch (NumberFormatException ex) {
            throw new InvalidParameterException(value, ex);
        }
    }

    /**
     * Replaces every literal backslash and brace with its {@code \'hh} escape. The text is scanned once, so
     * backslashes introduced by an escape are never escaped again.
     */
    public static String encodeEscapedControlChars(String text) {
        Objects.requireNonNull(text, "text");
        StringBuilder builder = null;
        for (int i = 0; i < text.length(); i++) {
            String replacement = escapeFor(text.charAt(i));
            if (replacement == null) {
                if (builder != null) {
                    builder.append(text.charAt(i));
                }
                continue;
            }
            if (builder == null) {
                builder = new StringBuilder(text.length() + 16);
                builder.append(text, 0, i);
            }
            builder.append(replacement);
        }
        return builder == null ? text : builder.toString();
    }

    /**
     * Rewrites the RTF control symbols {@code \\}, {@code \{} and {@code \}} to their hex escapes. Any other
     * backslash sequence is left as is.
     */
    public static String encodeEscapedControlSymbols(String rtf) {
        Objects.requireNonNull(rtf, "rtf");
        StringBuilder builder = new StringBuilder(rtf.length() + 16);
        int i = 0;
        while (i < rtf.length()) {
            char ch = rtf.charAt(i);
            if (ch == '\\' && i + 1 < rtf.length()) {
                String replacement = escapeFor(rtf.charAt(i + 1));
                if (replacement != null) {
                    builder.append(replacement);
                    i += 2;
                    continue;
                }
            }
            builder.append(ch);
            i++;
        }
        return builder.toString();
    }

    private static String escapeFor(char ch) {
        return switch (ch) {
            case '\\' -> ESCAPED_BACKSLASH;
            case '{' -> ESCAPED_OPEN_BRACE;
            case '}' -> ESCAPED_CLOSE_BRACE;
            default -> null;
        };
    }
}
