package io.rtfde.core.tree;

import java.util.Objects;

/**
 * Classifies tokens that are RTF control words followed by a numeric argument, such as {@code \fs24}.
 */
public final class CodewordMatcher {

    private CodewordMatcher() {
    }

    /**
     * Checks whether {@code candidate} is a token whose trimmed value is {@code codeword} followed by one or more
     * decimal digits. Anything that is not a token with a value is reported as no match.
     *
     * @param candidate token, or any other child of a parse tree
     * @param codeword control word to look for, including its leading backslash if the token carries one
     * @return true if the token is the codeword with a numeric argument
     */
    public static boolean isCodewordWithNumericArg(Object candidate, String codeword) {
        Objects.requireNonNull(codeword, "codeword");
        if (!(candidate instanceof Token token) || token.value() == null) {
            return false;
        }
        String value = token.value().strip();
        if (!value.startsWith(codeword)) {
            return false;
        }
        return isAllDigits(value.substring(codeword.length()));
    }

    private static boolean isAllDigits(String suffix) {
        if (suffix.isEmpty()) {
            return false;
        }
        for (int i = 0; i < suffix.length(); i++) {
            if (!Character.isDigit(suffix.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
