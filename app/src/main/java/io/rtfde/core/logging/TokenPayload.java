package io.rtfde.core.logging;

import io.rtfde.core.tree.Token;
import java.util.Objects;

/**
 * Token removed during HTMLRTF stripping. Rendered as {@code value, line, end_line, start_pos, end_pos}.
 */
public record TokenPayload(Token token) implements DiagnosticPayload {

    static final String PREFIX = "HTMLRTF Removed: ";

    public TokenPayload {
        Objects.requireNonNull(token, "token");
    }

    /**
     * @throws MalformedDiagnosticPayloadException if {@code candidate} is not a {@link Token}
     */
    public static TokenPayload from(Object candidate) {
        if (candidate instanceof Token token) {
            return new TokenPayload(token);
        }
        String actual = candidate == null ? "null" : candidate.getClass().getName();
        throw new MalformedDiagnosticPayloadException("HTMLRTF stripping channel only logs tokens, got " + actual);
    }

    @Override
    public String render() {
        return PREFIX + token.value() + ", " + token.line() + ", " + token.endLine()
                + ", " + token.startPos() + ", " + token.endPos();
    }
}
