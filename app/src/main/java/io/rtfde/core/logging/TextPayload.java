package io.rtfde.core.logging;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Free-form text, produced by the supplier only when the channel is enabled.
 */
public record TextPayload(Supplier<?> text) implements DiagnosticPayload {

    public TextPayload {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public String render() {
        return String.valueOf(text.get());
    }
}
