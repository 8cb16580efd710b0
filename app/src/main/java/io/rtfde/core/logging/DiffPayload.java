package io.rtfde.core.logging;

import io.rtfde.core.diff.DiffResult;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Lazily computed diff. The diff itself is only calculated when the channel is enabled.
 */
public record DiffPayload(Supplier<DiffResult> diff) implements DiagnosticPayload {

    public DiffPayload {
        Objects.requireNonNull(diff, "diff");
    }

    @Override
    public String render() {
        return diff.get().text();
    }
}
