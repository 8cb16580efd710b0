package io.rtfde.core.logging;

/**
 * Raised when a diagnostic channel receives a payload of the wrong shape. Signals a bug at the call site.
 */
public class MalformedDiagnosticPayloadException extends RuntimeException {

    public MalformedDiagnosticPayloadException(String message) {
        super(message);
    }
}
