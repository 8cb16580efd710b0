package io.rtfde.core.logging;

/**
 * Content handed to the {@link DiagnosticGate}. Rendering is deferred until the target channel is known to be
 * enabled.
 */
@FunctionalInterface
public interface DiagnosticPayload {

    String render();
}
