package io.rtfde.core.logging;

import java.util.Locale;

/**
 * Named diagnostic sinks, each backed by its own SLF4J logger and verbosity threshold.
 */
public enum DiagnosticChannel {
    GENERAL("RTFDE"),
    VALIDATION("RTFDE.validation_logger"),
    TRANSFORMATION("RTFDE.transform_logger"),
    HTMLRTF_STRIPPING("RTFDE.HTMLRTF_Stripping_logger");

    private final String loggerName;

    DiagnosticChannel(String loggerName) {
        this.loggerName = loggerName;
    }

    public String loggerName() {
        return loggerName;
    }

    /**
     * Resolves a channel from its enum name (case-insensitive, dashes allowed) or its logger name.
     */
    public static DiagnosticChannel from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Diagnostic channel must be provided");
        }
        String normalized = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (DiagnosticChannel channel : values()) {
            if (channel.name().equals(normalized) || channel.loggerName.equals(raw.trim())) {
                return channel;
            }
        }
        throw new IllegalArgumentException("Unsupported diagnostic channel: " + raw);
    }

    public static DiagnosticChannel forLoggerName(String loggerName) {
        for (DiagnosticChannel channel : values()) {
            if (channel.loggerName.equals(loggerName)) {
                return channel;
            }
        }
        return null;
    }
}
