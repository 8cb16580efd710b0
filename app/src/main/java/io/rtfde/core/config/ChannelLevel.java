package io.rtfde.core.config;

/**
 * Verbosity threshold of a diagnostic channel, ordered from most to least verbose.
 */
public enum ChannelLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    OFF;

    public static ChannelLevel from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Channel level must be provided");
        }
        for (ChannelLevel level : values()) {
            if (level.name().equalsIgnoreCase(raw.trim())) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unsupported channel level: " + raw);
    }

    public boolean permitsDebug() {
        return compareTo(DEBUG) <= 0;
    }
}
