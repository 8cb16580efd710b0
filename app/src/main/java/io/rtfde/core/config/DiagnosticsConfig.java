package io.rtfde.core.config;

import io.rtfde.core.logging.DiagnosticChannel;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable diagnostic settings: output format and the verbosity threshold of every channel. Channels
 * without an explicit level use {@link #DEFAULT_LEVEL}.
 */
public record DiagnosticsConfig(LogFormat logFormat, Map<DiagnosticChannel, ChannelLevel> channelLevels) {

    public static final ChannelLevel DEFAULT_LEVEL = ChannelLevel.INFO;

    public DiagnosticsConfig {
        Objects.requireNonNull(logFormat, "logFormat");
        EnumMap<DiagnosticChannel, ChannelLevel> levels = new EnumMap<>(DiagnosticChannel.class);
        for (DiagnosticChannel channel : DiagnosticChannel.values()) {
            levels.put(channel, DEFAULT_LEVEL);
        }
        if (channelLevels != null) {
            channelLevels.forEach((channel, level) ->
                    levels.put(Objects.requireNonNull(channel, "channel"), Objects.requireNonNull(level, "level")));
        }
        channelLevels = Collections.unmodifiableMap(levels);
    }

    public static DiagnosticsConfig defaults() {
        return new DiagnosticsConfig(LogFormat.TEXT, Map.of());
    }

    public ChannelLevel levelOf(DiagnosticChannel channel) {
        return channelLevels.get(Objects.requireNonNull(channel, "channel"));
    }

    public DiagnosticsConfig withChannelLevel(DiagnosticChannel channel, ChannelLevel level) {
        EnumMap<DiagnosticChannel, ChannelLevel> levels = new EnumMap<>(channelLevels);
        levels.put(channel, level);
        return new DiagnosticsConfig(logFormat, levels);
    }
}
