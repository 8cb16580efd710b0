package io.rtfde.core.config;

import io.rtfde.core.cli.CliArguments;
import io.rtfde.core.logging.DiagnosticChannel;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Builds a {@link DiagnosticsConfig} by combining CLI arguments with environment variables and defaults.
 */
public class DiagnosticsConfigLoader {

    static final String ENV_LOG_FORMAT = "RTFDE_LOG_FORMAT";
    static final String ENV_LEVEL_PREFIX = "RTFDE_LOG_LEVEL_";

    private final EnvironmentReader environmentReader;

    public DiagnosticsConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public DiagnosticsConfig load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        LogFormat logFormat = resolveLogFormat(arguments);

        Map<DiagnosticChannel, ChannelLevel> levels = new EnumMap<>(DiagnosticChannel.class);
        for (DiagnosticChannel channel : DiagnosticChannel.values()) {
            String key = levelKey(channel);
            environmentReader.getNonBlank(key)
                    .map(value -> parseLevel(key, value))
                    .ifPresent(level -> levels.put(channel, level));
        }
        for (DiagnosticChannel channel : arguments.debugChannels()) {
            levels.put(channel, ChannelLevel.DEBUG);
        }
        return new DiagnosticsConfig(logFormat, levels);
    }

    static String levelKey(DiagnosticChannel channel) {
        return ENV_LEVEL_PREFIX + channel.name().toUpperCase(Locale.ROOT);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.getNonBlank(ENV_LOG_FORMAT)
                .map(value -> {
                    try {
                        return LogFormat.from(value);
                    } catch (IllegalArgumentException ex) {
                        throw new IllegalArgumentException(ENV_LOG_FORMAT + " has an unsupported value: " + value, ex);
                    }
                })
                .orElse(LogFormat.TEXT);
    }

    private static ChannelLevel parseLevel(String key, String raw) {
        try {
            return ChannelLevel.from(raw);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(key + " has an unsupported value: " + raw, ex);
        }
    }
}
