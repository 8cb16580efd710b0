package io.rtfde.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import io.rtfde.core.cli.CliArguments;
import io.rtfde.core.logging.DiagnosticChannel;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class DiagnosticsConfigLoaderTest {

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--log-format", "json",
                "--debug", "validation",
                "--debug", "htmlrtf-stripping");

        DiagnosticsConfig config = new DiagnosticsConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.levelOf(DiagnosticChannel.VALIDATION)).isEqualTo(ChannelLevel.DEBUG);
        assertThat(config.levelOf(DiagnosticChannel.HTMLRTF_STRIPPING)).isEqualTo(ChannelLevel.DEBUG);
        assertThat(config.levelOf(DiagnosticChannel.GENERAL)).isEqualTo(ChannelLevel.INFO);
        assertThat(config.levelOf(DiagnosticChannel.TRANSFORMATION)).isEqualTo(ChannelLevel.INFO);
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                DiagnosticsConfigLoader.ENV_LOG_FORMAT, "json",
                "RTFDE_LOG_LEVEL_TRANSFORMATION", " trace ",
                "RTFDE_LOG_LEVEL_GENERAL", "off"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());

        DiagnosticsConfig config = new DiagnosticsConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.levelOf(DiagnosticChannel.TRANSFORMATION)).isEqualTo(ChannelLevel.TRACE);
        assertThat(config.levelOf(DiagnosticChannel.GENERAL)).isEqualTo(ChannelLevel.OFF);
        assertThat(environmentReader.requestedKeys()).contains(
                "RTFDE_LOG_LEVEL_VALIDATION", "RTFDE_LOG_LEVEL_HTMLRTF_STRIPPING");
    }

    @Test
    void cliArgumentsOverrideEnvironment() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                DiagnosticsConfigLoader.ENV_LOG_FORMAT, "json",
                "RTFDE_LOG_LEVEL_VALIDATION", "error"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--log-format", "text", "--debug", "validation");

        DiagnosticsConfig config = new DiagnosticsConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
        assertThat(config.levelOf(DiagnosticChannel.VALIDATION)).isEqualTo(ChannelLevel.DEBUG);
    }

    @Test
    void defaultsToTextAndInfo() {
        DiagnosticsConfig config = new DiagnosticsConfigLoader(key -> Optional.empty())
                .load(CommandLine.populateCommand(new CliArguments()));

        assertThat(config).isEqualTo(DiagnosticsConfig.defaults());
    }

    @Test
    void invalidEnvironmentLevelNamesTheVariable() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                "RTFDE_LOG_LEVEL_VALIDATION", "verbose"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());

        Throwable thrown = catchThrowable(() -> new DiagnosticsConfigLoader(environmentReader).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("RTFDE_LOG_LEVEL_VALIDATION")
                .hasMessageContaining("verbose");
    }

    @Test
    void invalidEnvironmentLogFormatNamesTheVariable() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                DiagnosticsConfigLoader.ENV_LOG_FORMAT, "xml"));

        Throwable thrown = catchThrowable(() -> new DiagnosticsConfigLoader(environmentReader)
                .load(CommandLine.populateCommand(new CliArguments())));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("RTFDE_LOG_FORMAT");
    }

    private static final class RecordingEnvironmentReader implements EnvironmentReader {

        private final Map<String, String> values;
        private final List<String> requestedKeys = new ArrayList<>();

        private RecordingEnvironmentReader(Map<String, String> values) {
            this.values = values;
        }

        @Override
        public Optional<String> get(String key) {
            requestedKeys.add(key);
            return Optional.ofNullable(values.get(key));
        }

        List<String> requestedKeys() {
            return requestedKeys;
        }
    }
}
