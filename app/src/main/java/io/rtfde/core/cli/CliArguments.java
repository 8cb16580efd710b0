package io.rtfde.core.cli;

import io.rtfde.core.config.LogFormat;
import io.rtfde.core.logging.DiagnosticChannel;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "rtfde-tools", mixinStandardHelpOptions = true,
        description = "Encoding and diff helpers for RTF de-encapsulation development",
        subcommands = {EncodeParameterCommand.class, EscapeCommand.class, DiffCommand.class})
public class CliArguments {

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = "--debug", description = "Enable debug output for a diagnostic channel (repeatable): general, validation, transformation, htmlrtf-stripping",
            converter = DiagnosticChannelConverter.class, paramLabel = "CHANNEL")
    private List<DiagnosticChannel> debugChannels = new ArrayList<>();

    public LogFormat logFormat() {
        return logFormat;
    }

    public List<DiagnosticChannel> debugChannels() {
        return debugChannels == null ? List.of() : debugChannels;
    }
}
