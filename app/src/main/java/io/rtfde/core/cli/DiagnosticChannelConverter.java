package io.rtfde.core.cli;

import io.rtfde.core.logging.DiagnosticChannel;
import picocli.CommandLine;

public class DiagnosticChannelConverter implements CommandLine.ITypeConverter<DiagnosticChannel> {

    @Override
    public DiagnosticChannel convert(String value) {
        return DiagnosticChannel.from(value);
    }
}
