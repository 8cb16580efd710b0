package io.rtfde.core.cli;

import picocli.CommandLine;

@CommandLine.Command(name = "escape", mixinStandardHelpOptions = true,
        description = "Replace backslashes and braces with their \\'hh escapes")
public class EscapeCommand {

    @CommandLine.Parameters(index = "0", paramLabel = "TEXT", description = "Text to escape")
    private String text;

    @CommandLine.Option(names = "--symbols", description = "Treat input as RTF and only rewrite the control symbols \\\\, \\{ and \\}")
    private boolean symbols;

    public String text() {
        return text;
    }

    public boolean symbols() {
        return symbols;
    }
}
