package io.rtfde.core.cli;

import picocli.CommandLine;

@CommandLine.Command(name = "encode-parameter", mixinStandardHelpOptions = true,
        description = "Print the hex token of a control parameter")
public class EncodeParameterCommand {

    @CommandLine.Parameters(index = "0", paramLabel = "VALUE", description = "Decimal control parameter")
    private String value;

    public String value() {
        return value;
    }
}
