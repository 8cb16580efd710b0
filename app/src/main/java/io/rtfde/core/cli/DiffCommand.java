package io.rtfde.core.cli;

import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "diff", mixinStandardHelpOptions = true,
        description = "Print a context diff of two files. Exits with 1 when they differ")
public class DiffCommand {

    @CommandLine.Parameters(index = "0", paramLabel = "ORIGINAL", description = "File before transformation")
    private Path original;

    @CommandLine.Parameters(index = "1", paramLabel = "REVISED", description = "File after transformation")
    private Path revised;

    @CommandLine.Option(names = "--separator", paramLabel = "REGEX",
            description = "Split by this pattern instead of by line; line breaks and empty units are ignored")
    private String separator;

    public Path original() {
        return original;
    }

    public Path revised() {
        return revised;
    }

    public String separator() {
        return separator;
    }
}
