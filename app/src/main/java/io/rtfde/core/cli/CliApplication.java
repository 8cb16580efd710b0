package io.rtfde.core.cli;

import io.rtfde.core.config.DiagnosticsConfig;
import io.rtfde.core.config.DiagnosticsConfigLoader;
import io.rtfde.core.config.SystemEnvironmentReader;
import io.rtfde.core.diff.DiffEngine;
import io.rtfde.core.diff.DiffResult;
import io.rtfde.core.encoding.InvalidParameterException;
import io.rtfde.core.encoding.RtfEncoding;
import io.rtfde.core.logging.DiagnosticGate;
import io.rtfde.core.logging.LoggingConfigurator;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, diagnostics configuration and the encoding and diff primitives.
 */
public final class CliApplication {

    static final int EXIT_OK = 0;
    static final int EXIT_DIFFERENT = 1;
    static final int EXIT_ERROR = 2;

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final DiagnosticsConfigLoader configLoader;
    private final DiffEngine diffEngine;
    private final PrintWriter out;
    private final PrintWriter err;

    public CliApplication() {
        this(new DiagnosticsConfigLoader(new SystemEnvironmentReader()), new DiffEngine(),
                new PrintWriter(System.out, true, StandardCharsets.UTF_8),
                new PrintWriter(System.err, true, StandardCharsets.UTF_8));
    }

    CliApplication(DiagnosticsConfigLoader configLoader, DiffEngine diffEngine, PrintWriter out, PrintWriter err) {
        this.configLoader = configLoader;
        this.diffEngine = diffEngine;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(out);
        commandLine.setErr(err);

        CommandLine.ParseResult parseResult;
        try {
            parseResult = commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            err.println(ex.getMessage());
            ex.getCommandLine().usage(err);
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (CommandLine.printHelpIfRequested(parseResult)) {
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (!parseResult.hasSubcommand()) {
            err.println("A subcommand is required");
            commandLine.usage(err);
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        try {
            DiagnosticsConfig config = configLoader.load(cliArguments);
            LoggingConfigurator.configure(config);
            DiagnosticGate gate = new DiagnosticGate(config, diffEngine);
            Object command = parseResult.subcommand().commandSpec().userObject();
            return execute(command, gate);
        } catch (InvalidParameterException | IllegalArgumentException ex) {
            err.println(ex.getMessage());
            return EXIT_ERROR;
        }
    }

    private int execute(Object command, DiagnosticGate gate) {
        if (command instanceof EncodeParameterCommand encode) {
            out.println(RtfEncoding.encodeControlParameter(encode.value()));
            return EXIT_OK;
        }
        if (command instanceof EscapeCommand escape) {
            String escaped = escape.symbols()
                    ? RtfEncoding.encodeEscapedControlSymbols(escape.text())
                    : RtfEncoding.encodeEscapedControlChars(escape.text());
            gate.logTransformation(() -> "Escaped '" + escape.text() + "' as '" + escaped + "'");
            out.println(escaped);
            return EXIT_OK;
        }
        if (command instanceof DiffCommand diff) {
            return runDiff(diff);
        }
        throw new IllegalStateException("Unhandled subcommand: " + command.getClass().getName());
    }

    private int runDiff(DiffCommand command) {
        String original;
        String revised;
        try {
            original = Files.readString(command.original(), StandardCharsets.UTF_8);
            revised = Files.readString(command.revised(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            LOGGER.error("Unable to read diff input: {}", ex.getMessage(), ex);
            err.println("Unable to read diff input: " + ex.getMessage());
            return EXIT_ERROR;
        }
        LOGGER.debug("Diffing {} against {} (separator={})", command.original(), command.revised(), command.separator());
        DiffResult result = diffEngine.stringDiff(original, revised, command.separator());
        if (result.isEmpty()) {
            return EXIT_OK;
        }
        out.println(result.text());
        return EXIT_DIFFERENT;
    }
}
