package com.seqdraft;

import com.seqdraft.cli.FormatCommand;
import com.seqdraft.cli.InspectCommand;
import com.seqdraft.cli.ListCommand;
import com.seqdraft.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for seqdraft.
 *
 * <p>seqdraft reads sequence diagram text, checks it and writes it back in canonical form.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code format} - Parse a diagram and write canonical text or Markdown</li>
 *   <li>{@code validate} - Report skipped lines and structural errors</li>
 *   <li>{@code inspect} - Show participant order, activations and statistics</li>
 *   <li>{@code list} - List available generators</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Rewrite a diagram in canonical form
 * seqdraft format checkout.mmd -o checkout.mmd
 *
 * # Fail on any skipped line
 * seqdraft validate checkout.mmd --strict
 *
 * # Debug parsing
 * seqdraft -v inspect checkout.mmd
 * }</pre>
 */
@Command(
    name = "seqdraft",
    mixinStandardHelpOptions = true,
    version = "seqdraft 1.0.0-SNAPSHOT",
    description = "Sequence diagram parser, validator and formatter",
    subcommands = {
        FormatCommand.class,
        ValidateCommand.class,
        InspectCommand.class,
        ListCommand.class
    }
)
public class SeqDraftCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SeqDraftCLI.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return; // Suppress banner in quiet mode
        }

        spec.commandLine().getOut().println("seqdraft - sequence diagram formatter");
        spec.commandLine().getOut().println("Version: 1.0.0-SNAPSHOT");
        spec.commandLine().getOut().println();
        spec.commandLine().getOut().println("Use 'seqdraft --help' to see available commands");
        spec.commandLine().getOut().println("Use 'seqdraft <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    private void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line. Global options are applied before the selected subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine newCommandLine() {
        SeqDraftCLI cli = new SeqDraftCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }
}
