package com.codemeter;

import ch.qos.logback.classic.Level;
import com.codemeter.cli.LanguagesCommand;
import com.codemeter.cli.ListCommand;
import com.codemeter.cli.ScanCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;

/**
 * Main CLI entry point for CodeMeter.
 *
 * <p>CodeMeter counts blank, comment and code lines per language across a directory tree.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code scan} - Count lines under a directory</li>
 *   <li>{@code languages} - List known languages and their extensions</li>
 *   <li>{@code list} - List available report renderers</li>
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
 * # Count the current directory
 * codemeter scan
 *
 * # Count with 8 workers and print JSON
 * codemeter scan src -j 8 -f json
 *
 * # Which languages are counted as Python?
 * codemeter languages python
 * }</pre>
 */
@Command(
    name = "codemeter",
    mixinStandardHelpOptions = true,
    version = "CodeMeter 1.0.0-SNAPSHOT",
    description = "Counts blank, comment and code lines per language",
    subcommands = {
        ScanCommand.class,
        LanguagesCommand.class,
        ListCommand.class
    }
)
public class CodeMeterCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(CodeMeterCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("CodeMeter - Source Line Counter");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'codemeter --help' to see available commands");
        System.out.println("Use 'codemeter <command> --help' for command-specific help");
    }

    /**
     * Applies the global options, then runs the most specific command given.
     *
     * @param parseResult parsed command line
     * @return exit code
     */
    private int executionStrategy(ParseResult parseResult) {
        configureLogging();
        return new CommandLine.RunLast().execute(parseResult);
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
        log.debug("Log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the configured command line, ready to {@code execute}.
     *
     * @return command line for a fresh CLI instance
     */
    public static CommandLine commandLine() {
        CodeMeterCLI cli = new CodeMeterCLI();
        return new CommandLine(cli)
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setExecutionStrategy(cli::executionStrategy);
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
