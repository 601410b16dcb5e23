package com.itiac;

import com.itiac.cli.AnalyzeCommand;
import com.itiac.cli.ImpactCommand;
import com.itiac.cli.ValidateCommand;
import com.itiac.cli.WorkflowsCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for ITIAC.
 *
 * <p>ITIAC reads a snapshot of IT infrastructure components, their dependencies and the
 * business workflows running on them, and reports what an outage takes down.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code analyze} - Score the business impact of components</li>
 *   <li>{@code impact} - Show what the current outage impacts, and why</li>
 *   <li>{@code workflows} - Show affected business workflows step by step</li>
 *   <li>{@code validate} - Check a snapshot for structural problems</li>
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
 * # Score every component that is not online
 * itiac analyze snapshot.json
 *
 * # Score one component as JSON
 * itiac analyze snapshot.json --component db-orders --json
 *
 * # Current outage, restricted to what a dashboard shows
 * itiac impact snapshot.json --visible db-orders,svc-orders
 * }</pre>
 */
@Command(
    name = "itiac",
    mixinStandardHelpOptions = true,
    version = "ITIAC 1.0.0-SNAPSHOT",
    description = "IT Infrastructure Impact Analysis",
    subcommands = {
        AnalyzeCommand.class,
        ImpactCommand.class,
        WorkflowsCommand.class,
        ValidateCommand.class
    }
)
public class ItiacCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ItiacCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return; // Suppress banner in quiet mode
        }

        System.out.println("ITIAC - IT Infrastructure Impact Analysis");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'itiac --help' to see available commands");
        System.out.println("Use 'itiac <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Verbose logging enabled");
    }

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line. Global options are applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        ItiacCLI cli = new ItiacCLI();
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
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
