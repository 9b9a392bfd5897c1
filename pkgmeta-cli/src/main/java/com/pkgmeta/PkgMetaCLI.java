package com.pkgmeta;

import ch.qos.logback.classic.Level;
import com.pkgmeta.cli.ListCommand;
import com.pkgmeta.cli.ScanCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for pkgmeta.
 *
 * <p>pkgmeta reads Python packaging descriptors (PKG-INFO, METADATA,
 * setup.py, setup.cfg, pyproject.toml, requirements files, Pipfile and
 * Pipfile.lock) and prints normalized package records as JSON.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code scan} - Extract package records from a directory tree</li>
 *   <li>{@code list} - List available descriptor handlers</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * pkgmeta scan path/to/project -o records.json
 * pkgmeta -v scan
 * pkgmeta list handlers
 * }</pre>
 */
@Command(
    name = "pkgmeta",
    mixinStandardHelpOptions = true,
    version = "pkgmeta 1.0.0-SNAPSHOT",
    description = "Python package metadata extraction and normalization",
    subcommands = {
        ScanCommand.class,
        ListCommand.class
    }
)
public class PkgMetaCLI implements Runnable {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        System.out.println("pkgmeta - Python package metadata normalization");
        System.out.println("Use 'pkgmeta --help' to see available commands");
    }

    /**
     * Applies the global log level before any subcommand runs.
     *
     * @param parseResult parsed command line
     * @return exit code
     */
    private int executionStrategy(CommandLine.ParseResult parseResult) {
        configureLogging();
        return new CommandLine.RunLast().execute(parseResult);
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
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with the logging-aware execution strategy.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        PkgMetaCLI cli = new PkgMetaCLI();
        return new CommandLine(cli).setExecutionStrategy(cli::executionStrategy);
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
