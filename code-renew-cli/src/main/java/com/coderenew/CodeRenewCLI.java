package com.coderenew;

import ch.qos.logback.classic.Level;
import com.coderenew.cli.EstimateCommand;
import com.coderenew.cli.ListCommand;
import com.coderenew.cli.ScanCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for CodeRenew.
 *
 * <p>CodeRenew checks a WordPress plugin or theme for compatibility problems when
 * upgrading between two WordPress versions.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code scan} - Scan a directory or zip archive</li>
 *   <li>{@code estimate} - Project tokens and cost of a scan</li>
 *   <li>{@code list} - List catalogued deprecations for a version range</li>
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
 * # Scan a plugin directory
 * coderenew scan ./my-plugin --from 5.9 --to 6.4
 *
 * # Scan an archive without calling any remote service
 * coderenew scan my-theme.zip --from 5.9 --to 6.4 --offline
 *
 * # Estimate cost first
 * coderenew estimate ./my-plugin --from 5.9 --to 6.4
 * }</pre>
 *
 * <p>Exit codes: 0 on success, 1 on a failed scan or command error, 2 on invalid arguments.
 */
@Command(
    name = "coderenew",
    mixinStandardHelpOptions = true,
    version = "CodeRenew 1.0.0-SNAPSHOT",
    description = "WordPress compatibility scanner combining static analysis with AI-assisted review",
    subcommands = {
        ScanCommand.class,
        EstimateCommand.class,
        ListCommand.class
    }
)
public class CodeRenewCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(CodeRenewCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("CodeRenew - WordPress Compatibility Scanner");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'coderenew --help' to see available commands");
        System.out.println("Use 'coderenew <command> --help' for command-specific help");
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
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        CodeRenewCLI cli = new CodeRenewCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
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
