package com.plotbinding;

import com.plotbinding.cli.BundleCommand;
import com.plotbinding.cli.ListCommand;
import com.plotbinding.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for PlotBinding resources.
 *
 * <p>Resolves the BokehJS scripts and stylesheets a document needs and checks the
 * packaged BokehJS build.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code bundle} - Resolve the asset bundle for a set of models</li>
 *   <li>{@code list} - List deployment modes, components or renderers</li>
 *   <li>{@code validate} - Check the bundled asset layout</li>
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
 * # HTML tags for a document with widgets, served from the CDN
 * plotbinding bundle --widgets
 *
 * # Embedded development assets as JSON
 * plotbinding bundle --mode inline-dev --format json
 *
 * # List deployment modes
 * plotbinding list modes
 * }</pre>
 */
@Command(
    name = "plotbinding",
    mixinStandardHelpOptions = true,
    version = "PlotBinding 0.1.0-SNAPSHOT",
    description = "Resolves BokehJS script and stylesheet bundles",
    subcommands = {
        BundleCommand.class,
        ListCommand.class,
        ValidateCommand.class
    }
)
public class PlotBindingCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(PlotBindingCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        configureLogging();

        if (quiet) {
            return;
        }

        System.out.println("PlotBinding - BokehJS resource bundler");
        System.out.println("Version: 0.1.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'plotbinding --help' to see available commands");
        System.out.println("Use 'plotbinding <command> --help' for command-specific help");
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
        log.debug("Root log level set to {}", root.getLevel());
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
    public static CommandLine createCommandLine() {
        PlotBindingCLI cli = new PlotBindingCLI();
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
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
