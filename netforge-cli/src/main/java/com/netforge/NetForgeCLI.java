package com.netforge;

import com.netforge.cli.ExportCommand;
import com.netforge.cli.ListCommand;
import com.netforge.cli.NetsCommand;
import com.netforge.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for NetForge.
 *
 * <p>NetForge reads schematic snapshots saved by the editor, extracts their
 * netlist, flattens hierarchical chips and writes the result as SPICE or one of
 * the plain-text formats.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code export} - Build and write the netlist of a schematic</li>
 *   <li>{@code nets} - Print the nets of a schematic</li>
 *   <li>{@code validate} - Check a schematic's netlist for inconsistencies</li>
 *   <li>{@code list} - List available formatters, renderers or component kinds</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Print the SPICE netlist of a schematic
 * netforge export amplifier.json --stdout
 *
 * # Write a plain netlist into ./out
 * netforge export amplifier.json -f simple -o out
 *
 * # Debug logging
 * netforge -v export amplifier.json
 * }</pre>
 */
@Command(
    name = "netforge",
    mixinStandardHelpOptions = true,
    version = "NetForge 1.0.0-SNAPSHOT",
    description = "Netlist extraction and export for schematic snapshots",
    subcommands = {
        ExportCommand.class,
        NetsCommand.class,
        ValidateCommand.class,
        ListCommand.class
    }
)
public class NetForgeCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(NetForgeCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("NetForge - Netlist Extraction and Export");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'netforge --help' to see available commands");
        System.out.println("Use 'netforge <command> --help' for command-specific help");
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
        log.debug("Logging level set to {}", root.getLevel());
    }

    /**
     * Creates the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        NetForgeCLI cli = new NetForgeCLI();
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
