package com.diagramforge;

import ch.qos.logback.classic.Level;
import com.diagramforge.cli.AnalyzeCommand;
import com.diagramforge.cli.CanonicalizeCommand;
import com.diagramforge.cli.DiffCommand;
import com.diagramforge.cli.EditCommand;
import com.diagramforge.cli.GenerateCommand;
import com.diagramforge.cli.ListCommand;
import com.diagramforge.cli.ParseCommand;
import com.diagramforge.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for DiagramForge.
 *
 * <p>DiagramForge generates, validates, repairs and edits draw.io (mxGraph) diagram XML.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code generate} - Convert a components JSON file into diagram XML</li>
 *   <li>{@code parse} - Decode diagram XML into components JSON</li>
 *   <li>{@code analyze} - Summarize a diagram and list structural warnings</li>
 *   <li>{@code edit} - Apply a batch of edit operations</li>
 *   <li>{@code validate} - Check structure, optionally auto-fixing</li>
 *   <li>{@code canonicalize} - Turn a partial fragment into a complete document</li>
 *   <li>{@code diff} - Compare two diagram revisions</li>
 *   <li>{@code list} - List component kinds, cloud services or repair rules</li>
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
 * diagramforge generate components.json -o diagram.drawio
 * diagramforge -v validate diagram.drawio --fix -o fixed.drawio
 * diagramforge list kinds
 * }</pre>
 */
@Command(
    name = "diagramforge",
    mixinStandardHelpOptions = true,
    version = "DiagramForge 1.0.0-SNAPSHOT",
    description = "Generate, validate, repair and edit draw.io diagram XML",
    subcommands = {
        GenerateCommand.class,
        ParseCommand.class,
        AnalyzeCommand.class,
        EditCommand.class,
        ValidateCommand.class,
        CanonicalizeCommand.class,
        DiffCommand.class,
        ListCommand.class
    }
)
public class DiagramForgeCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(DiagramForgeCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        System.out.println("DiagramForge - draw.io diagram XML engine");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'diagramforge --help' to see available commands");
        System.out.println("Use 'diagramforge <command> --help' for command-specific help");
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
     * Creates the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        DiagramForgeCLI cli = new DiagramForgeCLI();
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
