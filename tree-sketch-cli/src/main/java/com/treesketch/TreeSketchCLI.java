package com.treesketch;

import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.treesketch.cli.ListCommand;
import com.treesketch.cli.RenderCommand;
import com.treesketch.cli.ValidateCommand;

import ch.qos.logback.classic.Level;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for TreeSketch.
 *
 * <p>TreeSketch turns an indented outline of files and folders into a tree diagram or a
 * structured listing (JSON, YAML, XML, sorted paths, markdown).
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code render} - Render an outline in one of the output formats</li>
 *   <li>{@code list} - List output formats or charsets</li>
 *   <li>{@code validate} - Check that an outline parses</li>
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
 * # Draw an outline
 * treesketch render layout.txt
 *
 * # Same outline as sorted paths, with debug logging
 * treesketch -v render layout.txt -f dot
 * }</pre>
 */
@Command(
    name = "treesketch",
    mixinStandardHelpOptions = true,
    version = "TreeSketch 1.0.0-SNAPSHOT",
    description = "Turns indented outlines into directory tree diagrams",
    subcommands = {
        RenderCommand.class,
        ListCommand.class,
        ValidateCommand.class
    }
)
public class TreeSketchCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TreeSketchCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return; // Suppress banner in quiet mode
        }

        System.out.println("TreeSketch - Directory Tree Diagrams from Indented Outlines");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'treesketch --help' to see available commands");
        System.out.println("Use 'treesketch <command> --help' for command-specific help");
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
            root.setLevel(Level.WARN);
        }
        log.debug("Logging configured (verbose: {}, quiet: {})", verbose, quiet);
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
     * Builds the command line with logging configured from the global options before any
     * subcommand runs. Standard output is UTF-8 regardless of the platform charset, matching
     * what {@code render -o} writes to files.
     *
     * @return configured command line
     */
    static CommandLine createCommandLine() {
        TreeSketchCLI cli = new TreeSketchCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setOut(new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true));
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
