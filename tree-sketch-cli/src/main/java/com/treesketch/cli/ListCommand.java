package com.treesketch.cli;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.treesketch.core.generator.LineCharset;
import com.treesketch.core.generator.TreeFormat;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Command to list the supported output formats or line-drawing charsets.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # List all formats
 * treesketch list
 *
 * # List glyph sets
 * treesketch list charsets
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available output formats or charsets",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        arity = "0..1",
        defaultValue = "formats",
        description = "What to list: formats or charsets (default: ${DEFAULT-VALUE})"
    )
    private String type;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        int exitCode = switch (type.toLowerCase()) {
            case "formats", "format" -> listFormats(out);
            case "charsets", "charset" -> listCharsets(out);
            default -> {
                log.error("Unknown type: {}. Use: formats or charsets", type);
                spec.commandLine().getErr().println("Unknown type: " + type + ". Use: formats or charsets");
                yield 1;
            }
        };
        out.flush();
        return exitCode;
    }

    private int listFormats(PrintWriter out) {
        out.println("Available Formats:");
        out.println();

        for (TreeFormat format : TreeFormat.values()) {
            out.printf("  • %s (ID: %s)%n", format.displayName(), format.id());
            out.printf("    File Extension: .%s%n", format.fileExtension());
        }
        return 0;
    }

    private int listCharsets(PrintWriter out) {
        out.println("Available Charsets:");
        out.println();

        for (LineCharset charset : LineCharset.values()) {
            out.printf("  • %s: %s%s%n", charset.id(), charset.child().strip(), charset.lastChild().strip());
        }
        return 0;
    }
}
