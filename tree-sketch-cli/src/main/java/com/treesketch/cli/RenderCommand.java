package com.treesketch.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.treesketch.config.ConfigLoader;
import com.treesketch.config.ProjectConfig;
import com.treesketch.core.TreeSketch;
import com.treesketch.core.generator.EmptyDirectoryRule;
import com.treesketch.core.generator.FormatOptions;
import com.treesketch.core.generator.LineCharset;
import com.treesketch.core.model.TreeNode;
import com.treesketch.core.parser.TreeParseException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Command that parses an outline and prints it in the requested format.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Draw layout.txt with box-drawing glyphs
 * treesketch render layout.txt
 *
 * # Pipe an outline in, get YAML out
 * cat layout.txt | treesketch render -f yaml
 *
 * # ASCII glyphs, directories marked, no root line, written to a file
 * treesketch render layout.txt -f ascii --trailing-slash --no-root-dot -o tree.txt
 * }</pre>
 *
 * <p>Command-line options win over {@code treesketch.yaml}, which wins over built-in
 * defaults.
 */
@Command(
    name = "render",
    description = "Render an indented outline as a tree diagram or structured listing",
    mixinStandardHelpOptions = true
)
public class RenderCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RenderCommand.class);

    static final int EXIT_INVALID_INPUT = 1;
    static final int EXIT_IO_ERROR = 2;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", description = "Outline file; '-' or absent reads standard input")
    private Path input;

    @Option(names = {"-f", "--format"},
        description = "Output format: ascii, utf8, json-nested, json-array, json-flat, yaml, xml, dot, markdown")
    private String format;

    @Option(names = {"-c", "--charset"}, description = "Glyph set for tree formats: ascii or utf8")
    private String charset;

    @Option(names = "--trailing-slash", description = "Append '/' to directory names")
    private Boolean trailingDirSlash;

    @Option(names = "--full-path", description = "Print every entry with its full path")
    private Boolean fullPath;

    @Option(names = "--no-root-dot", description = "Do not print the root '.' line")
    private Boolean noRootDot;

    @Option(names = "--empty-dirs",
        description = "How childless directories are recognized in nested JSON and YAML: trailing-slash or name-contains-dir")
    private String emptyDirectories;

    @Option(names = "--config", description = "Configuration file (default: ${DEFAULT-VALUE})")
    private Path configFile = Paths.get("treesketch.yaml");

    @Option(names = {"-o", "--output"}, description = "Write output to this file instead of standard output")
    private Path output;

    private final TreeSketch treeSketch = new TreeSketch();
    private final InputStream stdin;

    public RenderCommand() {
        this(System.in);
    }

    RenderCommand(InputStream stdin) {
        this.stdin = stdin;
    }

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        ProjectConfig config = ConfigLoader.load(configFile);

        String effectiveFormat = format != null ? format : config.effectiveFormat();
        FormatOptions options;
        try {
            options = resolveOptions(config);
        } catch (IllegalArgumentException e) {
            log.error("Invalid option: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return EXIT_INVALID_INPUT;
        }

        String text;
        try {
            text = OutlineInput.read(input, stdin);
        } catch (IOException e) {
            log.error("Failed to read {}: {}", OutlineInput.describe(input), e.getMessage());
            err.println("Error: cannot read " + OutlineInput.describe(input));
            return EXIT_IO_ERROR;
        }

        String rendered;
        try {
            TreeNode root = treeSketch.parse(text);
            rendered = treeSketch.render(root, effectiveFormat, options);
        } catch (TreeParseException e) {
            log.error("Failed to parse {}: {}", OutlineInput.describe(input), e.getMessage());
            err.println("Error: " + e.getMessage());
            return EXIT_INVALID_INPUT;
        }

        Path target = output != null ? output : configuredOutput(config);
        if (target == null) {
            PrintWriter out = spec.commandLine().getOut();
            out.print(rendered);
            if (!rendered.endsWith("\n")) {
                out.println();
            }
            out.flush();
            return 0;
        }

        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, rendered, StandardCharsets.UTF_8);
            log.info("Wrote {} output to {}", effectiveFormat, target);
            return 0;
        } catch (IOException e) {
            log.error("Failed to write {}: {}", target, e.getMessage());
            err.println("Error: cannot write " + target);
            return EXIT_IO_ERROR;
        }
    }

    private FormatOptions resolveOptions(ProjectConfig config) {
        FormatOptions options = config.toFormatOptions();
        if (charset != null) {
            options = options.withCharset(LineCharset.fromId(charset));
        }
        if (trailingDirSlash != null) {
            options = options.withTrailingDirSlash(trailingDirSlash);
        }
        if (fullPath != null) {
            options = options.withFullPath(fullPath);
        }
        if (noRootDot != null) {
            options = options.withRootDot(!noRootDot);
        }
        if (emptyDirectories != null) {
            options = options.withEmptyDirectoryRule(EmptyDirectoryRule.fromId(emptyDirectories));
        }
        return options;
    }

    private static Path configuredOutput(ProjectConfig config) {
        if (config.output() == null || config.output().file() == null || config.output().file().isBlank()) {
            return null;
        }
        return Paths.get(config.output().file());
    }
}
