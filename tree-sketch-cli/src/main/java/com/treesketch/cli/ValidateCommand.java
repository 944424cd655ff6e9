package com.treesketch.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.treesketch.core.TreeSketch;
import com.treesketch.core.model.TreeNode;
import com.treesketch.core.parser.TreeParseException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Command to check that an outline parses, printing a short summary of the tree.
 */
@Command(
    name = "validate",
    description = "Check that an indented outline parses and summarize it",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", description = "Outline file; '-' or absent reads standard input")
    private Path input;

    private final TreeSketch treeSketch = new TreeSketch();
    private final InputStream stdin;

    public ValidateCommand() {
        this(System.in);
    }

    ValidateCommand(InputStream stdin) {
        this.stdin = stdin;
    }

    @Override
    public Integer call() {
        String source = OutlineInput.describe(input);
        log.info("Validating outline: {}", source);

        String text;
        try {
            text = OutlineInput.read(input, stdin);
        } catch (IOException e) {
            log.error("Failed to read {}: {}", source, e.getMessage());
            spec.commandLine().getErr().println("Error: cannot read " + source);
            return RenderCommand.EXIT_IO_ERROR;
        }

        TreeNode root;
        try {
            root = treeSketch.parse(text);
        } catch (TreeParseException e) {
            spec.commandLine().getErr().println("Invalid outline " + source + ": " + e.getMessage());
            return RenderCommand.EXIT_INVALID_INPUT;
        }

        int directories = 0;
        int files = 0;
        int maxDepth = 0;
        Deque<TreeNode> stack = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        stack.push(root);
        depths.push(0);
        while (!stack.isEmpty()) {
            TreeNode node = stack.pop();
            int depth = depths.pop();
            if (!node.isRoot()) {
                if (node.isDirectory()) {
                    directories++;
                } else {
                    files++;
                }
                maxDepth = Math.max(maxDepth, depth);
            }
            for (TreeNode child : node.children()) {
                stack.push(child);
                depths.push(depth + 1);
            }
        }

        PrintWriter out = spec.commandLine().getOut();
        out.printf("Valid outline: %d entries (%d directories, %d files), max depth %d%n",
            directories + files, directories, files, maxDepth);
        out.flush();
        return 0;
    }
}
