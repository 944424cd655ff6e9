package com.treesketch.core;

import com.treesketch.core.generator.FormatOptions;
import com.treesketch.core.generator.TreeFormatDispatcher;
import com.treesketch.core.model.TreeNode;
import com.treesketch.core.parser.IndentationParser;
import com.treesketch.core.parser.TreeParseException;

/**
 * Entry point for front ends: parse an outline, then render the tree as often as needed.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * TreeSketch sketch = new TreeSketch();
 * TreeNode root = sketch.parse("app\n  src\n    index.js\n  package.json");
 *
 * String diagram = sketch.render(root, "utf8", FormatOptions.defaults());
 * String paths = sketch.render(root, "dot", FormatOptions.defaults());
 * }</pre>
 *
 * <p>Instances hold no per-call state and can be shared.
 */
public class TreeSketch {

    private final IndentationParser parser;
    private final TreeFormatDispatcher dispatcher;

    public TreeSketch() {
        this(new IndentationParser(), new TreeFormatDispatcher());
    }

    public TreeSketch(IndentationParser parser, TreeFormatDispatcher dispatcher) {
        this.parser = parser;
        this.dispatcher = dispatcher;
    }

    /**
     * Parses an indented outline.
     *
     * @param input outline text
     * @return root of the sealed tree
     * @throws TreeParseException if the input is empty or its indentation is ambiguous
     */
    public TreeNode parse(String input) {
        return parser.parse(input);
    }

    /**
     * Renders a parsed tree.
     *
     * @param root root returned by {@link #parse(String)}
     * @param formatId one of the {@link com.treesketch.core.generator.TreeFormat} identifiers
     * @param options rendering options, or null for defaults
     * @return rendered text
     * @throws NullPointerException if {@code root} is null
     */
    public String render(TreeNode root, String formatId, FormatOptions options) {
        return dispatcher.format(root, formatId, options);
    }

    /**
     * Parses and renders in one step.
     *
     * @param input outline text
     * @param formatId format identifier
     * @param options rendering options, or null for defaults
     * @return rendered text
     * @throws TreeParseException if the input cannot be parsed
     */
    public String parseAndRender(String input, String formatId, FormatOptions options) {
        return render(parse(input), formatId, options);
    }
}
