package com.treesketch.core.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.treesketch.core.model.TreeBuilder;
import com.treesketch.core.model.TreeNode;

/**
 * Turns an indented plain-text outline into a {@link TreeNode} tree.
 *
 * <p>Each non-blank line becomes one node. Leading whitespace decides nesting and an
 * optional markdown bullet ({@code "- "}) directly after it is dropped, so both of these
 * inputs produce the same tree:
 * <pre>
 * app                 - app
 *   src                 - src
 *     index.js            - index.js
 * </pre>
 *
 * <h2>Indentation Rules</h2>
 * <ul>
 *   <li>Every whitespace character counts as one column, tabs and a leading byte order
 *       mark included</li>
 *   <li>An item may be at most 2 columns deeper than the item it nests under;
 *       top-level items may start at any column</li>
 *   <li>Dedenting closes every open item indented at or beyond the new line</li>
 * </ul>
 *
 * <p>Ancestor resolution uses an explicit stack, so arbitrarily deep outlines are parsed
 * without recursion. The parser is stateless and thread-safe.
 */
public class IndentationParser {

    private static final Logger log = LoggerFactory.getLogger(IndentationParser.class);

    /** Whitespace set of ECMAScript {@code \s}: includes the byte order mark, excludes NEL. */
    private static final String WHITESPACE =
        "[\\t\\n\\u000B\\f\\r \\u00A0\\u1680\\u2000-\\u200A\\u2028\\u2029\\u202F\\u205F\\u3000\\uFEFF]";

    /** Leading whitespace (group 2) plus an optional "- " bullet (group 1 covers both). */
    private static final Pattern LEADING_WHITESPACE_AND_BULLET =
        Pattern.compile("^((" + WHITESPACE + "*)(?:-" + WHITESPACE + ")?)");

    private static final Pattern ONLY_WHITESPACE =
        Pattern.compile("^" + WHITESPACE + "*$");

    private static final Pattern LINE_BREAKS = Pattern.compile("[\\r\\n]+");

    /** Largest allowed indentation step between an item and the item it nests under. */
    private static final int MAX_INDENT_STEP = 2;

    /**
     * One surviving input line before nesting is resolved.
     *
     * @param name line text after indentation and bullet
     * @param indentLevel number of leading whitespace characters
     */
    record Line(String name, int indentLevel) {}

    /**
     * Parses an outline into a sealed tree rooted at the synthetic {@code "."} node.
     *
     * <p>Input made only of blank lines yields a root without children.
     *
     * @param input outline text
     * @return root of the parsed tree
     * @throws TreeParseException with reason {@code INVALID_INPUT} if input is null or empty,
     *         or {@code STRUCTURAL_AMBIGUITY} if an item's indentation has no unique parent
     */
    public TreeNode parse(String input) {
        if (input == null || input.isEmpty()) {
            throw TreeParseException.invalidInput();
        }

        List<Line> lines = splitInput(input);

        TreeBuilder builder = new TreeBuilder();
        Deque<TreeNode> path = new ArrayDeque<>();
        path.push(builder.root());

        for (Line line : lines) {
            int lastIndent = path.peek().indentLevel();
            if (line.indentLevel() > lastIndent + MAX_INDENT_STEP && lastIndent != TreeNode.ROOT_INDENT_LEVEL) {
                throw TreeParseException.badIndentation(line.name());
            }

            while (!path.isEmpty() && path.peek().indentLevel() >= line.indentLevel()) {
                path.pop();
            }
            if (path.isEmpty()) {
                throw TreeParseException.badIndentation(line.name());
            }

            path.push(builder.add(path.peek(), line.name(), line.indentLevel()));
        }

        TreeNode root = builder.build();
        log.debug("Parsed {} lines into a tree of {} nodes", lines.size(), root.nodeCount());
        return root;
    }

    /**
     * Splits input into non-blank lines and measures their indentation.
     *
     * @param input outline text
     * @return lines in document order, without nesting
     */
    List<Line> splitInput(String input) {
        List<Line> lines = new ArrayList<>();
        int lineNumber = 0;

        for (String raw : LINE_BREAKS.split(input)) {
            if (ONLY_WHITESPACE.matcher(raw).matches()) {
                continue;
            }
            lineNumber++;

            Matcher matcher = LEADING_WHITESPACE_AND_BULLET.matcher(raw);
            if (!matcher.find()) {
                throw new IllegalStateException(
                    "Cannot parse line " + lineNumber + ": \"" + raw + "\". Expected valid indentation.");
            }

            String name = raw.substring(matcher.end(1));
            lines.add(new Line(name, matcher.group(2).length()));
        }
        return lines;
    }
}
