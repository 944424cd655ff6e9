package com.treesketch.core.generator.impl;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

import com.treesketch.core.generator.FormatOptions;
import com.treesketch.core.generator.LineCharset;
import com.treesketch.core.generator.TreeFormat;
import com.treesketch.core.generator.TreeFormatter;
import com.treesketch.core.model.TreeNode;

/**
 * Draws the tree with box-drawing or plain ASCII connectors.
 *
 * <pre>
 * .
 * └── app
 *     ├── src
 *     │   └── index.js
 *     └── package.json
 * </pre>
 *
 * <h2>Options</h2>
 * <ul>
 *   <li>{@code charset} - {@code ├──} glyphs or their {@code |--} ASCII counterparts</li>
 *   <li>{@code trailingDirSlash} - append {@code /} to directories that lack one</li>
 *   <li>{@code fullPath} - show every entry with its ancestors' path</li>
 *   <li>{@code rootDot} - emit the {@code .} line; without it every line loses one level</li>
 * </ul>
 *
 * <p>Nodes are visited in pre-order from an explicit stack so that very deep trees cannot
 * overflow the call stack. Each line is composed by walking up the parent links: the node
 * contributes its connector, every ancestor below the root contributes a continuation.
 */
public class LineDrawingFormatter implements TreeFormatter {

    private static final Pattern TRAILING_SLASH = Pattern.compile("/\\s*$");

    @Override
    public String getId() {
        return TreeFormat.UTF8.id();
    }

    @Override
    public String getDisplayName() {
        return "Line-Drawing Tree";
    }

    @Override
    public String getFileExtension() {
        return "txt";
    }

    @Override
    public String format(TreeNode root, FormatOptions options) {
        Objects.requireNonNull(root, "Structure is required");
        FormatOptions effective = options != null ? options : FormatOptions.defaults();

        List<String> lines = new ArrayList<>();
        Deque<TreeNode> stack = new ArrayDeque<>();
        stack.push(root);

        while (!stack.isEmpty()) {
            TreeNode node = stack.pop();

            String line = renderLine(node, effective);
            if (line != null) {
                lines.add(line);
            }

            // reverse push keeps document order on pop
            List<TreeNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }

        return String.join("\n", lines);
    }

    private String renderLine(TreeNode node, FormatOptions options) {
        if (node.isRoot()) {
            return options.rootDot() ? node.name() : null;
        }

        LineCharset glyphs = options.charset();
        Deque<String> chunks = new ArrayDeque<>();
        chunks.addFirst(decorateName(node, options));
        chunks.addFirst(node.isLastChild() ? glyphs.lastChild() : glyphs.child());

        TreeNode current = node.parent();
        while (current != null && !current.isRoot()) {
            chunks.addFirst(current.isLastChild() ? glyphs.empty() : glyphs.directory());
            current = current.parent();
        }

        String line = String.join("", chunks);
        return options.rootDot() ? line : line.substring(glyphs.child().length());
    }

    private String decorateName(TreeNode node, FormatOptions options) {
        StringBuilder name = new StringBuilder();

        if (options.fullPath()) {
            String parentPath = node.parent().path();
            if (!parentPath.isEmpty()) {
                name.append(parentPath).append('/');
            }
        }

        name.append(node.name());

        if (options.trailingDirSlash() && node.isDirectory() && !TRAILING_SLASH.matcher(node.name()).find()) {
            name.append('/');
        }
        return name.toString();
    }
}
