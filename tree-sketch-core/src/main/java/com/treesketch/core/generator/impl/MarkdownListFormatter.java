package com.treesketch.core.generator.impl;

import java.util.Objects;

import com.treesketch.core.generator.FormatOptions;
import com.treesketch.core.generator.TreeFormatter;
import com.treesketch.core.model.TreeNode;

/**
 * Renders a nested markdown bullet list. Directories get a trailing {@code /}; top-level
 * entries start at column zero and each level adds two spaces.
 */
public class MarkdownListFormatter implements TreeFormatter {

    private static final String BULLET = "* ";
    private static final int INDENT_STEP = 2;

    @Override
    public String getId() {
        return "markdown";
    }

    @Override
    public String getDisplayName() {
        return "Markdown List";
    }

    @Override
    public String getFileExtension() {
        return "md";
    }

    @Override
    public String format(TreeNode root, FormatOptions options) {
        Objects.requireNonNull(root, "Structure is required");

        StringBuilder markdown = new StringBuilder();
        for (TreeNode child : root.children()) {
            appendItem(markdown, child, 0);
        }
        return markdown.toString();
    }

    private void appendItem(StringBuilder markdown, TreeNode node, int indent) {
        markdown.append(" ".repeat(indent))
            .append(BULLET)
            .append(node.name())
            .append(node.isDirectory() ? "/" : "")
            .append('\n');

        for (TreeNode child : node.children()) {
            appendItem(markdown, child, indent + INDENT_STEP);
        }
    }
}
