package com.treesketch.core.generator.impl;

import java.util.Objects;

import com.treesketch.core.generator.FormatOptions;
import com.treesketch.core.generator.TreeFormatter;
import com.treesketch.core.model.TreeNode;

/**
 * Renders {@code <directory>} and {@code <file />} elements, two spaces per level, after an
 * XML declaration. The root becomes {@code <directory name="root">} (or a file element
 * when the tree is empty).
 */
public class XmlFormatter implements TreeFormatter {

    private static final String XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n";
    private static final String ROOT_LABEL = "root";
    private static final int INDENT_STEP = 2;

    @Override
    public String getId() {
        return "xml";
    }

    @Override
    public String getDisplayName() {
        return "XML";
    }

    @Override
    public String getFileExtension() {
        return "xml";
    }

    @Override
    public String format(TreeNode root, FormatOptions options) {
        Objects.requireNonNull(root, "Structure is required");

        StringBuilder xml = new StringBuilder(XML_DECLARATION);
        appendElement(xml, root, 0);
        return xml.toString();
    }

    private void appendElement(StringBuilder xml, TreeNode node, int indent) {
        String spaces = " ".repeat(indent);
        String name = escape(node.isRoot() ? ROOT_LABEL : node.name());

        if (!node.isDirectory()) {
            xml.append(spaces).append("<file name=\"").append(name).append("\" />\n");
            return;
        }

        xml.append(spaces).append("<directory name=\"").append(name).append("\">\n");
        for (TreeNode child : node.children()) {
            appendElement(xml, child, indent + INDENT_STEP);
        }
        xml.append(spaces).append("</directory>\n");
    }

    /**
     * Escapes the five predefined XML entities. Ampersands go first so that later
     * replacements are not escaped twice.
     */
    static String escape(String text) {
        return text.replace("&", "&amp;")
            .replace("<", "&lt;")
            .replace(">", "&gt;")
            .replace("\"", "&quot;")
            .replace("'", "&apos;");
    }
}
