package com.treesketch.core.generator.impl;

import java.util.Objects;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.treesketch.core.generator.FormatOptions;
import com.treesketch.core.generator.TreeFormatter;
import com.treesketch.core.model.TreeNode;

/**
 * Renders every entry as {@code {"name", "type"}}, with a {@code children} array on
 * directories. The root is named {@code root}.
 */
public class ArrayJsonFormatter implements TreeFormatter {

    private static final String ROOT_LABEL = "root";
    private static final String DIRECTORY = "directory";
    private static final String FILE = "file";

    @Override
    public String getId() {
        return "json-array";
    }

    @Override
    public String getDisplayName() {
        return "Typed JSON Tree";
    }

    @Override
    public String getFileExtension() {
        return "json";
    }

    @Override
    public String format(TreeNode root, FormatOptions options) {
        Objects.requireNonNull(root, "Structure is required");
        return JsonSupport.write(createObjectWithChildren(root));
    }

    private ObjectNode createObjectWithChildren(TreeNode node) {
        ObjectNode result = JsonSupport.objectNode();
        result.put("name", node.isRoot() ? ROOT_LABEL : node.name());
        result.put("type", node.isDirectory() ? DIRECTORY : FILE);

        if (node.isDirectory()) {
            ArrayNode children = result.putArray("children");
            for (TreeNode child : node.children()) {
                children.add(createObjectWithChildren(child));
            }
        }
        return result;
    }
}
