package com.treesketch.core.generator.impl;

import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.treesketch.core.generator.EmptyDirectoryRule;
import com.treesketch.core.generator.FormatOptions;
import com.treesketch.core.generator.TreeFormatter;
import com.treesketch.core.model.TreeNode;

/**
 * Renders the tree as nested JSON objects keyed by entry name.
 *
 * <pre>{@code
 * {
 *   ".": {
 *     "app": {
 *       "index.js": null
 *     }
 *   }
 * }
 * }</pre>
 *
 * <p>Files map to {@code null}. A childless entry that the configured
 * {@link EmptyDirectoryRule} recognizes maps to {@code {}}. Siblings with the same name
 * collapse into one key holding the last sibling's value.
 */
public class NestedJsonFormatter implements TreeFormatter {

    @Override
    public String getId() {
        return "json-nested";
    }

    @Override
    public String getDisplayName() {
        return "Nested JSON";
    }

    @Override
    public String getFileExtension() {
        return "json";
    }

    @Override
    public String format(TreeNode root, FormatOptions options) {
        Objects.requireNonNull(root, "Structure is required");
        return JsonSupport.write(toJson(root, options));
    }

    /**
     * Builds the single-key object that {@link #format} serializes. The YAML formatter
     * reuses it.
     *
     * @param root root of the tree
     * @param options rendering options; only the empty directory rule is read
     * @return object keyed by the root's name
     */
    ObjectNode toJson(TreeNode root, FormatOptions options) {
        EmptyDirectoryRule rule = options != null
            ? options.emptyDirectoryRule()
            : FormatOptions.defaults().emptyDirectoryRule();

        ObjectNode wrapper = JsonSupport.objectNode();
        wrapper.set(root.name(), createNestedObject(root, rule));
        return wrapper;
    }

    private JsonNode createNestedObject(TreeNode node, EmptyDirectoryRule rule) {
        if (!node.isDirectory()) {
            return rule.isEmptyDirectory(node) ? JsonSupport.objectNode() : NullNode.getInstance();
        }

        ObjectNode result = JsonSupport.objectNode();
        for (TreeNode child : node.children()) {
            result.set(child.name(), createNestedObject(child, rule));
        }
        return result;
    }
}
