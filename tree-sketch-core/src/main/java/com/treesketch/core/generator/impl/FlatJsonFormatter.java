package com.treesketch.core.generator.impl;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.treesketch.core.generator.FormatOptions;
import com.treesketch.core.generator.TreeFormatter;
import com.treesketch.core.model.TreeNode;

/**
 * Renders two flat path lists:
 *
 * <pre>{@code
 * {
 *   "files": [
 *     { "path": "app/index.js", "type": "file" }
 *   ],
 *   "directories": [
 *     { "path": "app" }
 *   ]
 * }
 * }</pre>
 *
 * <p>Both lists follow pre-order document order. The root is not listed.
 */
public class FlatJsonFormatter implements TreeFormatter {

    @Override
    public String getId() {
        return "json-flat";
    }

    @Override
    public String getDisplayName() {
        return "Flat JSON Paths";
    }

    @Override
    public String getFileExtension() {
        return "json";
    }

    @Override
    public String format(TreeNode root, FormatOptions options) {
        Objects.requireNonNull(root, "Structure is required");

        ObjectNode result = JsonSupport.objectNode();
        ArrayNode files = result.putArray("files");
        ArrayNode directories = result.putArray("directories");

        Deque<TreeNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TreeNode node = stack.pop();

            if (!node.isRoot()) {
                if (node.isDirectory()) {
                    directories.addObject().put("path", node.path());
                } else {
                    files.addObject()
                        .put("path", node.path())
                        .put("type", "file");
                }
            }

            List<TreeNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }

        return JsonSupport.write(result);
    }
}
