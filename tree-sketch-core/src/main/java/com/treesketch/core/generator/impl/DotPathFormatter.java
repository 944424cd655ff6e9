package com.treesketch.core.generator.impl;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

import com.treesketch.core.generator.FormatOptions;
import com.treesketch.core.generator.TreeFormatter;
import com.treesketch.core.model.TreeNode;

/**
 * Lists the full path of every entry, files and directories alike, sorted ascending and
 * one per line.
 */
public class DotPathFormatter implements TreeFormatter {

    @Override
    public String getId() {
        return "dot";
    }

    @Override
    public String getDisplayName() {
        return "Sorted Path List";
    }

    @Override
    public String getFileExtension() {
        return "txt";
    }

    @Override
    public String format(TreeNode root, FormatOptions options) {
        Objects.requireNonNull(root, "Structure is required");

        List<String> paths = new ArrayList<>();
        Deque<TreeNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TreeNode node = stack.pop();
            if (!node.isRoot()) {
                paths.add(node.path());
            }
            node.children().forEach(stack::push);
        }

        Collections.sort(paths);
        return String.join("\n", paths);
    }
}
