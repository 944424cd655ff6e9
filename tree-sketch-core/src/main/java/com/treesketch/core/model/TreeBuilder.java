package com.treesketch.core.model;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Assembles a {@link TreeNode} tree and seals it.
 *
 * <p>The builder starts with the synthetic root. Nodes are appended to an existing parent
 * in document order; {@link #build()} freezes every node and returns the root. A builder
 * can only be built once.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * TreeBuilder builder = new TreeBuilder();
 * TreeNode app = builder.add(builder.root(), "app", 0);
 * builder.add(app, "index.js", 2);
 * TreeNode root = builder.build();
 * }</pre>
 */
public final class TreeBuilder {

    private final TreeNode root = new TreeNode(TreeNode.ROOT_NAME, TreeNode.ROOT_INDENT_LEVEL, null);
    private boolean built;

    /**
     * Returns the synthetic root node that top-level entries attach to.
     *
     * @return the root
     */
    public TreeNode root() {
        return root;
    }

    /**
     * Appends a new node as the last child of {@code parent}.
     *
     * @param parent node created by this builder
     * @param name entry name
     * @param indentLevel leading whitespace count of the source line
     * @return the new node
     * @throws IllegalStateException if the tree is already built
     */
    public TreeNode add(TreeNode parent, String name, int indentLevel) {
        Objects.requireNonNull(parent, "parent must not be null");
        if (built) {
            throw new IllegalStateException("Tree is already built");
        }
        TreeNode child = new TreeNode(name, indentLevel, parent);
        parent.addChild(child);
        return child;
    }

    /**
     * Seals every node and returns the root.
     *
     * @return the finished tree
     * @throws IllegalStateException if called twice
     */
    public TreeNode build() {
        if (built) {
            throw new IllegalStateException("Tree is already built");
        }
        built = true;

        Deque<TreeNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TreeNode node = stack.pop();
            node.children().forEach(stack::push);
            node.seal();
        }
        return root;
    }
}
