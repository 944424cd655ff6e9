package com.treesketch.core.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * One entry of a parsed directory layout.
 *
 * <p>A node owns its children through {@link #children()}; the {@link #parent()} link is a
 * plain lookup reference used to walk upwards when computing prefixes and paths. Whether a
 * node is a directory is derived from its child count and never stored.
 *
 * <p>Nodes are assembled exclusively through {@link TreeBuilder}. Once
 * {@link TreeBuilder#build()} returns, the whole tree is sealed: child lists are
 * unmodifiable and no node can gain children or change parent. A sealed tree is read-only,
 * so once safely published (a final field, a concurrent collection) any number of threads
 * may read it.
 *
 * @see TreeBuilder
 */
public final class TreeNode {

    /** Name of the synthetic root, meaning "current directory". */
    public static final String ROOT_NAME = ".";

    /** Indent level of the synthetic root; lower than any real line. */
    public static final int ROOT_INDENT_LEVEL = -1;

    private final String name;
    private final int indentLevel;
    private final TreeNode parent;
    private final List<TreeNode> children = new ArrayList<>();
    private final List<TreeNode> readOnlyChildren = Collections.unmodifiableList(children);
    private boolean sealed;

    TreeNode(String name, int indentLevel, TreeNode parent) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.indentLevel = indentLevel;
        this.parent = parent;
    }

    /**
     * Returns the display text of this entry, verbatim from the input line.
     *
     * @return node name; {@value #ROOT_NAME} for the root
     */
    public String name() {
        return name;
    }

    /**
     * Returns the number of leading whitespace characters the source line carried.
     *
     * @return indent level; {@value #ROOT_INDENT_LEVEL} for the root
     */
    public int indentLevel() {
        return indentLevel;
    }

    /**
     * Returns the enclosing node.
     *
     * @return parent node, or {@code null} for the root
     */
    public TreeNode parent() {
        return parent;
    }

    /**
     * Returns the children in input order.
     *
     * @return unmodifiable child list
     */
    public List<TreeNode> children() {
        return readOnlyChildren;
    }

    public boolean isRoot() {
        return parent == null;
    }

    /**
     * A node with at least one child is a directory; everything else is a file.
     *
     * @return true if this node has children
     */
    public boolean isDirectory() {
        return !children.isEmpty();
    }

    /**
     * Checks whether this node occupies the final slot of its parent's child list.
     * The root is never a last child.
     *
     * @return true if this node is the last child of its parent
     */
    public boolean isLastChild() {
        if (parent == null || parent.children.isEmpty()) {
            return false;
        }
        return parent.children.get(parent.children.size() - 1) == this;
    }

    /**
     * Returns the slash-joined names from the top-level ancestor down to this node.
     * The root does not contribute to the path, so the root's own path is empty.
     *
     * @return path such as {@code app/src/index.js}
     */
    public String path() {
        Deque<String> parts = new ArrayDeque<>();
        TreeNode current = this;
        while (current != null && !current.isRoot()) {
            parts.addFirst(current.name);
            current = current.parent;
        }
        return String.join("/", parts);
    }

    /**
     * Returns the distance from the root; the root is at depth 0.
     *
     * @return number of parent links between this node and the root
     */
    public int depth() {
        int depth = 0;
        TreeNode current = parent;
        while (current != null) {
            depth++;
            current = current.parent;
        }
        return depth;
    }

    /**
     * Counts this node and all of its descendants.
     *
     * @return subtree size, including this node
     */
    public int nodeCount() {
        int count = 0;
        Deque<TreeNode> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            TreeNode node = stack.pop();
            count++;
            node.children.forEach(stack::push);
        }
        return count;
    }

    void addChild(TreeNode child) {
        if (sealed) {
            throw new IllegalStateException("Tree is already built; cannot add " + child.name + " to " + name);
        }
        children.add(child);
    }

    void seal() {
        sealed = true;
    }

    @Override
    public String toString() {
        return "TreeNode[name=" + name + ", indentLevel=" + indentLevel + ", children=" + children.size() + "]";
    }
}
