package com.treesketch.core.generator;

import com.treesketch.core.model.TreeNode;

/**
 * Projects a parsed tree into one textual notation.
 *
 * <p>Formatters are pure functions of their arguments: they never modify the tree, keep no
 * state between calls and may be shared between threads.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class DotPathFormatter implements TreeFormatter {
 *     @Override
 *     public String getId() {
 *         return "dot";
 *     }
 *
 *     @Override
 *     public String getDisplayName() {
 *         return "Sorted Path List";
 *     }
 *
 *     @Override
 *     public String getFileExtension() {
 *         return "txt";
 *     }
 *
 *     @Override
 *     public String format(TreeNode root, FormatOptions options) {
 *         Objects.requireNonNull(root, "Structure is required");
 *         ...
 *     }
 * }
 * }</pre>
 *
 * @see TreeFormat
 * @see TreeFormatDispatcher
 */
public interface TreeFormatter {

    /**
     * Returns the format identifier, e.g. {@code "json-nested"}.
     *
     * @return lowercase identifier
     */
    String getId();

    /**
     * Returns a human-readable name for listings.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the file extension used when the output is saved.
     *
     * @return extension without leading dot
     */
    String getFileExtension();

    /**
     * Renders the tree.
     *
     * @param root root of a parsed tree
     * @param options rendering options; formatters ignore settings that do not apply to them
     * @return rendered text
     * @throws NullPointerException if {@code root} is null
     */
    String format(TreeNode root, FormatOptions options);
}
