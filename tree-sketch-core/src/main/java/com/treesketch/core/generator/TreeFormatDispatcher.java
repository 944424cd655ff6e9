package com.treesketch.core.generator;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.treesketch.core.generator.impl.ArrayJsonFormatter;
import com.treesketch.core.generator.impl.DotPathFormatter;
import com.treesketch.core.generator.impl.FlatJsonFormatter;
import com.treesketch.core.generator.impl.LineDrawingFormatter;
import com.treesketch.core.generator.impl.MarkdownListFormatter;
import com.treesketch.core.generator.impl.NestedJsonFormatter;
import com.treesketch.core.generator.impl.XmlFormatter;
import com.treesketch.core.generator.impl.YamlFormatter;
import com.treesketch.core.model.TreeNode;

/**
 * Routes a render request to the formatter for the requested {@link TreeFormat}.
 *
 * <p>{@code ascii} and {@code utf8} both go to the line-drawing formatter with the charset
 * forced accordingly. An unrecognized format identifier does not fail: the tree is drawn
 * with the caller's options as given, which matches the behavior users of the web tool
 * relied on.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * TreeFormatDispatcher dispatcher = new TreeFormatDispatcher();
 * String yaml = dispatcher.format(root, "yaml", FormatOptions.defaults());
 * }</pre>
 */
public class TreeFormatDispatcher {

    private static final Logger log = LoggerFactory.getLogger(TreeFormatDispatcher.class);

    private final LineDrawingFormatter lineDrawing = new LineDrawingFormatter();
    private final NestedJsonFormatter nestedJson = new NestedJsonFormatter();
    private final ArrayJsonFormatter arrayJson = new ArrayJsonFormatter();
    private final FlatJsonFormatter flatJson = new FlatJsonFormatter();
    private final YamlFormatter yaml = new YamlFormatter();
    private final XmlFormatter xml = new XmlFormatter();
    private final DotPathFormatter dotPath = new DotPathFormatter();
    private final MarkdownListFormatter markdown = new MarkdownListFormatter();

    /**
     * Renders the tree in the format named by {@code formatId}.
     *
     * @param root root of a parsed tree
     * @param formatId format identifier; unknown values fall back to line drawing
     * @param options rendering options, or null for defaults
     * @return rendered text
     * @throws NullPointerException if {@code root} is null
     */
    public String format(TreeNode root, String formatId, FormatOptions options) {
        Objects.requireNonNull(root, "Structure is required");
        FormatOptions effective = options != null ? options : FormatOptions.defaults();

        return TreeFormat.fromId(formatId)
            .map(format -> format(root, format, effective))
            .orElseGet(() -> {
                log.warn("Unknown format '{}', rendering line-drawing tree instead", formatId);
                return lineDrawing.format(root, effective);
            });
    }

    /**
     * Renders the tree in the given format.
     *
     * @param root root of a parsed tree
     * @param format output format
     * @param options rendering options, or null for defaults
     * @return rendered text
     * @throws NullPointerException if {@code root} or {@code format} is null
     */
    public String format(TreeNode root, TreeFormat format, FormatOptions options) {
        Objects.requireNonNull(root, "Structure is required");
        Objects.requireNonNull(format, "format must not be null");
        FormatOptions effective = options != null ? options : FormatOptions.defaults();

        if (log.isDebugEnabled()) {
            log.debug("Rendering {} nodes as {}", root.nodeCount(), format.id());
        }
        return switch (format) {
            case ASCII -> lineDrawing.format(root, effective.withCharset(LineCharset.ASCII));
            case UTF8 -> lineDrawing.format(root, effective.withCharset(LineCharset.UTF8));
            default -> formatterFor(format).format(root, effective);
        };
    }

    /**
     * Returns the formatter that produces the given format.
     *
     * @param format output format
     * @return formatter instance shared by this dispatcher
     */
    public TreeFormatter formatterFor(TreeFormat format) {
        return switch (format) {
            case ASCII, UTF8 -> lineDrawing;
            case JSON_NESTED -> nestedJson;
            case JSON_ARRAY -> arrayJson;
            case JSON_FLAT -> flatJson;
            case YAML -> yaml;
            case XML -> xml;
            case DOT -> dotPath;
            case MARKDOWN -> markdown;
        };
    }
}
