package com.treesketch.core.generator;

import java.util.Locale;
import java.util.Optional;

/**
 * The output notations a tree can be rendered into.
 */
public enum TreeFormat {

    /** Line-drawing tree with {@code |--} glyphs */
    ASCII("ascii", "ASCII Tree", "txt"),

    /** Line-drawing tree with box-drawing glyphs */
    UTF8("utf8", "UTF-8 Tree", "txt"),

    /** Objects keyed by entry name */
    JSON_NESTED("json-nested", "Nested JSON", "json"),

    /** Name/type objects with children arrays */
    JSON_ARRAY("json-array", "Typed JSON Tree", "json"),

    /** Separate file and directory path lists */
    JSON_FLAT("json-flat", "Flat JSON Paths", "json"),

    /** Block-style YAML mapping */
    YAML("yaml", "YAML", "yaml"),

    /** Directory and file elements */
    XML("xml", "XML", "xml"),

    /** Sorted full paths, one per line */
    DOT("dot", "Sorted Path List", "txt"),

    /** Nested bullet list */
    MARKDOWN("markdown", "Markdown List", "md");

    private final String id;
    private final String displayName;
    private final String fileExtension;

    TreeFormat(String id, String displayName, String fileExtension) {
        this.id = id;
        this.displayName = displayName;
        this.fileExtension = fileExtension;
    }

    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    public String fileExtension() {
        return fileExtension;
    }

    /**
     * Looks up a format by identifier, ignoring case. {@code utf-8} is accepted for
     * {@link #UTF8}.
     *
     * @param id format identifier
     * @return the format, or empty if the identifier is unknown
     */
    public static Optional<TreeFormat> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("utf-8")) {
            return Optional.of(UTF8);
        }
        for (TreeFormat format : values()) {
            if (format.id.equals(normalized)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
