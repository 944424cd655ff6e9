package com.treesketch.core.generator;

import java.util.Locale;

/**
 * Glyph sets used to draw tree lines. Every glyph is four columns wide.
 */
public enum LineCharset {

    ASCII("ascii", "|-- ", "`-- ", "|   ", "    "),
    UTF8("utf8", "├── ", "└── ", "│   ", "    ");

    private final String id;
    private final String child;
    private final String lastChild;
    private final String directory;
    private final String empty;

    LineCharset(String id, String child, String lastChild, String directory, String empty) {
        this.id = id;
        this.child = child;
        this.lastChild = lastChild;
        this.directory = directory;
        this.empty = empty;
    }

    public String id() {
        return id;
    }

    /** Connector in front of a child that has later siblings. */
    public String child() {
        return child;
    }

    /** Connector in front of the last child. */
    public String lastChild() {
        return lastChild;
    }

    /** Continuation below an ancestor that still has later siblings. */
    public String directory() {
        return directory;
    }

    /** Continuation below an ancestor that was the last child. */
    public String empty() {
        return empty;
    }

    /**
     * Resolves a charset from its identifier. Accepts {@code utf-8} as an alias of
     * {@code utf8}; matching ignores case.
     *
     * @param id charset identifier
     * @return the charset
     * @throws IllegalArgumentException if the identifier is unknown
     */
    public static LineCharset fromId(String id) {
        if (id != null) {
            switch (id.trim().toLowerCase(Locale.ROOT)) {
                case "ascii":
                    return ASCII;
                case "utf8":
                case "utf-8":
                    return UTF8;
                default:
                    break;
            }
        }
        throw new IllegalArgumentException("Unknown charset: " + id);
    }
}
