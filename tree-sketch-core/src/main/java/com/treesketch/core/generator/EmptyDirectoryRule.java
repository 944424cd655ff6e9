package com.treesketch.core.generator;

import java.util.Locale;
import java.util.regex.Pattern;

import com.treesketch.core.model.TreeNode;

/**
 * Decides whether a childless node stands for an empty directory in the nested JSON and
 * YAML projections. All other formats classify nodes by child count alone.
 */
public enum EmptyDirectoryRule {

    /** The name ends with {@code /}, trailing whitespace ignored. */
    TRAILING_SLASH("trailing-slash"),

    /** The name contains {@code dir} anywhere. Legacy heuristic, kept selectable. */
    NAME_CONTAINS_DIR("name-contains-dir");

    private static final Pattern TRAILING_SLASH_PATTERN = Pattern.compile("/\\s*$");

    private final String id;

    EmptyDirectoryRule(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * Checks whether a childless node should render as an empty directory.
     *
     * @param node node without children
     * @return true for an empty directory, false for a file
     */
    public boolean isEmptyDirectory(TreeNode node) {
        return switch (this) {
            case TRAILING_SLASH -> TRAILING_SLASH_PATTERN.matcher(node.name()).find();
            case NAME_CONTAINS_DIR -> node.name().contains("dir");
        };
    }

    /**
     * Resolves a rule from its identifier or enum name.
     *
     * @param id rule identifier, e.g. {@code trailing-slash}
     * @return the rule
     * @throws IllegalArgumentException if the identifier is unknown
     */
    public static EmptyDirectoryRule fromId(String id) {
        if (id != null) {
            String normalized = id.trim().toLowerCase(Locale.ROOT).replace('_', '-');
            for (EmptyDirectoryRule rule : values()) {
                if (rule.id.equals(normalized)) {
                    return rule;
                }
            }
        }
        throw new IllegalArgumentException("Unknown empty directory rule: " + id);
    }
}
