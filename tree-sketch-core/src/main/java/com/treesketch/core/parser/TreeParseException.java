package com.treesketch.core.parser;

/**
 * Thrown when plain-text input cannot be turned into a tree.
 *
 * <p>No partial tree is ever produced; callers are expected to show {@link #getMessage()}
 * and let the user fix the input.
 */
public class TreeParseException extends RuntimeException {

    /**
     * Why parsing failed.
     */
    public enum Reason {
        /** The input was null or empty. */
        INVALID_INPUT,

        /** Indentation cannot be resolved to a single parent. */
        STRUCTURAL_AMBIGUITY
    }

    private final Reason reason;
    private final String itemName;

    public TreeParseException(Reason reason, String message, String itemName) {
        super(message);
        this.reason = reason;
        this.itemName = itemName;
    }

    static TreeParseException invalidInput() {
        return new TreeParseException(Reason.INVALID_INPUT, "Input must be a non-empty string", null);
    }

    static TreeParseException badIndentation(String itemName) {
        return new TreeParseException(Reason.STRUCTURAL_AMBIGUITY,
            "Bad indentation found at item: " + itemName, itemName);
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * Returns the name of the offending item.
     *
     * @return item name, or {@code null} when the failure is not tied to a line
     */
    public String getItemName() {
        return itemName;
    }
}
