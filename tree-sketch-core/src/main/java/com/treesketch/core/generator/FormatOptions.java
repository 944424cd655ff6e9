package com.treesketch.core.generator;

/**
 * Rendering options. Only the line-drawing formats read the first four settings;
 * {@code emptyDirectoryRule} applies to nested JSON and YAML.
 *
 * @param charset glyph set for line drawing
 * @param trailingDirSlash append {@code /} to directory names that lack one
 * @param fullPath prefix every name with its ancestors' path
 * @param rootDot emit the root {@code .} line
 * @param emptyDirectoryRule how childless directories are recognized
 */
public record FormatOptions(
    LineCharset charset,
    boolean trailingDirSlash,
    boolean fullPath,
    boolean rootDot,
    EmptyDirectoryRule emptyDirectoryRule
) {
    /**
     * Compact constructor applying defaults for missing enums.
     */
    public FormatOptions {
        if (charset == null) {
            charset = LineCharset.UTF8;
        }
        if (emptyDirectoryRule == null) {
            emptyDirectoryRule = EmptyDirectoryRule.TRAILING_SLASH;
        }
    }

    /**
     * Creates the default options: UTF-8 glyphs, no decorations, root dot shown.
     *
     * @return default options
     */
    public static FormatOptions defaults() {
        return new FormatOptions(LineCharset.UTF8, false, false, true, EmptyDirectoryRule.TRAILING_SLASH);
    }

    public FormatOptions withCharset(LineCharset newCharset) {
        return new FormatOptions(newCharset, trailingDirSlash, fullPath, rootDot, emptyDirectoryRule);
    }

    public FormatOptions withTrailingDirSlash(boolean enabled) {
        return new FormatOptions(charset, enabled, fullPath, rootDot, emptyDirectoryRule);
    }

    public FormatOptions withFullPath(boolean enabled) {
        return new FormatOptions(charset, trailingDirSlash, enabled, rootDot, emptyDirectoryRule);
    }

    public FormatOptions withRootDot(boolean enabled) {
        return new FormatOptions(charset, trailingDirSlash, fullPath, enabled, emptyDirectoryRule);
    }

    public FormatOptions withEmptyDirectoryRule(EmptyDirectoryRule rule) {
        return new FormatOptions(charset, trailingDirSlash, fullPath, rootDot, rule);
    }
}
