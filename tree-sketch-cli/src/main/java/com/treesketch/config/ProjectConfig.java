package com.treesketch.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.treesketch.core.generator.EmptyDirectoryRule;
import com.treesketch.core.generator.FormatOptions;
import com.treesketch.core.generator.LineCharset;

/**
 * Settings loaded from {@code treesketch.yaml}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * format: utf8
 *
 * options:
 *   charset: utf8
 *   trailingDirSlash: true
 *   fullPath: false
 *   rootDot: true
 *   emptyDirectories: trailing-slash
 *
 * output:
 *   file: "docs/layout.txt"
 * }</pre>
 *
 * <p>Every section is optional; absent values fall back to the defaults of
 * {@link FormatOptions#defaults()}.
 *
 * @param format default output format identifier
 * @param options rendering options
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("format") String format,
    @JsonProperty("options") OptionsConfig options,
    @JsonProperty("output") OutputConfig output
) {
    /** Format used when neither the command line nor the config names one. */
    public static final String DEFAULT_FORMAT = "utf8";

    /**
     * Creates the built-in configuration.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(
            DEFAULT_FORMAT,
            new OptionsConfig(null, null, null, null, null),
            new OutputConfig(null)
        );
    }

    /**
     * Returns the configured format, or {@value #DEFAULT_FORMAT}.
     *
     * @return format identifier
     */
    public String effectiveFormat() {
        return format != null ? format : DEFAULT_FORMAT;
    }

    /**
     * Converts the options section into {@link FormatOptions}, filling gaps with defaults.
     *
     * @return rendering options
     * @throws IllegalArgumentException if the charset or empty directory rule is unknown
     */
    public FormatOptions toFormatOptions() {
        FormatOptions result = FormatOptions.defaults();
        if (options == null) {
            return result;
        }
        if (options.charset() != null) {
            result = result.withCharset(LineCharset.fromId(options.charset()));
        }
        if (options.trailingDirSlash() != null) {
            result = result.withTrailingDirSlash(options.trailingDirSlash());
        }
        if (options.fullPath() != null) {
            result = result.withFullPath(options.fullPath());
        }
        if (options.rootDot() != null) {
            result = result.withRootDot(options.rootDot());
        }
        if (options.emptyDirectories() != null) {
            result = result.withEmptyDirectoryRule(EmptyDirectoryRule.fromId(options.emptyDirectories()));
        }
        return result;
    }

    /**
     * Rendering options; null means "not configured".
     *
     * @param charset {@code ascii} or {@code utf8}
     * @param trailingDirSlash append {@code /} to directories
     * @param fullPath show full paths
     * @param rootDot show the root {@code .} line
     * @param emptyDirectories {@code trailing-slash} or {@code name-contains-dir}
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OptionsConfig(
        @JsonProperty("charset") String charset,
        @JsonProperty("trailingDirSlash") Boolean trailingDirSlash,
        @JsonProperty("fullPath") Boolean fullPath,
        @JsonProperty("rootDot") Boolean rootDot,
        @JsonProperty("emptyDirectories") String emptyDirectories
    ) {}

    /**
     * Output configuration.
     *
     * @param file file to write instead of standard output
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("file") String file
    ) {}
}
