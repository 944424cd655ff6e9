package com.treesketch.core.generator.impl;

import java.io.IOException;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.treesketch.core.generator.FormatOptions;
import com.treesketch.core.generator.TreeFormatter;
import com.treesketch.core.model.TreeNode;
import com.treesketch.core.parser.IndentationParser;

import static org.assertj.core.api.Assertions.*;

/**
 * Base class for formatter tests.
 *
 * <p>Provides the shared sample outline, parsing helpers and the null-structure check every
 * formatter must pass. Subclasses supply the formatter under test.
 */
public abstract class FormatterTestBase {

    /** Outline used across formatter tests. */
    protected static final String SAMPLE = "app\n  src\n    index.js\n  package.json";

    private static final ObjectMapper JSON = new ObjectMapper();

    private final IndentationParser parser = new IndentationParser();

    /**
     * Returns the formatter under test.
     *
     * @return formatter instance
     */
    protected abstract TreeFormatter formatter();

    protected TreeNode parse(String input) {
        return parser.parse(input);
    }

    protected TreeNode sample() {
        return parse(SAMPLE);
    }

    protected String format(String input) {
        return formatter().format(parse(input), FormatOptions.defaults());
    }

    protected String format(String input, FormatOptions options) {
        return formatter().format(parse(input), options);
    }

    /**
     * Parses JSON output back, failing the test if it is not valid JSON.
     *
     * @param json formatter output
     * @return parsed tree
     */
    protected JsonNode readJson(String json) {
        try {
            return JSON.readTree(json);
        } catch (IOException e) {
            throw new AssertionError("Output is not valid JSON: " + json, e);
        }
    }

    @Test
    void format_withNullStructure_throwsException() {
        assertThatThrownBy(() -> formatter().format(null, FormatOptions.defaults()))
            .isInstanceOf(NullPointerException.class)
            .hasMessage("Structure is required");
    }

    @Test
    void format_withNullOptions_usesDefaults() {
        assertThat(formatter().format(sample(), null))
            .isEqualTo(formatter().format(sample(), FormatOptions.defaults()));
    }

    @Test
    void metadata_isPresent() {
        assertThat(formatter().getId()).matches("[a-z-]+");
        assertThat(formatter().getDisplayName()).isNotBlank();
        assertThat(formatter().getFileExtension()).isNotBlank().doesNotStartWith(".");
    }
}
