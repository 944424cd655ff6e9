package com.treesketch.core.generator.impl;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.treesketch.core.generator.TreeFormatter;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link FlatJsonFormatter}.
 */
class FlatJsonFormatterTest extends FormatterTestBase {

    private final FlatJsonFormatter formatter = new FlatJsonFormatter();

    @Override
    protected TreeFormatter formatter() {
        return formatter;
    }

    @Test
    void format_sample_listsFilesAndDirectories() {
        JsonNode json = readJson(format(SAMPLE));

        assertThat(json.get("directories").findValuesAsText("path")).containsExactly("app", "app/src");
        assertThat(json.get("files").findValuesAsText("path"))
            .containsExactly("app/src/index.js", "app/package.json");
        assertThat(json.get("files").get(0).get("type").asText()).isEqualTo("file");
        assertThat(json.get("directories").get(0).has("type")).isFalse();
    }

    @Test
    void format_filesComeBeforeDirectories() {
        String result = format(SAMPLE);

        assertThat(result.indexOf("\"files\"")).isLessThan(result.indexOf("\"directories\""));
    }

    @Test
    void format_emptyTree_writesEmptyArrays() {
        assertThat(format(" ")).isEqualTo(
            "{\n"
                + "  \"files\": [],\n"
                + "  \"directories\": []\n"
                + "}");
    }
}
