package com.treesketch.core.generator;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.treesketch.core.generator.impl.LineDrawingFormatter;
import com.treesketch.core.generator.impl.YamlFormatter;
import com.treesketch.core.model.TreeNode;
import com.treesketch.core.parser.IndentationParser;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link TreeFormatDispatcher}.
 */
class TreeFormatDispatcherTest {

    private TreeFormatDispatcher dispatcher;
    private TreeNode root;

    @BeforeEach
    void setUp() {
        dispatcher = new TreeFormatDispatcher();
        root = new IndentationParser().parse("app\n  src\n    index.js\n  package.json");
    }

    @Test
    void format_ascii_forcesAsciiCharset() {
        String result = dispatcher.format(root, "ascii", FormatOptions.defaults().withCharset(LineCharset.UTF8));

        assertThat(result).contains("|-- src").doesNotContain("├──");
    }

    @Test
    void format_utf8_forcesUtf8Charset() {
        String result = dispatcher.format(root, "utf8", FormatOptions.defaults().withCharset(LineCharset.ASCII));

        assertThat(result).contains("├── src").doesNotContain("|--");
    }

    @Test
    void format_utf8Alias_isAccepted() {
        assertThat(dispatcher.format(root, "utf-8", null))
            .isEqualTo(dispatcher.format(root, TreeFormat.UTF8, null));
    }

    @Test
    void format_passesOptionsToLineDrawing() {
        String result = dispatcher.format(root, "ascii", FormatOptions.defaults().withRootDot(false));

        assertThat(result).doesNotStartWith(".").startsWith("app");
    }

    @Test
    void format_unknownFormat_fallsBackToLineDrawingWithCallerOptions() {
        FormatOptions options = FormatOptions.defaults().withCharset(LineCharset.ASCII).withRootDot(false);

        String result = dispatcher.format(root, "unknown-format", options);

        assertThat(result).isEqualTo(new LineDrawingFormatter().format(root, options));
    }

    @Test
    void format_nullFormatId_fallsBackToDefaultTree() {
        assertThat(dispatcher.format(root, (String) null, null))
            .startsWith(".\n└── app");
    }

    @Test
    void format_structuredFormat_delegatesToSerializer() {
        assertThat(dispatcher.format(root, "yaml", null))
            .isEqualTo(new YamlFormatter().format(root, null));
    }

    @Test
    void format_formatIdIsCaseInsensitive() {
        assertThat(dispatcher.format(root, "JSON-Flat", null))
            .isEqualTo(dispatcher.format(root, TreeFormat.JSON_FLAT, null));
    }

    @ParameterizedTest
    @EnumSource(TreeFormat.class)
    void format_everyFormat_producesOutput(TreeFormat format) {
        assertThat(dispatcher.format(root, format.id(), FormatOptions.defaults())).contains("index.js");
    }

    @ParameterizedTest
    @EnumSource(TreeFormat.class)
    void format_withNullStructure_throwsException(TreeFormat format) {
        assertThatThrownBy(() -> dispatcher.format(null, format.id(), FormatOptions.defaults()))
            .isInstanceOf(NullPointerException.class)
            .hasMessage("Structure is required");
    }

    @Test
    void format_unknownFormatWithNullStructure_throwsException() {
        assertThatThrownBy(() -> dispatcher.format(null, "bogus", null))
            .isInstanceOf(NullPointerException.class)
            .hasMessage("Structure is required");
    }

    @Test
    void formatterFor_lineDrawingFormats_shareFormatter() {
        assertThat(dispatcher.formatterFor(TreeFormat.ASCII)).isSameAs(dispatcher.formatterFor(TreeFormat.UTF8));
        assertThat(dispatcher.formatterFor(TreeFormat.XML).getId()).isEqualTo("xml");
        assertThat(dispatcher.formatterFor(TreeFormat.JSON_NESTED).getFileExtension())
            .isEqualTo(TreeFormat.JSON_NESTED.fileExtension());
    }

    @ParameterizedTest
    @EnumSource(TreeFormat.class)
    void formatterFor_everyFormat_reportsKnownId(TreeFormat format) {
        String id = dispatcher.formatterFor(format).getId();

        assertThat(TreeFormat.fromId(id)).isPresent();
    }

    @ParameterizedTest
    @EnumSource(TreeFormat.class)
    void format_treeDeeperThanJsonDefaultLimit_rendersEveryFormat(TreeFormat format) {
        StringBuilder input = new StringBuilder();
        int depth = 1200;
        for (int i = 0; i < depth; i++) {
            input.append(" ".repeat(i)).append('n').append(i).append('\n');
        }
        TreeNode deep = new IndentationParser().parse(input.toString());

        String result = dispatcher.format(deep, format, FormatOptions.defaults());

        assertThat(result).contains("n" + (depth - 1));
    }
}
