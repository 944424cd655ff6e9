package com.treesketch.cli;

import java.io.PrintWriter;
import java.io.StringWriter;

import org.junit.jupiter.api.Test;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ListCommand}.
 */
class ListCommandTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int list(String... args) {
        CommandLine commandLine = new CommandLine(new ListCommand());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    @Test
    void list_default_showsAllFormats() {
        assertThat(list()).isZero();
        assertThat(out.toString())
            .contains("Available Formats:")
            .contains("(ID: json-nested)")
            .contains("(ID: markdown)")
            .contains("File Extension: .yaml");
    }

    @Test
    void list_charsets_showsGlyphs() {
        assertThat(list("charsets")).isZero();
        assertThat(out.toString()).contains("ascii: |--`--").contains("utf8: ├──└──");
    }

    @Test
    void list_unknownType_fails() {
        assertThat(list("plugins")).isEqualTo(1);
        assertThat(err.toString()).contains("Unknown type: plugins");
    }
}
