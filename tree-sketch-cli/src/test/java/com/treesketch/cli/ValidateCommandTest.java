package com.treesketch.cli;

import java.io.ByteArrayInputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ValidateCommand}.
 */
class ValidateCommandTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int validate(String outline) {
        ValidateCommand command = new ValidateCommand(
            new ByteArrayInputStream(outline.getBytes(StandardCharsets.UTF_8)));
        CommandLine commandLine = new CommandLine(command);
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute();
    }

    @Test
    void validate_validOutline_printsSummary() {
        int exitCode = validate("app\n  src\n    index.js\n  package.json\nREADME.md");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Valid outline: 5 entries (2 directories, 3 files), max depth 3");
    }

    @Test
    void validate_blankOutline_hasNoEntries() {
        int exitCode = validate("  \n");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("0 entries");
    }

    @Test
    void validate_badIndentation_reportsItem() {
        int exitCode = validate("app\n     lib");

        assertThat(exitCode).isEqualTo(RenderCommand.EXIT_INVALID_INPUT);
        assertThat(err.toString()).contains("Bad indentation found at item: lib");
    }
}
