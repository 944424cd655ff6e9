package com.treesketch.cli;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link RenderCommand}.
 */
class RenderCommandTest {

    private static final String OUTLINE = "app\n  src\n    index.js\n  package.json\n";

    @TempDir
    Path tempDir;

    private Path outline;
    private Path noConfig;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws IOException {
        outline = tempDir.resolve("layout.txt");
        Files.writeString(outline, OUTLINE);
        noConfig = tempDir.resolve("missing.yaml");
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(RenderCommand command, String... args) {
        CommandLine commandLine = new CommandLine(command);
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    private int run(String... args) {
        return run(new RenderCommand(), args);
    }

    @Test
    void render_defaults_printsUtf8Tree() {
        int exitCode = run(outline.toString(), "--config", noConfig.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEqualTo(
            ".\n"
                + "└── app\n"
                + "    ├── src\n"
                + "    │   └── index.js\n"
                + "    └── package.json"
                + System.lineSeparator());
    }

    @Test
    void render_optionsFromFlags() {
        int exitCode = run(outline.toString(), "--config", noConfig.toString(),
            "-f", "ascii", "--no-root-dot", "--trailing-slash");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).startsWith("app/\n|-- src/\n");
    }

    @Test
    void render_readsStandardInput() {
        RenderCommand command = new RenderCommand(
            new ByteArrayInputStream(OUTLINE.getBytes(StandardCharsets.UTF_8)));

        int exitCode = run(command, "-", "--config", noConfig.toString(), "-f", "dot");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("app/src/index.js");
    }

    @Test
    void render_configSuppliesFormatAndOptions() throws IOException {
        Path config = tempDir.resolve("treesketch.yaml");
        Files.writeString(config, """
            format: markdown
            """);

        int exitCode = run(outline.toString(), "--config", config.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).startsWith("* app/\n  * src/\n");
    }

    @Test
    void render_flagsOverrideConfig() throws IOException {
        Path config = tempDir.resolve("treesketch.yaml");
        Files.writeString(config, """
            format: markdown
            options:
              charset: ascii
              rootDot: false
            """);

        int exitCode = run(outline.toString(), "--config", config.toString(), "-f", "utf8");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).startsWith("app\n├── src");
    }

    @Test
    void render_writesOutputFile() throws IOException {
        Path target = tempDir.resolve("out/tree.xml");

        int exitCode = run(outline.toString(), "--config", noConfig.toString(), "-f", "xml", "-o", target.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEmpty();
        assertThat(Files.readString(target))
            .startsWith("<?xml")
            .contains("<file name=\"index.js\" />");
    }

    @Test
    void render_badIndentation_exitsWithError() throws IOException {
        Files.writeString(outline, "app\n        deep.txt\n");

        int exitCode = run(outline.toString(), "--config", noConfig.toString());

        assertThat(exitCode).isEqualTo(RenderCommand.EXIT_INVALID_INPUT);
        assertThat(err.toString()).contains("Bad indentation found at item: deep.txt");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void render_emptyFile_exitsWithError() throws IOException {
        Files.writeString(outline, "");

        int exitCode = run(outline.toString(), "--config", noConfig.toString());

        assertThat(exitCode).isEqualTo(RenderCommand.EXIT_INVALID_INPUT);
        assertThat(err.toString()).contains("Input must be a non-empty string");
    }

    @Test
    void render_unknownCharset_exitsWithError() {
        int exitCode = run(outline.toString(), "--config", noConfig.toString(), "-c", "latin1");

        assertThat(exitCode).isEqualTo(RenderCommand.EXIT_INVALID_INPUT);
        assertThat(err.toString()).contains("Unknown charset: latin1");
    }

    @Test
    void render_missingInputFile_exitsWithIoError() {
        int exitCode = run(tempDir.resolve("nope.txt").toString(), "--config", noConfig.toString());

        assertThat(exitCode).isEqualTo(RenderCommand.EXIT_IO_ERROR);
        assertThat(err.toString()).contains("cannot read");
    }

    @Test
    void render_unknownFormat_fallsBackToTree() {
        int exitCode = run(outline.toString(), "--config", noConfig.toString(), "-f", "toml");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).startsWith(".\n└── app");
    }
}
