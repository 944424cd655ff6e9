package com.treesketch.cli;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads outline text from a file or, when no file (or {@code -}) is given, from a stream.
 */
final class OutlineInput {

    private static final String STDIN_MARKER = "-";

    private OutlineInput() {
    }

    static String read(Path file, InputStream stdin) throws IOException {
        if (file == null || STDIN_MARKER.equals(file.toString())) {
            return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
        }
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    static String describe(Path file) {
        return file == null || STDIN_MARKER.equals(file.toString()) ? "<stdin>" : file.toString();
    }
}
