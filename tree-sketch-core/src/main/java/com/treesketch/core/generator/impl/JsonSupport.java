package com.treesketch.core.generator.impl;

import java.io.IOException;
import java.io.UncheckedIOException;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Shared Jackson plumbing for the JSON formatters.
 *
 * <p>Output uses two-space indentation, {@code "key": value} spacing, one array element per
 * line and {@code {}} / {@code []} for empty containers, with {@code \n} line breaks on
 * every platform.
 *
 * <p>Nesting depth is unbounded: parsed outlines may be far deeper than Jackson's default
 * write limit of 1000 levels.
 */
final class JsonSupport {

    private static final ObjectMapper MAPPER = new ObjectMapper(JsonFactory.builder()
        .streamWriteConstraints(StreamWriteConstraints.builder()
            .maxNestingDepth(Integer.MAX_VALUE)
            .build())
        .build());
    private static final ObjectWriter WRITER = MAPPER.writer(new TwoSpacePrettyPrinter());

    private JsonSupport() {
    }

    static ObjectNode objectNode() {
        return MAPPER.createObjectNode();
    }

    static String write(JsonNode node) {
        try {
            return WRITER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize tree to JSON", e);
        }
    }

    private static final class TwoSpacePrettyPrinter extends DefaultPrettyPrinter {

        private static final DefaultIndenter INDENTER = new DefaultIndenter("  ", "\n");

        TwoSpacePrettyPrinter() {
            _objectIndenter = INDENTER;
            _arrayIndenter = INDENTER;
        }

        @Override
        public DefaultPrettyPrinter createInstance() {
            return new TwoSpacePrettyPrinter();
        }

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(": ");
        }

        @Override
        public void writeEndObject(JsonGenerator g, int nrOfEntries) throws IOException {
            if (!_objectIndenter.isInline()) {
                --_nesting;
            }
            if (nrOfEntries > 0) {
                _objectIndenter.writeIndentation(g, _nesting);
            }
            g.writeRaw('}');
        }

        @Override
        public void writeEndArray(JsonGenerator g, int nrOfValues) throws IOException {
            if (!_arrayIndenter.isInline()) {
                --_nesting;
            }
            if (nrOfValues > 0) {
                _arrayIndenter.writeIndentation(g, _nesting);
            }
            g.writeRaw(']');
        }
    }
}
