package com.treesketch.core.generator.impl;

import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.treesketch.core.generator.FormatOptions;
import com.treesketch.core.generator.TreeFormatter;
import com.treesketch.core.model.TreeNode;

/**
 * Renders the nested JSON projection as block-style YAML under a {@code root} key.
 *
 * <pre>
 * root:
 *   app:
 *     index.js: null
 * </pre>
 *
 * <p>Keys are written verbatim: no quoting, escaping or flow style. Every line, the last
 * one included, ends with a newline.
 */
public class YamlFormatter implements TreeFormatter {

    private static final String ROOT_KEY = "root";
    private static final int INDENT_STEP = 2;

    private final NestedJsonFormatter nestedJson = new NestedJsonFormatter();

    @Override
    public String getId() {
        return "yaml";
    }

    @Override
    public String getDisplayName() {
        return "YAML";
    }

    @Override
    public String getFileExtension() {
        return "yaml";
    }

    @Override
    public String format(TreeNode root, FormatOptions options) {
        Objects.requireNonNull(root, "Structure is required");

        ObjectNode nested = nestedJson.toJson(root, options);
        ObjectNode rekeyed = JsonSupport.objectNode();
        rekeyed.set(ROOT_KEY, nested.elements().next());

        StringBuilder yaml = new StringBuilder();
        appendObject(yaml, rekeyed, 0);
        return yaml.toString();
    }

    private void appendObject(StringBuilder yaml, JsonNode object, int indent) {
        String spaces = " ".repeat(indent);
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isNull()) {
                yaml.append(spaces).append(field.getKey()).append(": null\n");
            } else {
                yaml.append(spaces).append(field.getKey()).append(":\n");
                appendObject(yaml, field.getValue(), indent + INDENT_STEP);
            }
        }
    }
}
