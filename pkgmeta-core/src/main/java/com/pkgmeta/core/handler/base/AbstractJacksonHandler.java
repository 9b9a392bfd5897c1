package com.pkgmeta.core.handler.base;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Abstract base class for handlers that parse TOML or JSON descriptors using Jackson.
 *
 * <p>This class provides pre-configured Jackson mappers and utility methods for:
 * <ul>
 *   <li>TOML parsing via TomlMapper (Pipfile, pyproject.toml)</li>
 *   <li>JSON parsing via ObjectMapper (Pipfile.lock)</li>
 *   <li>JsonNode navigation and value extraction</li>
 * </ul>
 *
 * <p>Syntax errors surface as Jackson's {@code JsonProcessingException}, an
 * {@link IOException}, so a malformed file produces no record.
 *
 * @see AbstractDescriptorHandler
 */
public abstract class AbstractJacksonHandler extends AbstractDescriptorHandler {

    /**
     * TOML mapper for parsing TOML files.
     * Thread-safe and reusable across parse operations.
     */
    protected final TomlMapper tomlMapper;

    /**
     * JSON mapper for parsing JSON files.
     * Thread-safe and reusable across parse operations.
     */
    protected final ObjectMapper objectMapper;

    /**
     * Constructor that initializes both TOML and JSON mappers.
     */
    protected AbstractJacksonHandler() {
        super();
        this.tomlMapper = new TomlMapper();
        this.objectMapper = new ObjectMapper();
    }

    // ==================== Parsing ====================

    /**
     * Parses a TOML file into a JsonNode tree.
     *
     * @param file path to TOML file
     * @return root JsonNode of parsed TOML
     * @throws IOException if file cannot be read or parsed
     */
    protected JsonNode parseToml(Path file) throws IOException {
        return tomlMapper.readTree(readFileContent(file));
    }

    /**
     * Parses a JSON file into a JsonNode tree.
     *
     * @param file path to JSON file
     * @return root JsonNode of parsed JSON
     * @throws IOException if file cannot be read or parsed
     */
    protected JsonNode parseJson(Path file) throws IOException {
        return objectMapper.readTree(readFileContent(file));
    }

    // ==================== JsonNode Navigation Utilities ====================

    /**
     * Extracts a text value from a child node.
     *
     * @param node parent JsonNode
     * @param childName child name
     * @return text of a scalar child, or null if absent or not a value
     */
    protected String extractText(JsonNode node, String childName) {
        if (node == null) {
            return null;
        }
        JsonNode child = node.get(childName);
        if (child == null || !child.isValueNode() || child.isNull()) {
            return null;
        }
        return child.asText();
    }

    /**
     * Navigates a path of object fields.
     *
     * @param node starting node
     * @param names field names
     * @return node at the end of the path, or null if any step is missing
     */
    protected JsonNode path(JsonNode node, String... names) {
        JsonNode current = node;
        for (String name : names) {
            if (current == null || !current.isObject()) {
                return null;
            }
            current = current.get(name);
        }
        return current;
    }

    /**
     * Reads an array of strings; a single string is treated as a one-element list.
     *
     * @param node array or text node, may be null
     * @return text values in order
     */
    protected List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null) {
            return values;
        }
        if (node.isTextual()) {
            values.add(node.asText());
        } else if (node.isArray()) {
            for (JsonNode element : node) {
                if (element.isTextual()) {
                    values.add(element.asText());
                }
            }
        }
        return values;
    }
}
