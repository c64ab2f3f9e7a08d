package com.tether.plugin;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * JSON codec for plugin definitions. Accepts either a JSON array of definitions or an object with
 * a {@code plugins} array. Unknown properties are ignored.
 */
public final class PluginDefinitions {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private static final TypeReference<List<PluginDefinition>> LIST_TYPE = new TypeReference<>() {};

    private PluginDefinitions() {
    }

    /**
     * Parses definitions from JSON.
     *
     * @throws UncheckedIOException on malformed JSON or an unexpected root shape
     */
    public static List<PluginDefinition> fromJson(String json) {
        try {
            JsonNode root = MAPPER.readTree(json);
            if (root == null || root.isMissingNode() || root.isNull()) {
                return List.of();
            }
            JsonNode array = root.isObject() ? root.get("plugins") : root;
            if (array == null || array.isNull()) {
                return List.of();
            }
            if (!array.isArray()) {
                throw new IOException("Expected a JSON array of plugin definitions or {\"plugins\": [...]}");
            }
            List<PluginDefinition> defs = MAPPER.convertValue(array, LIST_TYPE);
            return List.copyOf(defs);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (IllegalArgumentException e) {
            throw new UncheckedIOException(new IOException(e.getMessage(), e));
        }
    }

    /**
     * Reads definitions from a file. A missing file yields an empty list.
     *
     * @throws UncheckedIOException when the file exists but cannot be read or parsed
     */
    public static List<PluginDefinition> readFile(Path file) {
        if (!Files.isRegularFile(file)) {
            return List.of();
        }
        try {
            return fromJson(Files.readString(file));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Serializes definitions as a JSON array (nulls excluded). */
    public static String toJson(List<PluginDefinition> definitions) {
        try {
            return MAPPER.writeValueAsString(definitions);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }
}
