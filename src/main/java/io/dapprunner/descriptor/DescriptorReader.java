package io.dapprunner.descriptor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads YAML descriptor documents into plain trees and deep-merges them in order.
 */
public final class DescriptorReader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(
        new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
    );

    private DescriptorReader() {}

    /**
     * Reads every file and merges them; later files extend or override earlier ones.
     */
    public static Map<String, Object> readAll(List<Path> paths) {
        Map<String, Object> merged = new LinkedHashMap<>();
        for (var path : paths) {
            merged = merge(merged, read(path));
        }
        return merged;
    }

    public static Map<String, Object> read(Path path) {
        try (var in = Files.newInputStream(path)) {
            return parse(in, path.toString());
        } catch (IOException ex) {
            throw new DescriptorException("Failed to read descriptor: " + path + " (" + ex.getMessage() + ")", ex);
        }
    }

    public static Map<String, Object> parse(InputStream in, String origin) throws IOException {
        var root = YAML_MAPPER.readTree(in);
        if (root == null || root.isNull() || root.isMissingNode()) {
            return new LinkedHashMap<>();
        }
        if (!root.isObject()) {
            throw new DescriptorValidationException("Descriptor must be a mapping: " + origin);
        }
        @SuppressWarnings("unchecked")
        var tree = (Map<String, Object>) convertNode(root);
        return tree;
    }

    /**
     * Deep merge: mappings are merged key-wise, lists are concatenated, anything else is replaced by the right side.
     */
    public static Map<String, Object> merge(Map<String, Object> left, Map<String, Object> right) {
        var result = new LinkedHashMap<String, Object>(left);
        for (var entry : right.entrySet()) {
            Object leftValue = result.get(entry.getKey());
            Object rightValue = entry.getValue();
            if (leftValue instanceof Map && rightValue instanceof Map) {
                @SuppressWarnings("unchecked")
                var merged = merge((Map<String, Object>) leftValue, (Map<String, Object>) rightValue);
                result.put(entry.getKey(), merged);
                continue;
            }
            if (leftValue instanceof List && rightValue instanceof List) {
                var list = new ArrayList<Object>((List<?>) leftValue);
                list.addAll((List<?>) rightValue);
                result.put(entry.getKey(), list);
                continue;
            }
            result.put(entry.getKey(), rightValue);
        }
        return result;
    }

    public static String toYaml(Map<String, Object> tree) {
        try {
            return YAML_MAPPER.writeValueAsString(tree);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize descriptor: " + ex.getOriginalMessage(), ex);
        }
    }

    private static Object convertNode(JsonNode node) {
        if (node.isObject()) {
            var map = new LinkedHashMap<String, Object>();
            var fields = node.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                map.put(entry.getKey(), convertNode(entry.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>();
            for (var item : node) {
                list.add(convertNode(item));
            }
            return list;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNull()) {
            return null;
        }
        return node.asText();
    }
}
