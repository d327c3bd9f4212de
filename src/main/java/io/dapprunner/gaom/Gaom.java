package io.dapprunner.gaom;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.io.JsonStringEncoder;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Path queries and {@code ${path}} interpolation over the application object model.
 */
public final class Gaom {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]*)}");

    private Gaom() {}

    /**
     * Resolves {@code query} against {@code root}. Objects and collections are returned as deep copies
     * made of plain maps and lists.
     */
    public static Object lookup(Object root, String query, boolean isRuntime) {
        var path = GaomPath.parse(query);
        var walked = new StringBuilder();
        Object current = root;
        for (var component : path.components()) {
            if (walked.length() > 0) {
                walked.append('.');
            }
            walked.append(component.key());
            current = field(current, component.key(), walked, isRuntime);
            for (var index : component.indexes()) {
                walked.append('[').append(index).append(']');
                current = element(current, index, walked);
            }
        }
        return toPlain(current);
    }

    /**
     * Replaces every {@code ${path}} found in the string values of {@code doc} with the value it resolves to.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> interpolate(Map<String, Object> doc, Object root, boolean isRuntime) {
        return (Map<String, Object>) interpolateValue(doc, root, isRuntime);
    }

    public static Object interpolateValue(Object doc, Object root, boolean isRuntime) {
        try {
            var serialized = JSON.writeValueAsString(toPlain(doc));
            if (!serialized.contains("${")) {
                return JSON.readValue(serialized, Object.class);
            }
            var matcher = PLACEHOLDER.matcher(serialized);
            var result = new StringBuilder();
            while (matcher.find()) {
                var value = lookup(root, matcher.group(1), isRuntime);
                var escaped = new String(JsonStringEncoder.getInstance().quoteAsString(stringify(value)));
                matcher.appendReplacement(result, Matcher.quoteReplacement(escaped));
            }
            matcher.appendTail(result);
            return JSON.readValue(result.toString(), Object.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to interpolate document: " + ex.getOriginalMessage(), ex);
        }
    }

    /**
     * Converts model objects into nested {@link LinkedHashMap}s and {@link ArrayList}s. Null fields are omitted.
     */
    public static Object toPlain(Object value) {
        if (value instanceof GaomObject object) {
            var map = new LinkedHashMap<String, Object>();
            for (var field : object.gaomFields()) {
                if (field.value() != null) {
                    map.put(field.name(), toPlain(field.value()));
                }
            }
            return map;
        }
        if (value instanceof Map<?, ?> source) {
            var map = new LinkedHashMap<String, Object>();
            source.forEach((key, item) -> map.put(String.valueOf(key), toPlain(item)));
            return map;
        }
        if (value instanceof List<?> source) {
            var list = new ArrayList<Object>(source.size());
            source.forEach(item -> list.add(toPlain(item)));
            return list;
        }
        if (value instanceof Enum<?> constant) {
            return constant.toString();
        }
        return value;
    }

    private static Object field(Object current, String key, CharSequence walked, boolean isRuntime) {
        if (current instanceof GaomObject object) {
            for (var field : object.gaomFields()) {
                if (!field.name().equals(key)) {
                    continue;
                }
                if (field.runtimeOnly() && !isRuntime) {
                    throw new GaomRuntimeLookupException("`" + walked + "` is only available at runtime.");
                }
                return field.value();
            }
            throw cannotRetrieve(walked);
        }
        if (current instanceof Map<?, ?> map && map.containsKey(key)) {
            return map.get(key);
        }
        throw cannotRetrieve(walked);
    }

    private static Object element(Object current, int index, CharSequence walked) {
        if (current instanceof List<?> list && index < list.size()) {
            return list.get(index);
        }
        throw cannotRetrieve(walked);
    }

    private static String stringify(Object value) throws JsonProcessingException {
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            return JSON.writeValueAsString(value);
        }
        return String.valueOf(value);
    }

    private static GaomLookupException cannotRetrieve(CharSequence walked) {
        return new GaomLookupException("Cannot retrieve `" + walked + "`.");
    }
}
