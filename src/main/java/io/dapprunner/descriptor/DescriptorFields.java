package io.dapprunner.descriptor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Typed view over one mapping of a descriptor tree. Rejects keys the owning entity does not declare.
 */
final class DescriptorFields {
    private final String owner;
    private final Map<String, Object> tree;

    private DescriptorFields(String owner, Map<String, Object> tree) {
        this.owner = owner;
        this.tree = tree;
    }

    static DescriptorFields of(String owner, Object value, Set<String> allowed) {
        var tree = mapping(owner, value);
        var unexpected = new TreeSet<String>();
        for (var key : tree.keySet()) {
            if (!allowed.contains(key)) {
                unexpected.add(key);
            }
        }
        if (!unexpected.isEmpty()) {
            throw new DescriptorValidationException("Unexpected keys: `" + unexpected + "` for `" + owner + "`");
        }
        return new DescriptorFields(owner, tree);
    }

    static Map<String, Object> mapping(String owner, Object value) {
        if (value == null) {
            return new LinkedHashMap<>();
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new DescriptorValidationException("`" + owner + "` must be a mapping");
        }
        var copy = new LinkedHashMap<String, Object>();
        map.forEach((key, item) -> copy.put(String.valueOf(key), item));
        return copy;
    }

    String owner() {
        return owner;
    }

    String child(String key) {
        return owner + "." + key;
    }

    boolean has(String key) {
        return tree.get(key) != null;
    }

    Object raw(String key) {
        return tree.get(key);
    }

    String requireString(String key) {
        var value = optionalString(key);
        if (value == null) {
            throw new DescriptorValidationException("Missing key `" + key + "` for `" + owner + "`");
        }
        return value;
    }

    String optionalString(String key) {
        var value = tree.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            throw new DescriptorValidationException("`" + child(key) + "` must be a scalar value");
        }
        return String.valueOf(value);
    }

    Map<String, Object> optionalMap(String key) {
        return mapping(child(key), tree.get(key));
    }

    List<Object> optionalList(String key) {
        var value = tree.get(key);
        if (value == null) {
            return new ArrayList<>();
        }
        if (!(value instanceof List<?> list)) {
            throw new DescriptorValidationException("`" + child(key) + "` must be a list");
        }
        return new ArrayList<>(list);
    }

    List<String> stringList(String key) {
        var strings = new ArrayList<String>();
        for (var item : optionalList(key)) {
            if (item == null || item instanceof Map<?, ?> || item instanceof List<?>) {
                throw new DescriptorValidationException("`" + child(key) + "` must be a list of strings");
            }
            strings.add(String.valueOf(item));
        }
        return strings;
    }

    /**
     * Reads a list that may also be written as a single scalar, e.g. {@code ip: 192.168.0.2}.
     */
    List<String> stringOrList(String key) {
        var value = tree.get(key);
        if (value != null && !(value instanceof List<?>)) {
            return new ArrayList<>(List.of(requireString(key)));
        }
        return stringList(key);
    }
}
