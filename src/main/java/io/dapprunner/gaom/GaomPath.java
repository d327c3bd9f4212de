package io.dapprunner.gaom;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parsed query path: {@code key(.key|[index])*}. The empty query addresses the root.
 */
public record GaomPath(List<Component> components) {
    private static final Pattern QUERY = Pattern.compile("^(\\w+(\\[\\d+])*)(\\.\\w+(\\[\\d+])*)*$");
    private static final Pattern PART = Pattern.compile("(\\w+)|\\[(\\d+)]");

    public GaomPath {
        components = List.copyOf(components);
    }

    public static GaomPath parse(String query) {
        if (query == null || query.isEmpty()) {
            return new GaomPath(List.of());
        }
        if (!QUERY.matcher(query).matches()) {
            throw new IllegalArgumentException("Malformed query: `" + query + "`");
        }
        var components = new ArrayList<Component>();
        String key = null;
        var indexes = new ArrayList<Integer>();
        var matcher = PART.matcher(query);
        while (matcher.find()) {
            if (matcher.group(1) != null) {
                if (key != null) {
                    components.add(new Component(key, indexes));
                    indexes = new ArrayList<>();
                }
                key = matcher.group(1);
            } else {
                indexes.add(index(query, matcher.group(2)));
            }
        }
        components.add(new Component(key, indexes));
        return new GaomPath(components);
    }

    private static int index(String query, String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException ex) {
            // no list holds that many elements
            throw new GaomLookupException("Index " + digits + " out of range in `" + query + "`.");
        }
    }

    public boolean isRoot() {
        return components.isEmpty();
    }

    /**
     * A key followed by zero or more positional indexes, e.g. {@code init[0]}.
     */
    public record Component(String key, List<Integer> indexes) {
        public Component {
            indexes = List.copyOf(indexes);
        }

        @Override
        public String toString() {
            var text = new StringBuilder(key);
            indexes.forEach(index -> text.append('[').append(index).append(']'));
            return text.toString();
        }
    }
}
