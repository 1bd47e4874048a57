package io.kneo.programmer.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deep, unmodifiable copies of map/list trees. Insertion order and null values are kept.
 */
public final class ImmutableTree {

    private ImmutableTree() {}

    public static Object copyOf(Object node) {
        if (node instanceof Map<?, ?> map) {
            return copyOfMap(map);
        }
        if (node instanceof Collection<?> items) {
            List<Object> copy = new ArrayList<>(items.size());
            items.forEach(item -> copy.add(copyOf(item)));
            return Collections.unmodifiableList(copy);
        }
        return node;
    }

    public static Map<String, Object> copyOfMap(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((key, value) -> copy.put(String.valueOf(key), copyOf(value)));
        return Collections.unmodifiableMap(copy);
    }
}
