package com.entity.sync.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for the structured documents carried by entities.
 * Payloads are maps of scalars, lists and nested maps; copies are immutable.
 */
public final class Payloads {

    private Payloads() {
    }

    /**
     * Returns an immutable deep copy. Null values are preserved.
     */
    public static Map<String, Object> deepCopy(Map<String, ?> source) {
        if (source == null) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, copyValue(value)));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Shallow merge: top-level keys of {@code partial} replace those of {@code base}.
     */
    public static Map<String, Object> shallowMerge(Map<String, ?> base, Map<String, ?> partial) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (base != null) {
            merged.putAll(base);
        }
        if (partial != null) {
            merged.putAll(partial);
        }
        return deepCopy(merged);
    }

    @SuppressWarnings("unchecked")
    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return deepCopy((Map<String, ?>) map);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> list = new ArrayList<>(collection.size());
            for (Object element : collection) {
                list.add(copyValue(element));
            }
            return Collections.unmodifiableList(list);
        }
        return value;
    }
}
