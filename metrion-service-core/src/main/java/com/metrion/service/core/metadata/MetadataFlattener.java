package com.metrion.service.core.metadata;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Flattens nested resource metadata into dotted keys with string values, the shape metadata
 * filters address ({@code metadata.image.name}). Collection values cannot be addressed that way
 * and are dropped, as are null values.
 */
public final class MetadataFlattener {

    public static final char SEPARATOR = '.';

    private MetadataFlattener() {}

    public static Map<String, String> flatten(Map<String, ?> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Map.of();
        }
        Map<String, String> out = new TreeMap<>();
        walk("", metadata, out);
        return Collections.unmodifiableMap(out);
    }

    private static void walk(String prefix, Map<?, ?> node, Map<String, String> out) {
        for (Map.Entry<?, ?> e : node.entrySet()) {
            String key = prefix.isEmpty() ? String.valueOf(e.getKey()) : prefix + SEPARATOR + e.getKey();
            Object value = e.getValue();
            if (value instanceof Map<?, ?> nested) {
                walk(key, nested, out);
            } else if (value != null && !isCollection(value)) {
                out.put(key, String.valueOf(value));
            }
        }
    }

    private static boolean isCollection(Object value) {
        return value instanceof Collection<?> || (value != null && value.getClass().isArray());
    }
}
