package org.cmmn.parser.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Null-to-empty normalisation shared by the record compact constructors.
 */
final class ModelDefaults {

    private ModelDefaults() {
    }

    static <T> List<T> list(List<T> values) {
        return values == null ? List.of() : List.copyOf(values);
    }

    // keeps insertion order, which Map.copyOf would not
    static <K, V> Map<K, V> orderedMap(Map<K, V> values) {
        if (values == null || values.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    static void requireOneOf(CmmnElementType actual, String recordName, CmmnElementType... allowed) {
        for (CmmnElementType type : allowed) {
            if (type == actual) {
                return;
            }
        }
        throw new IllegalArgumentException(recordName + " cannot carry element type " + actual);
    }
}
