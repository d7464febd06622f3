package org.cmmn.parser.models;

import java.util.List;
import java.util.Map;

/**
 * Vendor extension content: a scalar, a sequence of values or an ordered mapping.
 */
public sealed interface ExtensionValue permits ExtensionValue.Scalar, ExtensionValue.Sequence, ExtensionValue.Mapping {

    /**
     * @param value a String, Number, Boolean or null
     */
    record Scalar(Object value) implements ExtensionValue {
        public Scalar {
            if (value != null && !(value instanceof String) && !(value instanceof Number) && !(value instanceof Boolean)) {
                throw new IllegalArgumentException("Unsupported scalar type: " + value.getClass().getName());
            }
        }
    }

    record Sequence(List<ExtensionValue> values) implements ExtensionValue {
        public Sequence {
            values = ModelDefaults.list(values);
        }
    }

    record Mapping(Map<String, ExtensionValue> entries) implements ExtensionValue {
        public Mapping {
            entries = ModelDefaults.orderedMap(entries);
        }

        public ExtensionValue get(String key) {
            return entries.get(key);
        }
    }
}
