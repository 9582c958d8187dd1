package org.pragmatica.markdown.template;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed data recovered by parsing text against a compiled template.
 */
public sealed interface BoundValue {

    /**
     * A single slot: {@code value} is a {@code String}, {@code Long}, {@code Double},
     * {@code Boolean} or {@link DateTimeLiteral} depending on {@code type}.
     */
    record Variable(String name, String type, Object value) implements BoundValue {}

    /**
     * A clause, contract or with-block: named fields in template order.
     * Field values are raw variable values or nested {@code Compound}s.
     */
    record Compound(String name, String type, Map<String, Object> fields) implements BoundValue {
        public Compound {
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        public Object field(String fieldName) {
            return fields.get(fieldName);
        }
    }

    /**
     * Ordered values of a sequence of template nodes.
     */
    record Sequence(List<BoundValue> values) implements BoundValue {
        public Sequence {
            values = List.copyOf(values);
        }
    }

    /**
     * Field map of a value: compound fields, or the flattened entries of a sequence.
     */
    static Map<String, Object> fieldsOf(BoundValue value) {
        var fields = new LinkedHashMap<String, Object>();
        collectFields(value, fields);
        return fields;
    }

    private static void collectFields(BoundValue value, Map<String, Object> fields) {
        if (value instanceof Variable variable) {
            fields.put(variable.name(), variable.value());
        } else if (value instanceof Compound compound) {
            fields.put(compound.name(), compound);
        } else if (value instanceof Sequence sequence) {
            sequence.values()
                    .forEach(item -> collectFields(item, fields));
        }
    }
}
