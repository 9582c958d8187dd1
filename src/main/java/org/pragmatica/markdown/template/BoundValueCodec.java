package org.pragmatica.markdown.template;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.pragmatica.markdown.tree.DocumentNodeCodec;

import java.time.temporal.Temporal;
import java.util.Map;

/**
 * Writes bound values as JSON. Compounds become objects tagged with their type,
 * sequences become arrays, variables become {@code {name, type, value}} objects.
 */
public final class BoundValueCodec {

    private BoundValueCodec() {}

    public static JsonNode toJson(BoundValue value) {
        var mapper = DocumentNodeCodec.mapper();
        if (value instanceof BoundValue.Variable variable) {
            var json = mapper.createObjectNode();
            json.put("name", variable.name());
            json.put("type", variable.type());
            putValue(json, "value", variable.value());
            return json;
        }
        if (value instanceof BoundValue.Compound compound) {
            return compoundToJson(compound);
        }
        var array = mapper.createArrayNode();
        ((BoundValue.Sequence) value).values()
                                     .forEach(item -> array.add(toJson(item)));
        return array;
    }

    private static ObjectNode compoundToJson(BoundValue.Compound compound) {
        var json = DocumentNodeCodec.mapper()
                                    .createObjectNode();
        json.put(DocumentNodeCodec.CLASS_FIELD, compound.type());
        for (Map.Entry<String, Object> entry : compound.fields()
                                                       .entrySet()) {
            putValue(json, entry.getKey(), entry.getValue());
        }
        return json;
    }

    private static void putValue(ObjectNode json, String field, Object value) {
        if (value instanceof BoundValue.Compound nested) {
            json.set(field, compoundToJson(nested));
        } else if (value instanceof Long number) {
            json.put(field, number);
        } else if (value instanceof Double number) {
            json.put(field, number);
        } else if (value instanceof Boolean flag) {
            json.put(field, flag);
        } else if (value instanceof DateTimeLiteral || value instanceof Temporal) {
            json.put(field, DateTimeLiteral.format(value));
        } else if (value == null) {
            json.putNull(field);
        } else {
            json.put(field, value.toString());
        }
    }
}
