package org.pragmatica.markdown.template;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.pragmatica.markdown.error.MarkdownException;
import org.pragmatica.markdown.error.TransformError;
import org.pragmatica.markdown.template.TemplateNode.*;
import org.pragmatica.markdown.tree.DocumentNodeCodec;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of template grammars, discriminated by {@code $class} in the
 * {@code org.accordproject.ciceromark.template} namespace.
 *
 * <p>Unknown tags decode to {@link Unrecognized}; compiling such a grammar fails.
 */
public final class TemplateNodeCodec {
    public static final String TEMPLATE_NS = "org.accordproject.ciceromark.template.";

    private TemplateNodeCodec() {}

    public static TemplateNode fromJson(String json) {
        try {
            return fromJson(DocumentNodeCodec.mapper()
                                             .readTree(json));
        } catch (JsonProcessingException e) {
            throw new MarkdownException(new TransformError.InvalidJson(e.getOriginalMessage()), e);
        }
    }

    public static TemplateNode fromJson(JsonNode json) {
        if (json == null || !json.isObject()) {
            throw new TransformError.InvalidJson("expected an object").toException();
        }
        var qualified = json.path(DocumentNodeCodec.CLASS_FIELD)
                            .asText("");
        if (qualified.isEmpty()) {
            throw new TransformError.InvalidJson("missing " + DocumentNodeCodec.CLASS_FIELD).toException();
        }
        var tag = qualified.substring(qualified.lastIndexOf('.') + 1);

        return switch (tag) {
            case "TextChunk" -> new TextChunk(text(json, "value"));
            case "Variable" -> new Variable(text(json, "name"), text(json, "type"), strings(json, "enumValues"));
            case "ConditionalBlock" -> new ConditionalBlock(text(json, "name"),
                                                            text(json, "whenTrue"),
                                                            text(json, "whenFalse"));
            case "UnorderedListBlock" -> new UnorderedListBlock(children(json));
            case "ClauseBlock" -> new ClauseBlock(text(json, "name"), text(json, "type"), children(json));
            case "WithBlock" -> new WithBlock(text(json, "name"), text(json, "type"), children(json));
            case "ContractBlock" -> new ContractBlock(text(json, "name"), text(json, "type"), children(json));
            default -> new Unrecognized(qualified);
        };
    }

    /**
     * Decode a JSON array of grammar nodes, the form of a bare sequence.
     */
    public static List<TemplateNode> listFromJson(String json) {
        try {
            var array = DocumentNodeCodec.mapper()
                                         .readTree(json);
            if (!array.isArray()) {
                throw new TransformError.InvalidJson("expected an array").toException();
            }
            var result = new ArrayList<TemplateNode>();
            array.forEach(node -> result.add(fromJson(node)));
            return result;
        } catch (JsonProcessingException e) {
            throw new MarkdownException(new TransformError.InvalidJson(e.getOriginalMessage()), e);
        }
    }

    private static List<TemplateNode> children(JsonNode json) {
        var result = new ArrayList<TemplateNode>();
        json.path("nodes")
            .forEach(child -> result.add(fromJson(child)));
        return result;
    }

    private static String text(JsonNode json, String field) {
        return json.path(field)
                   .asText("");
    }

    private static List<String> strings(JsonNode json, String field) {
        var result = new ArrayList<String>();
        json.path(field)
            .forEach(value -> result.add(value.asText()));
        return result;
    }

    // === Encoding ===

    public static ObjectNode toJson(TemplateNode node) {
        var json = DocumentNodeCodec.mapper()
                                    .createObjectNode();
        if (node instanceof Unrecognized unrecognized) {
            json.put(DocumentNodeCodec.CLASS_FIELD, unrecognized.tag());
            return json;
        }
        json.put(DocumentNodeCodec.CLASS_FIELD, TEMPLATE_NS + node.tag());

        if (node instanceof TextChunk chunk) {
            json.put("value", chunk.value());
        } else if (node instanceof Variable variable) {
            json.put("name", variable.name());
            json.put("type", variable.type());
            if (!variable.enumValues().isEmpty()) {
                var values = json.putArray("enumValues");
                variable.enumValues()
                        .forEach(values::add);
            }
        } else if (node instanceof ConditionalBlock conditional) {
            json.put("name", conditional.name());
            json.put("whenTrue", conditional.whenTrue());
            json.put("whenFalse", conditional.whenFalse());
        } else if (node instanceof UnorderedListBlock list) {
            json.set("nodes", toJsonArray(list.nodes()));
        } else if (node instanceof ClauseBlock clause) {
            json.put("name", clause.name());
            json.put("type", clause.type());
            json.set("nodes", toJsonArray(clause.nodes()));
        } else if (node instanceof WithBlock with) {
            json.put("name", with.name());
            json.put("type", with.type());
            json.set("nodes", toJsonArray(with.nodes()));
        } else if (node instanceof ContractBlock contract) {
            json.put("name", contract.name());
            json.put("type", contract.type());
            json.set("nodes", toJsonArray(contract.nodes()));
        }
        return json;
    }

    private static ArrayNode toJsonArray(List<TemplateNode> nodes) {
        var array = DocumentNodeCodec.mapper()
                                     .createArrayNode();
        nodes.forEach(child -> array.add(toJson(child)));
        return array;
    }
}
