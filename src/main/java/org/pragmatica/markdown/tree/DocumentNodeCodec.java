package org.pragmatica.markdown.tree;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.pragmatica.markdown.error.MarkdownException;
import org.pragmatica.markdown.error.TransformError;
import org.pragmatica.markdown.tree.DocumentNode.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * JSON form of document trees: nested objects discriminated by {@code $class}.
 *
 * <p>Tags outside the catalog are decoded into {@link Opaque} nodes carrying the full
 * {@code $class}, so they survive a decode/encode cycle but are rejected by visitors.
 */
public final class DocumentNodeCodec {
    public static final String CLASS_FIELD = "$class";
    public static final String COMMONMARK_NS = "org.accordproject.commonmark.";
    public static final String CICEROMARK_NS = "org.accordproject.ciceromark.";

    private static final Set<String> CICEROMARK_TAGS = Set.of(
        "Clause", "Contract", "Conditional", "WithBlock", "ListBlock",
        "Variable", "FormattedVariable", "EnumVariable", "Formula");

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private DocumentNodeCodec() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Qualified {@code $class} value for a node.
     */
    public static String qualifiedClass(DocumentNode node) {
        if (node instanceof Opaque) {
            return node.tag();
        }
        return (CICEROMARK_TAGS.contains(node.tag())
                ? CICEROMARK_NS
                : COMMONMARK_NS) + node.tag();
    }

    // === Decoding ===

    public static DocumentNode fromJson(String json) {
        try {
            return fromJson(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new MarkdownException(new TransformError.InvalidJson(e.getOriginalMessage()), e);
        }
    }

    public static DocumentNode fromJson(JsonNode json) {
        if (json == null || !json.isObject()) {
            throw new TransformError.InvalidJson("expected an object").toException();
        }
        var qualified = json.path(CLASS_FIELD)
                            .asText("");
        if (qualified.isEmpty()) {
            throw new TransformError.InvalidJson("missing " + CLASS_FIELD).toException();
        }
        var tag = qualified.substring(qualified.lastIndexOf('.') + 1);

        return switch (tag) {
            case "Document" -> new Document(children(json, "nodes"));
            case "Paragraph" -> new Paragraph(children(json, "nodes"));
            case "Heading" -> new Heading(text(json, "level"), children(json, "nodes"));
            case "List" -> new ListNode(text(json, "type"), text(json, "start"), flag(json, "tight"), children(json, "nodes"));
            case "ListBlock" -> new ListBlock(text(json, "name"),
                                              text(json, "type"),
                                              text(json, "start"),
                                              flag(json, "tight"),
                                              children(json, "nodes"));
            case "Item" -> new Item(children(json, "nodes"));
            case "BlockQuote" -> new BlockQuote(children(json, "nodes"));
            case "CodeBlock" -> new CodeBlock(text(json, "info"), text(json, "text"));
            case "HtmlBlock" -> new HtmlBlock(text(json, "text"));
            case "ThematicBreak" -> new ThematicBreak();
            case "Text" -> new Text(text(json, "text"));
            case "Emph" -> new Emph(children(json, "nodes"));
            case "Strong" -> new Strong(children(json, "nodes"));
            case "Code" -> new Code(text(json, "text"));
            case "HtmlInline" -> new HtmlInline(text(json, "text"));
            case "Link" -> new Link(text(json, "destination"), text(json, "title"), children(json, "nodes"));
            case "Image" -> new Image(text(json, "destination"), text(json, "title"), children(json, "nodes"));
            case "Linebreak" -> new Linebreak();
            case "Softbreak" -> new Softbreak();
            case "Clause" -> new Clause(text(json, "name"), text(json, "src"), children(json, "nodes"));
            case "Contract" -> new Contract(text(json, "name"), text(json, "src"), children(json, "nodes"));
            case "Conditional" -> new Conditional(text(json, "name"),
                                                  flag(json, "isTrue"),
                                                  children(json, "whenTrue"),
                                                  children(json, "whenFalse"),
                                                  children(json, "nodes"));
            case "WithBlock" -> new WithBlock(text(json, "name"), children(json, "nodes"));
            case "Variable" -> new Variable(text(json, "name"),
                                            text(json, "value"),
                                            text(json, "elementType"),
                                            flag(json, "identifiedBy"));
            case "FormattedVariable" -> new FormattedVariable(text(json, "name"),
                                                              text(json, "value"),
                                                              text(json, "elementType"),
                                                              flag(json, "identifiedBy"),
                                                              text(json, "format"));
            case "EnumVariable" -> new EnumVariable(text(json, "name"),
                                                    text(json, "value"),
                                                    text(json, "elementType"),
                                                    flag(json, "identifiedBy"),
                                                    strings(json, "enumValues"));
            case "Formula" -> new Formula(text(json, "name"),
                                          text(json, "value"),
                                          text(json, "elementType"),
                                          flag(json, "identifiedBy"),
                                          text(json, "code"));
            default -> new Opaque(qualified, children(json, "nodes"));
        };
    }

    private static List<DocumentNode> children(JsonNode json, String field) {
        var array = json.path(field);
        var result = new ArrayList<DocumentNode>();
        for (var child : array) {
            result.add(fromJson(child));
        }
        return result;
    }

    private static String text(JsonNode json, String field) {
        return json.path(field)
                   .asText("");
    }

    private static boolean flag(JsonNode json, String field) {
        return json.path(field)
                   .asBoolean(false);
    }

    private static List<String> strings(JsonNode json, String field) {
        var result = new ArrayList<String>();
        json.path(field)
            .forEach(value -> result.add(value.asText()));
        return result;
    }

    // === Encoding ===

    public static String toJsonString(DocumentNode node) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter()
                         .writeValueAsString(toJson(node));
        } catch (JsonProcessingException e) {
            throw new MarkdownException(new TransformError.InvalidJson(e.getOriginalMessage()), e);
        }
    }

    public static ObjectNode toJson(DocumentNode node) {
        var json = MAPPER.createObjectNode();
        json.put(CLASS_FIELD, qualifiedClass(node));

        if (node instanceof Heading heading) {
            json.put("level", heading.level());
        } else if (node instanceof ListNode list) {
            json.put("type", list.type());
            json.put("start", list.start());
            json.put("tight", String.valueOf(list.tight()));
        } else if (node instanceof ListBlock list) {
            json.put("name", list.name());
            json.put("type", list.type());
            json.put("start", list.start());
            json.put("tight", String.valueOf(list.tight()));
        } else if (node instanceof CodeBlock code) {
            json.put("info", code.info());
            json.put("text", code.text());
        } else if (node instanceof HtmlBlock html) {
            json.put("text", html.text());
        } else if (node instanceof Text text) {
            json.put("text", text.text());
        } else if (node instanceof Code code) {
            json.put("text", code.text());
        } else if (node instanceof HtmlInline html) {
            json.put("text", html.text());
        } else if (node instanceof Link link) {
            json.put("destination", link.destination());
            json.put("title", link.title());
        } else if (node instanceof Image image) {
            json.put("destination", image.destination());
            json.put("title", image.title());
        } else if (node instanceof Clause clause) {
            json.put("name", clause.name());
            json.put("src", clause.src());
        } else if (node instanceof Contract contract) {
            json.put("name", contract.name());
            json.put("src", contract.src());
        } else if (node instanceof Conditional conditional) {
            json.put("name", conditional.name());
            json.put("isTrue", conditional.isTrue());
            json.set("whenTrue", toJsonArray(conditional.whenTrue()));
            json.set("whenFalse", toJsonArray(conditional.whenFalse()));
        } else if (node instanceof WithBlock with) {
            json.put("name", with.name());
        } else if (node instanceof VariableNode variable) {
            json.put("name", variable.name());
            json.put("value", variable.value());
            json.put("elementType", variable.elementType());
            if (variable.identifiedBy()) {
                json.put("identifiedBy", true);
            }
            if (variable instanceof FormattedVariable formatted) {
                json.put("format", formatted.format());
            } else if (variable instanceof EnumVariable enumVariable) {
                var values = json.putArray("enumValues");
                enumVariable.enumValues()
                            .forEach(values::add);
            } else if (variable instanceof Formula formula) {
                json.put("code", formula.code());
            }
        }

        if (hasChildren(node)) {
            json.set("nodes", toJsonArray(node.nodes()));
        }
        return json;
    }

    private static boolean hasChildren(DocumentNode node) {
        return !(node instanceof VariableNode
                 || node instanceof Text
                 || node instanceof Code
                 || node instanceof CodeBlock
                 || node instanceof HtmlInline
                 || node instanceof HtmlBlock
                 || node instanceof ThematicBreak
                 || node instanceof Linebreak
                 || node instanceof Softbreak);
    }

    private static ArrayNode toJsonArray(List<DocumentNode> nodes) {
        var array = MAPPER.createArrayNode();
        nodes.forEach(child -> array.add(toJson(child)));
        return array;
    }
}
