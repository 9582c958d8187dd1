package org.pragmatica.markdown.tree;

import org.junit.jupiter.api.Test;
import org.pragmatica.markdown.error.MarkdownException;
import org.pragmatica.markdown.error.TransformError;
import org.pragmatica.markdown.tree.DocumentNode.*;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class DocumentNodeCodecTest {

    @Test
    void fromJson_paragraphWithMarks_buildsTree() {
        var json = """
            {
              "$class": "org.accordproject.commonmark.Document",
              "nodes": [
                {
                  "$class": "org.accordproject.commonmark.Paragraph",
                  "nodes": [
                    {"$class": "org.accordproject.commonmark.Text", "text": "Hello "},
                    {"$class": "org.accordproject.commonmark.Strong", "nodes": [
                      {"$class": "org.accordproject.commonmark.Text", "text": "world"}
                    ]}
                  ]
                }
              ]
            }
            """;

        var node = DocumentNodeCodec.fromJson(json);

        assertEquals(new Document(List.of(new Paragraph(List.of(new Text("Hello "),
                                                                new Strong(List.of(new Text("world"))))))),
                     node);
    }

    @Test
    void fromJson_unknownClass_decodesToOpaque() {
        var json = """
            {"$class": "org.accordproject.commonmark.Table", "nodes": [
              {"$class": "org.accordproject.commonmark.Text", "text": "cell"}
            ]}
            """;

        var node = assertInstanceOf(Opaque.class, DocumentNodeCodec.fromJson(json));

        assertEquals("org.accordproject.commonmark.Table", node.tag());
        assertEquals(List.of(new Text("cell")), node.nodes());
    }

    @Test
    void fromJson_listTightAsString_isParsed() {
        var json = """
            {"$class": "org.accordproject.commonmark.List", "type": "ordered", "start": "3", "tight": "true", "nodes": []}
            """;

        var list = assertInstanceOf(ListNode.class, DocumentNodeCodec.fromJson(json));

        assertTrue(list.tight());
        assertTrue(list.ordered());
        assertEquals("3", list.start());
    }

    @Test
    void fromJson_missingClass_failsWithInvalidJson() {
        var ex = assertThrows(MarkdownException.class, () -> DocumentNodeCodec.fromJson("{\"text\": \"x\"}"));

        assertInstanceOf(TransformError.InvalidJson.class, ex.error());
    }

    @Test
    void fromJson_malformedText_failsWithInvalidJson() {
        var ex = assertThrows(MarkdownException.class, () -> DocumentNodeCodec.fromJson("{not json"));

        assertInstanceOf(TransformError.InvalidJson.class, ex.error());
    }

    @Test
    void toJson_variable_usesCiceromarkNamespace() {
        var json = DocumentNodeCodec.toJson(new Variable("seller", "\"Steve\"", "String", false));

        assertEquals("org.accordproject.ciceromark.Variable", json.get("$class").asText());
        assertEquals("\"Steve\"", json.get("value").asText());
        assertFalse(json.has("nodes"));
        assertFalse(json.has("identifiedBy"));
    }

    @Test
    void toJson_thenFromJson_preservesContractTree() {
        var tree = new Document(List.of(
            new Heading("1", List.of(new Text("Sale"))),
            new Clause("payment", "Payment", List.of(
                new Paragraph(List.of(
                    new Text("Pay "),
                    new FormattedVariable("amount", "100", "Double", false, "0.00"),
                    new Text(" by "),
                    new EnumVariable("method", "WIRE", "PaymentMethod", false, List.of("WIRE", "CHECK")),
                    new Softbreak(),
                    new Conditional("late", true, List.of(new Text("late")), List.of(), List.of(new Text("late"))))))),
            new ListBlock("items", "bullet", "", true, List.of(new Item(List.of(new Paragraph(List.of(new Text("a"))))))),
            new CodeBlock("java", "int x;\n"),
            new ThematicBreak()));

        var decoded = DocumentNodeCodec.fromJson(DocumentNodeCodec.toJsonString(tree));

        assertEquals(tree, decoded);
    }

    @Test
    void qualifiedClass_commonmarkAndCiceromark() {
        assertThat(DocumentNodeCodec.qualifiedClass(new Text("x"))).isEqualTo("org.accordproject.commonmark.Text");
        assertThat(DocumentNodeCodec.qualifiedClass(new Clause("c", "C", List.of())))
            .isEqualTo("org.accordproject.ciceromark.Clause");
    }
}
