package org.pragmatica.markdown.template;

import org.junit.jupiter.api.Test;
import org.pragmatica.markdown.error.MarkdownException;
import org.pragmatica.markdown.error.TransformError;
import org.pragmatica.markdown.template.TemplateNode.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TemplateNodeCodecTest {

    @Test
    void fromJson_clauseGrammar_decodes() {
        var json = """
            {
              "$class": "org.accordproject.ciceromark.template.ClauseBlock",
              "name": "payment",
              "type": "Payment",
              "nodes": [
                {"$class": "org.accordproject.ciceromark.template.TextChunk", "value": "Pay "},
                {"$class": "org.accordproject.ciceromark.template.Variable", "name": "amount", "type": "Integer"},
                {"$class": "org.accordproject.ciceromark.template.TextChunk", "value": " USD."}
              ]
            }
            """;

        assertEquals(TemplateCompilerTest.PAYMENT, TemplateNodeCodec.fromJson(json));
    }

    @Test
    void fromJson_unknownClass_decodesToUnrecognized() {
        var node = TemplateNodeCodec.fromJson("{\"$class\": \"org.accordproject.ciceromark.template.TableBlock\"}");

        assertEquals(new Unrecognized("org.accordproject.ciceromark.template.TableBlock"), node);
    }

    @Test
    void listFromJson_decodesBareSequence() {
        var json = """
            [
              {"$class": "org.accordproject.ciceromark.template.TextChunk", "value": "Ship by "},
              {"$class": "org.accordproject.ciceromark.template.Variable", "name": "mode", "type": "Enum",
               "enumValues": ["AIR", "SEA"]}
            ]
            """;

        var nodes = TemplateNodeCodec.listFromJson(json);

        assertEquals(List.of(new TextChunk("Ship by "), Variable.ofEnum("mode", List.of("AIR", "SEA"))), nodes);
    }

    @Test
    void listFromJson_objectInput_failsWithInvalidJson() {
        var ex = assertThrows(MarkdownException.class, () -> TemplateNodeCodec.listFromJson("{}"));

        assertInstanceOf(TransformError.InvalidJson.class, ex.error());
    }

    @Test
    void toJson_thenFromJson_preservesContract() {
        var grammar = new ContractBlock("sale", "Sale", List.of(
            new TextChunk("Terms.\n"),
            new ConditionalBlock("liable", "will", "will not"),
            new UnorderedListBlock(List.of(new TextChunk("- "), Variable.of("item", "String"))),
            TemplateCompilerTest.PAYMENT));

        var json = TemplateNodeCodec.toJson(grammar);

        assertEquals("org.accordproject.ciceromark.template.ContractBlock", json.get("$class").asText());
        assertEquals(grammar, TemplateNodeCodec.fromJson(json));
    }
}
