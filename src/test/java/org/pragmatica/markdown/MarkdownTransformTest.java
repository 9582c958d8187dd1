package org.pragmatica.markdown;

import org.junit.jupiter.api.Test;
import org.pragmatica.markdown.error.MarkdownException;
import org.pragmatica.markdown.error.ParseError;
import org.pragmatica.markdown.pipeline.TransformOptions;
import org.pragmatica.markdown.template.BoundValue;
import org.pragmatica.markdown.template.TemplateNode;
import org.pragmatica.markdown.tree.DocumentNodeCodec;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarkdownTransformTest {

    @Test
    void compileTemplate_fromJson_parsesText() {
        var parser = MarkdownTransform.compileTemplate("""
            {
              "$class": "org.accordproject.ciceromark.template.ClauseBlock",
              "name": "delivery",
              "type": "Delivery",
              "nodes": [
                {"$class": "org.accordproject.ciceromark.template.TextChunk", "value": "Deliver within "},
                {"$class": "org.accordproject.ciceromark.template.Variable", "name": "days", "type": "Integer"},
                {"$class": "org.accordproject.ciceromark.template.TextChunk", "value": " days."}
              ]
            }
            """);

        var result = (BoundValue.Compound) parser.parse("Deliver within 10 days.");

        assertEquals(10L, result.field("days"));
    }

    @Test
    void compileTemplate_failedParse_reportsLocation() {
        var parser = MarkdownTransform.compileTemplate(List.of(new TemplateNode.TextChunk("Seller: "),
                                                               TemplateNode.Variable.of("seller", "String")));

        var ex = assertThrows(MarkdownException.class, () -> parser.parse("Seller: Steve"));

        var error = assertInstanceOf(ParseError.class, ex.error());
        assertTrue(ex.getMessage().contains("1:9"));
        assertTrue(error.report("Seller: Steve").contains("^"));
    }

    @Test
    void transform_jsonDocumentToMarkdown() {
        var document = DocumentNodeCodec.fromJson("""
            {"$class": "org.accordproject.commonmark.Document", "nodes": [
              {"$class": "org.accordproject.commonmark.Heading", "level": "1", "nodes": [
                {"$class": "org.accordproject.commonmark.Text", "text": "Sale"}
              ]},
              {"$class": "org.accordproject.commonmark.Paragraph", "nodes": [
                {"$class": "org.accordproject.commonmark.Text", "text": "Agreed."}
              ]}
            ]}
            """);

        assertEquals("# Sale\n\nAgreed.", MarkdownTransform.transform(document, "ciceromark", List.of("markdown")));
    }

    @Test
    void builder_bindsTemplateToTransformer() {
        var grammar = new TemplateNode.WithBlock("price", "Price", List.of(
            TemplateNode.Variable.of("amount", "Double"),
            new TemplateNode.TextChunk(" EUR")));
        var transformer = MarkdownTransform.builder()
                                           .template(grammar)
                                           .verbose(true)
                                           .build();

        var data = transformer.transform("12.5 EUR", "markdown", "data");

        assertEquals(12.5, ((BoundValue.Compound) data).field("amount"));
        assertEquals("12.5 EUR", transformer.transform(data, "data", "markdown"));
        assertTrue(transformer.options().verbose());
    }

    @Test
    void builder_withoutTemplate_hasDefaultOptions() {
        assertEquals(TransformOptions.DEFAULT, MarkdownTransform.builder().options());
    }

    @Test
    void transformationDiagram_isPlantUml() {
        var diagram = MarkdownTransform.transformationDiagram();

        assertTrue(diagram.startsWith("@startuml"));
        assertTrue(diagram.contains("markdown --> data"));
    }
}
