package org.pragmatica.markdown.pipeline;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.pragmatica.markdown.error.MarkdownException;
import org.pragmatica.markdown.error.TransformError;
import org.pragmatica.markdown.template.BoundValue;
import org.pragmatica.markdown.template.TemplateNode;
import org.pragmatica.markdown.template.TemplateNode.*;
import org.pragmatica.markdown.tree.ClauseMarkers;
import org.pragmatica.markdown.tree.DocumentNode;
import org.pragmatica.markdown.tree.DocumentNode.Clause;
import org.pragmatica.markdown.tree.DocumentNode.CodeBlock;
import org.pragmatica.markdown.tree.DocumentNode.Document;
import org.pragmatica.markdown.tree.DocumentNode.Paragraph;
import org.pragmatica.markdown.tree.DocumentNode.Text;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class PipelineTest {
    private final Pipeline pipeline = new Pipeline(FormatRegistry.standard());

    private static final TemplateNode SALE = new ContractBlock("sale", "Sale", List.of(
        new TextChunk("Seller "),
        Variable.of("seller", "String"),
        new TextChunk(" agrees.\n"),
        new ClauseBlock("payment", "Payment", List.of(
            new TextChunk("Pay "),
            Variable.of("amount", "Integer"),
            new TextChunk(" USD.")))));

    private static DocumentNode document() {
        return new Document(List.of(
            new Paragraph(List.of(new Text("Seller "),
                                  new DocumentNode.Variable("seller", "\"Steve\"", "String", false),
                                  new Text(" agrees."))),
            new Clause("payment", "Payment", List.of(new Paragraph(List.of(
                new Text("Pay "),
                new DocumentNode.Variable("amount", "100", "Integer", false),
                new Text(" USD.")))))));
    }

    private static TransformError transformError(Runnable action) {
        var ex = assertThrows(MarkdownException.class, action::run);
        return assertInstanceOf(TransformError.class, ex.error());
    }

    @Test
    void transform_ciceromarkToMarkdown_writesClauseMarkers() {
        var markdown = pipeline.transform(document(), "ciceromark", List.of("markdown"), TransformOptions.DEFAULT);

        assertEquals("Seller \"Steve\" agrees.\n" + ClauseMarkers.wrap("Payment", "payment", "Pay 100 USD."), markdown);
    }

    @Test
    void transform_chainThroughData_roundTripsMarkdown() {
        var options = TransformOptions.DEFAULT.withTemplate(SALE);
        var markdown = (String) pipeline.transform(document(), "ciceromark", List.of("markdown"), options);

        var data = pipeline.transform(document(), "ciceromark", List.of("markdown", "data"), options);
        var compound = assertInstanceOf(BoundValue.Compound.class, data);
        assertEquals("Steve", compound.field("seller"));
        assertEquals(100L, ((BoundValue.Compound) compound.field("payment")).field("amount"));

        assertEquals(markdown, pipeline.transform(data, "data", List.of("markdown"), options));
    }

    @Test
    void transform_dataToCiceromark_rebuildsDocument() {
        var options = TransformOptions.DEFAULT.withTemplate(SALE);
        var markdown = "Seller \"Steve\" agrees.\n" + ClauseMarkers.wrap("Payment", "payment", "Pay 100 USD.");

        var result = pipeline.transform(markdown, "markdown", List.of("data", "ciceromark"), options);

        assertEquals(document(), result);
    }

    @Test
    void transform_dataToCiceromarkWithoutTemplate_failsWithMissingOption() {
        var data = new BoundValue.Sequence(List.of());

        var error = transformError(() -> pipeline.transform(data, "data", List.of("ciceromark"), TransformOptions.DEFAULT));

        assertEquals(new TransformError.MissingOption("data->ciceromark", "template"), error);
    }

    @Test
    void transform_markdownToDataWithTextTemplate_bindsEmptySequence() {
        var options = TransformOptions.DEFAULT.withTemplate(new TextChunk("Hello"));

        var result = pipeline.transform("Hello", "markdown", List.of("data"), options);

        assertEquals(new BoundValue.Sequence(List.of()), result);
    }

    @Test
    void transform_ciceromarkToCommonmark_writesClauseAsCodeBlock() {
        var result = pipeline.transform(document(), "ciceromark", List.of("commonmark"), TransformOptions.DEFAULT);

        var tree = assertInstanceOf(Document.class, result);
        assertEquals(new Paragraph(List.of(new Text("Seller \"Steve\" agrees."))), tree.nodes().get(0));
        assertEquals(new CodeBlock("<clause src=\"Payment\" clauseid=\"payment\">", "Pay 100 USD.\n"),
                     tree.nodes().get(1));
    }

    @Test
    void transform_throughCommonmark_keepsMarkdown() {
        var direct = pipeline.transform(document(), "ciceromark", List.of("markdown"), TransformOptions.DEFAULT);

        assertEquals(direct, pipeline.transform(document(), "ciceromark", List.of("commonmark", "markdown"),
                                                TransformOptions.DEFAULT));
        assertEquals(direct, pipeline.transform(document(), "ciceromark",
                                                List.of("commonmark", "ciceromark", "markdown"),
                                                TransformOptions.DEFAULT));
    }

    @Test
    void transform_commonmarkToCiceromark_restoresClause() {
        var commonmark = pipeline.transform(document(), "ciceromark", List.of("commonmark"), TransformOptions.DEFAULT);

        var result = (Document) pipeline.transform(commonmark, "commonmark", List.of("ciceromark"), TransformOptions.DEFAULT);

        assertEquals(new Clause("payment", "Payment", List.of(new Paragraph(List.of(new Text("Pay 100 USD."))))),
                     result.nodes().get(1));
    }

    @Test
    void transform_unquotedThenPdfMake_feedsEachHop() {
        var result = pipeline.transform(document(), "ciceromark", List.of("ciceromark_unquoted", "pdfmake"),
                                        TransformOptions.DEFAULT.withVerbose(true));

        var pdf = assertInstanceOf(ObjectNode.class, result);
        var seller = pdf.get("content").get(0).get("text").get(1);
        assertEquals("Steve", seller.get("text").asText());
    }

    @Test
    void transform_untypedToMarkdown_isSupported() {
        var result = pipeline.transform(document(), "ciceromark", List.of("ciceromark_untyped", "markdown"),
                                        TransformOptions.DEFAULT);

        assertThat((String) result).startsWith("Seller \"Steve\"");
    }

    @Test
    void transform_missingHop_failsWithUnsupportedConversion() {
        var error = transformError(() -> pipeline.transform(document(), "ciceromark", List.of("pdfmake", "markdown"),
                                                            TransformOptions.DEFAULT));

        assertEquals(new TransformError.UnsupportedConversion("pdfmake", "markdown"), error);
    }

    @Test
    void transform_missingHop_runsNoConverter() {
        var opaque = new Document(List.of(new DocumentNode.Opaque("org.example.Table", List.of())));

        var error = transformError(() -> pipeline.transform(opaque, "ciceromark", List.of("markdown", "pdfmake"),
                                                            TransformOptions.DEFAULT));

        assertInstanceOf(TransformError.UnsupportedConversion.class, error);
    }

    @Test
    void transform_unknownFormat_fails() {
        var error = transformError(() -> pipeline.transform(document(), "ciceromark", List.of("docx"),
                                                            TransformOptions.DEFAULT));

        assertEquals(new TransformError.UnknownFormat("docx"), error);
    }

    @Test
    void transform_wrongInputType_failsWithUnexpectedValue() {
        var error = transformError(() -> pipeline.transform("# Title", "ciceromark", List.of("markdown"),
                                                            TransformOptions.DEFAULT));

        assertEquals(new TransformError.UnexpectedValue("ciceromark", "String"), error);
    }

    @Test
    void transform_markdownToDataWithoutTemplate_failsWithMissingOption() {
        var error = transformError(() -> pipeline.transform("Seller \"Steve\"", "markdown", List.of("data"),
                                                            TransformOptions.DEFAULT));

        assertEquals(new TransformError.MissingOption("markdown->data", "template"), error);
    }

    @Test
    void transform_emptyChain_returnsInput() {
        var input = document();

        assertSame(input, pipeline.transform(input, "ciceromark", List.of(), TransformOptions.DEFAULT));
    }

    @Test
    void registry_customConverter_isUsed() {
        var registry = FormatRegistry.standard()
                                     .register(new Format("shout", "Upper case text", SerializationKind.TEXT, "txt",
                                                          String.class))
                                     .register(new Converter("markdown", "shout",
                                                             (input, options) -> ((String) input).toUpperCase()));

        var result = new Pipeline(registry).transform("quiet", "markdown", List.of("shout"), TransformOptions.DEFAULT);

        assertEquals("QUIET", result);
    }

    @Test
    void registry_converterWithUnknownEnd_isRejected() {
        var registry = new FormatRegistry();

        assertThrows(MarkdownException.class,
                     () -> registry.register(new Converter("a", "b", (input, options) -> input)));
    }

    @Test
    void diagram_listsAllConverters() {
        var registry = FormatRegistry.standard();

        var diagram = TransformationDiagram.render(registry);

        assertTrue(diagram.startsWith("@startuml\n"));
        assertTrue(diagram.endsWith("@enduml\n"));
        assertTrue(diagram.contains("ciceromark --> pdfmake\n"));
        assertTrue(diagram.contains("data --> markdown\n"));
        assertTrue(diagram.contains("data --> ciceromark\n"));
        assertTrue(diagram.contains("ciceromark --> commonmark\n"));
        assertTrue(diagram.contains("commonmark --> ciceromark\n"));
        assertThat(diagram.lines().filter(line -> line.contains(" --> "))).hasSize(registry.converters().size());
    }
}
