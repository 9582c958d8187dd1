package org.pragmatica.markdown.template;

import org.junit.jupiter.api.Test;
import org.pragmatica.markdown.error.MarkdownException;
import org.pragmatica.markdown.error.TransformError;
import org.pragmatica.markdown.template.TemplateNode.*;
import org.pragmatica.markdown.tree.ClauseMarkers;
import org.pragmatica.markdown.tree.DocumentNode;
import org.pragmatica.markdown.visitor.MarkdownVisitor;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DocumentBuilderTest {

    @Test
    void build_contract_createsClauseBlocks() {
        var payment = new BoundValue.Compound("payment", "Payment", Map.of("amount", 100L));
        var sale = new BoundValue.Compound("sale", "Sale", Map.of("payment", payment));

        var result = DocumentBuilder.build(TemplateCompilerTest.SALE, sale);

        var expected = new DocumentNode.Document(List.of(
            new DocumentNode.Paragraph(List.of(new DocumentNode.Text("Terms."))),
            new DocumentNode.Clause("payment", "Payment", List.of(new DocumentNode.Paragraph(List.of(
                new DocumentNode.Text("Pay "),
                new DocumentNode.Variable("amount", "100", "Integer", false),
                new DocumentNode.Text(" USD.")))))));
        assertEquals(expected, result);
    }

    @Test
    void build_textChunks_splitIntoParagraphsAndSoftbreaks() {
        var grammar = List.<TemplateNode>of(new TextChunk("First line\nsecond line\n\nNext "),
                                            Variable.ofEnum("mode", List.of("AIR", "SEA")));
        var value = new BoundValue.Sequence(List.of(new BoundValue.Variable("mode", "Enum", "SEA")));

        var result = DocumentBuilder.build(grammar, value);

        var expected = new DocumentNode.Document(List.of(
            new DocumentNode.Paragraph(List.of(new DocumentNode.Text("First line"),
                                               new DocumentNode.Softbreak(),
                                               new DocumentNode.Text("second line"))),
            new DocumentNode.Paragraph(List.of(new DocumentNode.Text("Next "),
                                               new DocumentNode.EnumVariable("mode", "SEA", "Enum", false,
                                                                             List.of("AIR", "SEA"))))));
        assertEquals(expected, result);
    }

    @Test
    void build_conditional_keepsBothBranches() {
        var grammar = new ConditionalBlock("liable", "will", "will not");

        var result = DocumentBuilder.build(grammar, new BoundValue.Variable("liable", "Boolean", false));

        var conditional = (DocumentNode.Conditional) result.nodes().get(0).nodes().get(0);
        assertFalse(conditional.isTrue());
        assertEquals(List.of(new DocumentNode.Text("will")), conditional.whenTrue());
        assertEquals(List.of(new DocumentNode.Text("will not")), conditional.nodes());
    }

    @Test
    void build_thenMarkdown_matchesRenderedText() {
        var grammar = new ContractBlock("order", "Order", List.of(
            new TextChunk("Order of "),
            Variable.of("quantity", "Integer"),
            new TextChunk(" units.\n\nShip to "),
            new WithBlock("address", "Address", List.of(Variable.of("city", "String"))),
            new TextChunk(".\n"),
            new ClauseBlock("seller", "Seller", List.of(
                new TextChunk("Seller "),
                Variable.of("name", "String"),
                new TextChunk(" "),
                new ConditionalBlock("liable", "is liable", "is not liable"),
                new TextChunk(".")))));
        var text = "Order of 12 units.\n\nShip to \"Paris\".\n"
                   + ClauseMarkers.wrap("Seller", "seller", "Seller \"Steve\" is not liable.");
        var bound = TemplateCompiler.compile(grammar).parse(text);

        var markdown = new MarkdownVisitor().convert(DocumentBuilder.build(grammar, bound));

        assertEquals(TemplateRenderer.render(grammar, bound), markdown);
        assertEquals(text, markdown);
    }

    @Test
    void build_missingField_failsWithMissingValue() {
        var ex = assertThrows(MarkdownException.class,
                              () -> DocumentBuilder.build(Variable.of("seller", "String"), new BoundValue.Sequence(List.of())));

        assertEquals(new TransformError.MissingValue("seller"), ex.error());
    }
}
