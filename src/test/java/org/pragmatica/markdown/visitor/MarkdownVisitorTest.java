package org.pragmatica.markdown.visitor;

import org.junit.jupiter.api.Test;
import org.pragmatica.markdown.error.MarkdownException;
import org.pragmatica.markdown.error.TransformError;
import org.pragmatica.markdown.tree.ClauseMarkers;
import org.pragmatica.markdown.tree.DocumentNode;
import org.pragmatica.markdown.tree.DocumentNode.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarkdownVisitorTest {
    private final MarkdownVisitor visitor = new MarkdownVisitor();

    @Test
    void paragraphs_separatedByBlankLine() {
        var tree = new Document(List.of(new Paragraph(List.of(new Text("one"))),
                                        new Paragraph(List.of(new Text("two")))));

        assertEquals("one\n\ntwo", visitor.convert(tree));
    }

    @Test
    void inlineMarks_areWritten() {
        var tree = new Paragraph(List.of(new Emph(List.of(new Text("a"))),
                                         new Text(" "),
                                         new Strong(List.of(new Text("b"))),
                                         new Text(" "),
                                         new Code("c")));

        assertEquals("*a* **b** `c`", visitor.convert(tree));
    }

    @Test
    void heading_writesHashes() {
        assertEquals("## Terms", visitor.convert(new Heading("2", List.of(new Text("Terms")))));
    }

    @Test
    void lists_bulletAndOrdered() {
        var items = List.<DocumentNode>of(
            new Item(List.of(new Paragraph(List.of(new Text("a"))))),
            new Item(List.of(new Paragraph(List.of(new Text("b"))))));

        assertEquals("- a\n- b", visitor.convert(new ListNode("bullet", "", true, items)));
        assertEquals("3. a\n4. b", visitor.convert(new ListNode("ordered", "3", true, items)));
    }

    @Test
    void clause_isWrappedInMarkers() {
        var clause = new Clause("payment", "Payment", List.of(new Paragraph(List.of(
            new Text("Pay "), new Variable("amount", "100", "Integer", false), new Text(" USD.")))));
        var tree = new Document(List.of(new Paragraph(List.of(new Text("Terms."))), clause));

        assertEquals("Terms.\n" + ClauseMarkers.wrap("Payment", "payment", "Pay 100 USD."), visitor.convert(tree));
        assertEquals("Pay 100 USD.", visitor.clauseText(clause));
    }

    @Test
    void variables_keepStoredQuotes() {
        var tree = new Paragraph(List.of(new Text("Seller: "), new Variable("seller", "\"Steve\"", "String", false)));

        assertEquals("Seller: \"Steve\"", visitor.convert(tree));
    }

    @Test
    void breaks_andLinks() {
        var tree = new Paragraph(List.of(new Text("a"),
                                         new Linebreak(),
                                         new Text("b"),
                                         new Softbreak(),
                                         new Link("https://example.com", "", List.of(new Text("c")))));

        assertEquals("a\\\nb\n[c](https://example.com)", visitor.convert(tree));
    }

    @Test
    void opaque_isUnhandled() {
        var tree = new Document(List.of(new Opaque("org.example.Table", List.of())));

        var ex = assertThrows(MarkdownException.class, () -> visitor.convert(tree));
        assertInstanceOf(TransformError.UnhandledNodeType.class, ex.error());
    }
}
