package org.pragmatica.markdown.visitor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.pragmatica.markdown.tree.DocumentNode;
import org.pragmatica.markdown.tree.DocumentNode.*;
import org.pragmatica.markdown.tree.NodeVisitor;

/**
 * Converts a CiceroMark tree into a pdfmake document definition.
 *
 * <p>Every result object starts with {@code style} set to the node tag; the rules below
 * refine it. Formatting marks travel down as {@link Marks} and end up on {@code Text} leaves.
 *
 * @see <a href="http://pdfmake.org/playground.html">pdfmake playground</a>
 */
public final class PdfMakeVisitor implements NodeVisitor<ObjectNode, Marks> {
    private static final String STYLE = "style";
    private static final String TEXT = "text";

    private final ObjectMapper mapper;

    public PdfMakeVisitor(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Convert a whole tree. Fails with {@code UnhandledNodeType} without producing any output
     * if the tree contains a node without a rule.
     */
    public ObjectNode convert(DocumentNode root) {
        return convert(root, Marks.NONE);
    }

    /**
     * Convert a sub-tree that inherits formatting from its surroundings.
     */
    public ObjectNode convert(DocumentNode root, Marks marks) {
        return root.accept(this, marks);
    }

    /**
     * Style name for a heading level; unknown levels fall back to {@code heading_one}.
     */
    public static String headingStyle(String level) {
        if (level == null) {
            return "heading_one";
        }
        return switch (level) {
            case "2" -> "heading_two";
            case "3" -> "heading_three";
            case "4" -> "heading_four";
            case "5" -> "heading_five";
            case "6" -> "heading_six";
            default -> "heading_one";
        };
    }

    private ObjectNode styled(DocumentNode node) {
        var result = mapper.createObjectNode();
        result.put(STYLE, node.tag());
        return result;
    }

    private ArrayNode children(DocumentNode node, Marks marks) {
        var result = mapper.createArrayNode();
        for (var child : node.nodes()) {
            result.add(child.accept(this, marks));
        }
        return result;
    }

    private ObjectNode withChildText(DocumentNode node, Marks marks) {
        var result = styled(node);
        result.set(TEXT, children(node, marks));
        return result;
    }

    private ObjectNode withText(DocumentNode node, String text) {
        var result = styled(node);
        result.put(TEXT, text);
        return result;
    }

    // === Blocks ===

    @Override
    public ObjectNode visitDocument(Document node, Marks marks) {
        var result = styled(node);
        result.set("content", children(node, marks));
        return result;
    }

    @Override
    public ObjectNode visitParagraph(Paragraph node, Marks marks) {
        var result = styled(node);
        var child = children(node, marks);
        // pdfmake cannot render images inline
        if (child.size() > 0 && "Image".equals(child.get(0).path(STYLE).asText())) {
            result.set("stack", child);
        } else {
            result.set(TEXT, child);
            result.set("margin", mapper.createArrayNode().add(0).add(5));
        }
        return result;
    }

    @Override
    public ObjectNode visitHeading(Heading node, Marks marks) {
        children(node, marks);
        var result = mapper.createObjectNode();
        result.put(STYLE, headingStyle(node.level()));
        result.put(TEXT, "\n" + Visitors.firstText(node) + "\n");
        result.put("tocItem", true);
        return result;
    }

    @Override
    public ObjectNode visitList(ListNode node, Marks marks) {
        return list(node, node.ordered(), marks);
    }

    @Override
    public ObjectNode visitListBlock(ListBlock node, Marks marks) {
        return list(node, node.ordered(), marks);
    }

    private ObjectNode list(DocumentNode node, boolean ordered, Marks marks) {
        var result = styled(node);
        result.set(ordered ? "ol" : "ul", children(node, marks));
        return result;
    }

    @Override
    public ObjectNode visitItem(Item node, Marks marks) {
        return withChildText(node, marks);
    }

    @Override
    public ObjectNode visitBlockQuote(BlockQuote node, Marks marks) {
        return withChildText(node, marks);
    }

    @Override
    public ObjectNode visitCodeBlock(CodeBlock node, Marks marks) {
        return withText(node, node.text());
    }

    @Override
    public ObjectNode visitHtmlBlock(HtmlBlock node, Marks marks) {
        return withText(node, node.text());
    }

    @Override
    public ObjectNode visitThematicBreak(ThematicBreak node, Marks marks) {
        var result = withText(node, "");
        result.put("pageBreak", "after");
        return result;
    }

    // === Inlines ===

    @Override
    public ObjectNode visitText(Text node, Marks marks) {
        var result = mapper.createObjectNode();
        result.put(TEXT, node.text());
        if (marks.emph()) {
            result.put(STYLE, "Emph");
            result.put("italics", true);
        }
        if (marks.strong()) {
            result.put(STYLE, "Strong");
            result.put("bold", true);
        }
        if (marks.code()) {
            result.put(STYLE, "Code");
        }
        return result;
    }

    @Override
    public ObjectNode visitEmph(Emph node, Marks marks) {
        var result = withChildText(node, marks.withEmph());
        result.put("italics", true);
        return result;
    }

    @Override
    public ObjectNode visitStrong(Strong node, Marks marks) {
        var result = withChildText(node, marks.withStrong());
        result.put("bold", true);
        return result;
    }

    @Override
    public ObjectNode visitCode(Code node, Marks marks) {
        return withText(node, node.text());
    }

    @Override
    public ObjectNode visitHtmlInline(HtmlInline node, Marks marks) {
        return withText(node, node.text());
    }

    @Override
    public ObjectNode visitLink(Link node, Marks marks) {
        var result = withText(node, Visitors.firstText(node));
        result.put("link", node.destination());
        return result;
    }

    @Override
    public ObjectNode visitImage(Image node, Marks marks) {
        var result = styled(node);
        result.put("image", node.destination());
        return result;
    }

    @Override
    public ObjectNode visitLinebreak(Linebreak node, Marks marks) {
        return withText(node, "\n");
    }

    @Override
    public ObjectNode visitSoftbreak(Softbreak node, Marks marks) {
        return withText(node, " ");
    }

    // === Contract structure ===

    @Override
    public ObjectNode visitClause(Clause node, Marks marks) {
        return withChildText(node, marks);
    }

    @Override
    public ObjectNode visitContract(Contract node, Marks marks) {
        throw Visitors.unhandled(node);
    }

    @Override
    public ObjectNode visitConditional(Conditional node, Marks marks) {
        return withText(node, Visitors.firstText(node));
    }

    @Override
    public ObjectNode visitWithBlock(WithBlock node, Marks marks) {
        return withChildText(node, marks);
    }

    // === Variables ===

    @Override
    public ObjectNode visitVariable(Variable node, Marks marks) {
        return variable(node);
    }

    @Override
    public ObjectNode visitFormattedVariable(FormattedVariable node, Marks marks) {
        return variable(node);
    }

    @Override
    public ObjectNode visitEnumVariable(EnumVariable node, Marks marks) {
        return variable(node);
    }

    @Override
    public ObjectNode visitFormula(Formula node, Marks marks) {
        return variable(node);
    }

    private ObjectNode variable(VariableNode node) {
        var text = Visitors.isQuoted(node)
                   ? Visitors.unquote(node.value())
                   : node.value();
        return withText(node, text);
    }

    @Override
    public ObjectNode visitOpaque(Opaque node, Marks marks) {
        throw Visitors.unhandled(node);
    }
}
