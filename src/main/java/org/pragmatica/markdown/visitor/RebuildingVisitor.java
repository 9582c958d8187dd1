package org.pragmatica.markdown.visitor;

import org.pragmatica.markdown.tree.DocumentNode;
import org.pragmatica.markdown.tree.DocumentNode.*;
import org.pragmatica.markdown.tree.NodeVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * Tree-to-tree transformation base: copies every node, rebuilding containers from their
 * transformed children. Subclasses override the rules for the nodes they rewrite.
 */
public abstract class RebuildingVisitor implements NodeVisitor<DocumentNode, Void> {

    public DocumentNode convert(DocumentNode root) {
        return root.accept(this, null);
    }

    protected List<DocumentNode> rebuild(List<DocumentNode> nodes) {
        var result = new ArrayList<DocumentNode>(nodes.size());
        for (var node : nodes) {
            result.add(node.accept(this, null));
        }
        return result;
    }

    @Override
    public DocumentNode visitDocument(Document node, Void param) {
        return new Document(rebuild(node.nodes()));
    }

    @Override
    public DocumentNode visitParagraph(Paragraph node, Void param) {
        return new Paragraph(rebuild(node.nodes()));
    }

    @Override
    public DocumentNode visitHeading(Heading node, Void param) {
        return new Heading(node.level(), rebuild(node.nodes()));
    }

    @Override
    public DocumentNode visitList(ListNode node, Void param) {
        return new ListNode(node.type(), node.start(), node.tight(), rebuild(node.nodes()));
    }

    @Override
    public DocumentNode visitListBlock(ListBlock node, Void param) {
        return new ListBlock(node.name(), node.type(), node.start(), node.tight(), rebuild(node.nodes()));
    }

    @Override
    public DocumentNode visitItem(Item node, Void param) {
        return new Item(rebuild(node.nodes()));
    }

    @Override
    public DocumentNode visitBlockQuote(BlockQuote node, Void param) {
        return new BlockQuote(rebuild(node.nodes()));
    }

    @Override
    public DocumentNode visitCodeBlock(CodeBlock node, Void param) {
        return node;
    }

    @Override
    public DocumentNode visitHtmlBlock(HtmlBlock node, Void param) {
        return node;
    }

    @Override
    public DocumentNode visitThematicBreak(ThematicBreak node, Void param) {
        return node;
    }

    @Override
    public DocumentNode visitText(Text node, Void param) {
        return node;
    }

    @Override
    public DocumentNode visitEmph(Emph node, Void param) {
        return new Emph(rebuild(node.nodes()));
    }

    @Override
    public DocumentNode visitStrong(Strong node, Void param) {
        return new Strong(rebuild(node.nodes()));
    }

    @Override
    public DocumentNode visitCode(Code node, Void param) {
        return node;
    }

    @Override
    public DocumentNode visitHtmlInline(HtmlInline node, Void param) {
        return node;
    }

    @Override
    public DocumentNode visitLink(Link node, Void param) {
        return new Link(node.destination(), node.title(), rebuild(node.nodes()));
    }

    @Override
    public DocumentNode visitImage(Image node, Void param) {
        return new Image(node.destination(), node.title(), rebuild(node.nodes()));
    }

    @Override
    public DocumentNode visitLinebreak(Linebreak node, Void param) {
        return node;
    }

    @Override
    public DocumentNode visitSoftbreak(Softbreak node, Void param) {
        return node;
    }

    @Override
    public DocumentNode visitClause(Clause node, Void param) {
        return new Clause(node.name(), node.src(), rebuild(node.nodes()));
    }

    @Override
    public DocumentNode visitContract(Contract node, Void param) {
        return new Contract(node.name(), node.src(), rebuild(node.nodes()));
    }

    @Override
    public DocumentNode visitConditional(Conditional node, Void param) {
        return new Conditional(node.name(),
                               node.isTrue(),
                               rebuild(node.whenTrue()),
                               rebuild(node.whenFalse()),
                               rebuild(node.nodes()));
    }

    @Override
    public DocumentNode visitWithBlock(WithBlock node, Void param) {
        return new WithBlock(node.name(), rebuild(node.nodes()));
    }

    @Override
    public DocumentNode visitVariable(Variable node, Void param) {
        return node;
    }

    @Override
    public DocumentNode visitFormattedVariable(FormattedVariable node, Void param) {
        return node;
    }

    @Override
    public DocumentNode visitEnumVariable(EnumVariable node, Void param) {
        return node;
    }

    @Override
    public DocumentNode visitFormula(Formula node, Void param) {
        return node;
    }

    @Override
    public DocumentNode visitOpaque(Opaque node, Void param) {
        throw Visitors.unhandled(node);
    }
}
