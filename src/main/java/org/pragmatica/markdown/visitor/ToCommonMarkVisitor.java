package org.pragmatica.markdown.visitor;

import org.pragmatica.markdown.tree.ClauseMarkers;
import org.pragmatica.markdown.tree.DocumentNode;
import org.pragmatica.markdown.tree.DocumentNode.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers a CiceroMark tree to plain CommonMark.
 *
 * <p>A clause becomes a fenced code block whose info string is the clause marker and whose
 * text is the markdown of the clause body. Variables become text holding their stored value.
 * Contracts, conditionals and with-blocks are replaced by their content, and runs of adjacent
 * text are merged.
 */
public final class ToCommonMarkVisitor extends RebuildingVisitor {
    private final MarkdownVisitor markdown = new MarkdownVisitor();

    @Override
    protected List<DocumentNode> rebuild(List<DocumentNode> nodes) {
        var result = new ArrayList<DocumentNode>(nodes.size());
        for (var node : nodes) {
            if (node instanceof Contract || node instanceof Conditional || node instanceof WithBlock) {
                rebuild(node.nodes()).forEach(child -> append(result, child));
            } else {
                append(result, node.accept(this, null));
            }
        }
        return result;
    }

    private static void append(List<DocumentNode> result, DocumentNode node) {
        var last = result.isEmpty()
                   ? null
                   : result.get(result.size() - 1);
        if (last instanceof Text previous && node instanceof Text text) {
            result.set(result.size() - 1, new Text(previous.text() + text.text()));
        } else {
            result.add(node);
        }
    }

    @Override
    public DocumentNode visitListBlock(ListBlock node, Void param) {
        return new ListNode(node.type(), node.start(), node.tight(), rebuild(node.nodes()));
    }

    @Override
    public DocumentNode visitClause(Clause node, Void param) {
        return new CodeBlock(ClauseMarkers.info(node.src(), node.name()), markdown.clauseText(node) + "\n");
    }

    @Override
    public DocumentNode visitContract(Contract node, Void param) {
        return new Document(rebuild(node.nodes()));
    }

    @Override
    public DocumentNode visitConditional(Conditional node, Void param) {
        return new Paragraph(rebuild(node.nodes()));
    }

    @Override
    public DocumentNode visitWithBlock(WithBlock node, Void param) {
        return new Paragraph(rebuild(node.nodes()));
    }

    @Override
    public DocumentNode visitVariable(Variable node, Void param) {
        return new Text(node.value());
    }

    @Override
    public DocumentNode visitFormattedVariable(FormattedVariable node, Void param) {
        return new Text(node.value());
    }

    @Override
    public DocumentNode visitEnumVariable(EnumVariable node, Void param) {
        return new Text(node.value());
    }

    @Override
    public DocumentNode visitFormula(Formula node, Void param) {
        return new Text(node.value());
    }
}
