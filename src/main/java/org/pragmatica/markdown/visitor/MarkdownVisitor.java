package org.pragmatica.markdown.visitor;

import org.pragmatica.markdown.tree.ClauseMarkers;
import org.pragmatica.markdown.tree.DocumentNode;
import org.pragmatica.markdown.tree.DocumentNode.*;
import org.pragmatica.markdown.tree.NodeVisitor;

import java.util.List;

/**
 * Serializes a CiceroMark tree to markdown text.
 *
 * <p>Blocks are separated by a blank line. Clauses are written between {@link ClauseMarkers},
 * which already carry the surrounding newlines, so a single newline separates a clause from
 * its neighbours. A code block whose info string is a clause marker is written the same way.
 * Variables are written with their stored value, quotes included.
 */
public final class MarkdownVisitor implements NodeVisitor<String, Void> {

    public String convert(DocumentNode root) {
        return root.accept(this, null);
    }

    /**
     * Markdown of the body of a clause, without the boundary markers.
     */
    public String clauseText(Clause clause) {
        return blocks(clause.nodes());
    }

    private String blocks(List<DocumentNode> nodes) {
        var sb = new StringBuilder();
        DocumentNode previous = null;
        for (var node : nodes) {
            if (previous != null) {
                sb.append(isClause(previous) || isClause(node)
                          ? "\n"
                          : "\n\n");
            }
            sb.append(node.accept(this, null));
            previous = node;
        }
        return sb.toString();
    }

    /**
     * Clauses and their CommonMark form, a code block with a clause info string.
     */
    private static boolean isClause(DocumentNode node) {
        if (node instanceof Clause) {
            return true;
        }
        return node instanceof CodeBlock code && ClauseMarkers.parseInfo(code.info()).isPresent();
    }

    private String inlines(List<DocumentNode> nodes) {
        var sb = new StringBuilder();
        for (var node : nodes) {
            sb.append(node.accept(this, null));
        }
        return sb.toString();
    }

    private static String indent(String text, String firstPrefix, String restPrefix) {
        var lines = text.split("\n", -1);
        var sb = new StringBuilder();
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                sb.append("\n");
            }
            var prefix = i == 0 ? firstPrefix : restPrefix;
            sb.append(lines[i].isEmpty() ? prefix.stripTrailing() : prefix + lines[i]);
        }
        return sb.toString();
    }

    // === Blocks ===

    @Override
    public String visitDocument(Document node, Void param) {
        return blocks(node.nodes());
    }

    @Override
    public String visitParagraph(Paragraph node, Void param) {
        return inlines(node.nodes());
    }

    @Override
    public String visitHeading(Heading node, Void param) {
        int level;
        try {
            level = Integer.parseInt(node.level());
        } catch (NumberFormatException e) {
            level = 1;
        }
        if (level < 1 || level > 6) {
            level = 1;
        }
        return "#".repeat(level) + " " + inlines(node.nodes());
    }

    @Override
    public String visitList(ListNode node, Void param) {
        return list(node.nodes(), node.ordered(), node.start(), node.tight());
    }

    @Override
    public String visitListBlock(ListBlock node, Void param) {
        return list(node.nodes(), node.ordered(), node.start(), node.tight());
    }

    private String list(List<DocumentNode> items, boolean ordered, String start, boolean tight) {
        int number = parseStart(start);
        var sb = new StringBuilder();
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                sb.append(tight ? "\n" : "\n\n");
            }
            var marker = ordered
                         ? (number + i) + ". "
                         : "- ";
            sb.append(indent(items.get(i).accept(this, null), marker, " ".repeat(marker.length())));
        }
        return sb.toString();
    }

    private static int parseStart(String start) {
        try {
            return start == null || start.isEmpty()
                   ? 1
                   : Integer.parseInt(start);
        } catch (NumberFormatException e) {
            return 1;
        }
    }

    @Override
    public String visitItem(Item node, Void param) {
        return blocks(node.nodes());
    }

    @Override
    public String visitBlockQuote(BlockQuote node, Void param) {
        return indent(blocks(node.nodes()), "> ", "> ");
    }

    @Override
    public String visitCodeBlock(CodeBlock node, Void param) {
        var text = node.text();
        var clause = ClauseMarkers.parseInfo(node.info());
        if (clause.isPresent()) {
            var content = text.endsWith("\n")
                          ? text.substring(0, text.length() - 1)
                          : text;
            return ClauseMarkers.wrap(clause.get().src(), clause.get().clauseId(), content);
        }
        return "```" + node.info() + "\n" + text + (text.endsWith("\n") ? "" : "\n") + "```";
    }

    @Override
    public String visitHtmlBlock(HtmlBlock node, Void param) {
        return node.text().stripTrailing();
    }

    @Override
    public String visitThematicBreak(ThematicBreak node, Void param) {
        return "---";
    }

    // === Inlines ===

    @Override
    public String visitText(Text node, Void param) {
        return node.text();
    }

    @Override
    public String visitEmph(Emph node, Void param) {
        return "*" + inlines(node.nodes()) + "*";
    }

    @Override
    public String visitStrong(Strong node, Void param) {
        return "**" + inlines(node.nodes()) + "**";
    }

    @Override
    public String visitCode(Code node, Void param) {
        return "`" + node.text() + "`";
    }

    @Override
    public String visitHtmlInline(HtmlInline node, Void param) {
        return node.text();
    }

    @Override
    public String visitLink(Link node, Void param) {
        return "[" + inlines(node.nodes()) + "](" + destination(node.destination(), node.title()) + ")";
    }

    @Override
    public String visitImage(Image node, Void param) {
        return "![" + inlines(node.nodes()) + "](" + destination(node.destination(), node.title()) + ")";
    }

    private static String destination(String destination, String title) {
        return title == null || title.isEmpty()
               ? destination
               : destination + " \"" + title + "\"";
    }

    @Override
    public String visitLinebreak(Linebreak node, Void param) {
        return "\\\n";
    }

    @Override
    public String visitSoftbreak(Softbreak node, Void param) {
        return "\n";
    }

    // === Contract structure ===

    @Override
    public String visitClause(Clause node, Void param) {
        return ClauseMarkers.wrap(node.src(), node.name(), blocks(node.nodes()));
    }

    @Override
    public String visitContract(Contract node, Void param) {
        return blocks(node.nodes());
    }

    @Override
    public String visitConditional(Conditional node, Void param) {
        return inlines(node.nodes());
    }

    @Override
    public String visitWithBlock(WithBlock node, Void param) {
        return inlines(node.nodes());
    }

    // === Variables ===

    @Override
    public String visitVariable(Variable node, Void param) {
        return node.value();
    }

    @Override
    public String visitFormattedVariable(FormattedVariable node, Void param) {
        return node.value();
    }

    @Override
    public String visitEnumVariable(EnumVariable node, Void param) {
        return node.value();
    }

    @Override
    public String visitFormula(Formula node, Void param) {
        return node.value();
    }

    @Override
    public String visitOpaque(Opaque node, Void param) {
        throw Visitors.unhandled(node);
    }
}
