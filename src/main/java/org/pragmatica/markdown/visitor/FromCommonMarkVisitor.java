package org.pragmatica.markdown.visitor;

import org.pragmatica.markdown.tree.ClauseMarkers;
import org.pragmatica.markdown.tree.DocumentNode;
import org.pragmatica.markdown.tree.DocumentNode.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Lifts clause code blocks of a CommonMark tree back into {@code Clause} nodes.
 *
 * <p>The clause body is restored as plain-text paragraphs: blank lines separate paragraphs,
 * single newlines become soft breaks. Inline markdown inside the body stays literal text.
 */
public final class FromCommonMarkVisitor extends RebuildingVisitor {

    @Override
    public DocumentNode visitCodeBlock(CodeBlock node, Void param) {
        return ClauseMarkers.parseInfo(node.info())
                            .<DocumentNode>map(info -> new Clause(info.clauseId(), info.src(), paragraphs(node.text())))
                            .orElse(node);
    }

    static List<DocumentNode> paragraphs(String text) {
        var body = text.endsWith("\n")
                   ? text.substring(0, text.length() - 1)
                   : text;
        var result = new ArrayList<DocumentNode>();
        if (body.isEmpty()) {
            return result;
        }
        for (var block : body.split("\n\n+")) {
            var inlines = new ArrayList<DocumentNode>();
            var lines = block.split("\n", -1);
            for (int i = 0; i < lines.length; i++) {
                if (i > 0) {
                    inlines.add(new Softbreak());
                }
                if (!lines[i].isEmpty()) {
                    inlines.add(new Text(lines[i]));
                }
            }
            result.add(new Paragraph(inlines));
        }
        return result;
    }
}
