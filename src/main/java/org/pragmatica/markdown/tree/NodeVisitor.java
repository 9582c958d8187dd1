package org.pragmatica.markdown.tree;

import org.pragmatica.markdown.tree.DocumentNode.*;

/**
 * One rule per document node kind. Implementations are exhaustive by construction; a rule
 * that cannot handle its node raises {@code UnhandledNodeType}.
 *
 * @param <R> result of visiting a node
 * @param <P> context inherited from the parent
 */
public interface NodeVisitor<R, P> {
    R visitDocument(Document node, P param);

    R visitParagraph(Paragraph node, P param);

    R visitHeading(Heading node, P param);

    R visitList(ListNode node, P param);

    R visitListBlock(ListBlock node, P param);

    R visitItem(Item node, P param);

    R visitBlockQuote(BlockQuote node, P param);

    R visitCodeBlock(CodeBlock node, P param);

    R visitHtmlBlock(HtmlBlock node, P param);

    R visitThematicBreak(ThematicBreak node, P param);

    R visitText(Text node, P param);

    R visitEmph(Emph node, P param);

    R visitStrong(Strong node, P param);

    R visitCode(Code node, P param);

    R visitHtmlInline(HtmlInline node, P param);

    R visitLink(Link node, P param);

    R visitImage(Image node, P param);

    R visitLinebreak(Linebreak node, P param);

    R visitSoftbreak(Softbreak node, P param);

    R visitClause(Clause node, P param);

    R visitContract(Contract node, P param);

    R visitConditional(Conditional node, P param);

    R visitWithBlock(WithBlock node, P param);

    R visitVariable(Variable node, P param);

    R visitFormattedVariable(FormattedVariable node, P param);

    R visitEnumVariable(EnumVariable node, P param);

    R visitFormula(Formula node, P param);

    R visitOpaque(Opaque node, P param);
}
