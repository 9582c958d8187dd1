package org.pragmatica.markdown.template;

import org.pragmatica.markdown.error.CompileError;
import org.pragmatica.markdown.error.TransformError;
import org.pragmatica.markdown.tree.DocumentNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds a CiceroMark tree from bound data and the template it was parsed with.
 *
 * <p>The tree serializes to the same markdown {@link TemplateRenderer} produces: text chunks
 * are split into paragraphs at blank lines and into soft breaks at single newlines, variables
 * become variable nodes holding their rendered value, conditionals keep both branches, and
 * clauses inside a contract become {@code Clause} blocks. Contracts, with-blocks, lists and
 * clauses outside a contract contribute their content only.
 */
public final class DocumentBuilder {
    private final List<DocumentNode> blocks = new ArrayList<>();
    private List<DocumentNode> inlines = new ArrayList<>();
    private int pendingNewlines;

    private DocumentBuilder() {}

    public static DocumentNode.Document build(TemplateNode root, BoundValue value) {
        var builder = new DocumentBuilder();
        var compound = TemplateRenderer.compoundNodes(root);
        if (compound != null) {
            if (!(value instanceof BoundValue.Compound bound)) {
                throw new TransformError.MissingValue(TemplateRenderer.nameOf(root)).toException();
            }
            var state = root instanceof TemplateNode.ContractBlock
                        ? BuildState.INITIAL.enterContract()
                        : BuildState.INITIAL;
            builder.addAll(compound, bound.fields(), state);
        } else {
            builder.add(root, BoundValue.fieldsOf(value), BuildState.INITIAL);
        }
        return new DocumentNode.Document(builder.finish());
    }

    public static DocumentNode.Document build(List<TemplateNode> nodes, BoundValue value) {
        var builder = new DocumentBuilder();
        builder.addAll(nodes, BoundValue.fieldsOf(value), BuildState.INITIAL);
        return new DocumentNode.Document(builder.finish());
    }

    private void addAll(List<TemplateNode> nodes, Map<String, Object> scope, BuildState state) {
        for (var node : nodes) {
            add(node, scope, state);
        }
    }

    private void add(TemplateNode node, Map<String, Object> scope, BuildState state) {
        if (node instanceof TemplateNode.TextChunk chunk) {
            text(chunk.value());
        } else if (node instanceof TemplateNode.Variable variable) {
            inline(variableNode(variable, TemplateRenderer.lookup(scope, variable.name())));
        } else if (node instanceof TemplateNode.ConditionalBlock conditional) {
            var isTrue = Boolean.TRUE.equals(TemplateRenderer.lookup(scope, conditional.name()));
            var whenTrue = textNodes(conditional.whenTrue());
            var whenFalse = textNodes(conditional.whenFalse());
            inline(new DocumentNode.Conditional(conditional.name(),
                                                isTrue,
                                                whenTrue,
                                                whenFalse,
                                                isTrue ? whenTrue : whenFalse));
        } else if (node instanceof TemplateNode.UnorderedListBlock list) {
            addAll(list.nodes(), scope, state);
        } else if (node instanceof TemplateNode.ClauseBlock clause) {
            var clauseScope = TemplateRenderer.nestedScope(scope, clause.name());
            if (state.withinContract()) {
                var body = new DocumentBuilder();
                body.addAll(clause.nodes(), clauseScope, state);
                closeParagraph();
                blocks.add(new DocumentNode.Clause(clause.name(), clause.type(), body.finish()));
            } else {
                addAll(clause.nodes(), clauseScope, state);
            }
        } else if (node instanceof TemplateNode.WithBlock with) {
            addAll(with.nodes(), TemplateRenderer.nestedScope(scope, with.name()), state);
        } else if (node instanceof TemplateNode.ContractBlock contract) {
            addAll(contract.nodes(), TemplateRenderer.nestedScope(scope, contract.name()), state.enterContract());
        } else {
            throw new CompileError.UnknownGrammarNodeType(node.tag()).toException();
        }
    }

    private static DocumentNode variableNode(TemplateNode.Variable variable, Object value) {
        var text = TemplateRenderer.formatVariable(variable, value);
        if ("Enum".equals(variable.type())) {
            return new DocumentNode.EnumVariable(variable.name(), text, variable.type(), false, variable.enumValues());
        }
        return new DocumentNode.Variable(variable.name(), text, variable.type(), false);
    }

    private static List<DocumentNode> textNodes(String text) {
        return text.isEmpty()
               ? List.of()
               : List.of(new DocumentNode.Text(text));
    }

    // === Paragraph assembly ===

    private void text(String value) {
        var lines = value.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                pendingNewlines++;
            }
            if (!lines[i].isEmpty()) {
                inline(new DocumentNode.Text(lines[i]));
            }
        }
    }

    private void inline(DocumentNode node) {
        if (pendingNewlines >= 2) {
            closeParagraph();
        } else if (pendingNewlines == 1 && !inlines.isEmpty()) {
            inlines.add(new DocumentNode.Softbreak());
        }
        pendingNewlines = 0;
        var last = inlines.isEmpty()
                   ? null
                   : inlines.get(inlines.size() - 1);
        if (last instanceof DocumentNode.Text previous && node instanceof DocumentNode.Text text) {
            inlines.set(inlines.size() - 1, new DocumentNode.Text(previous.text() + text.text()));
        } else {
            inlines.add(node);
        }
    }

    private void closeParagraph() {
        if (!inlines.isEmpty()) {
            blocks.add(new DocumentNode.Paragraph(inlines));
            inlines = new ArrayList<>();
        }
        pendingNewlines = 0;
    }

    private List<DocumentNode> finish() {
        closeParagraph();
        return blocks;
    }
}
