package org.pragmatica.markdown.visitor;

import org.pragmatica.markdown.tree.DocumentNode;
import org.pragmatica.markdown.tree.DocumentNode.*;

/**
 * Removes the quotes around String and identifying variable values.
 */
public final class UnquoteVisitor extends RebuildingVisitor {

    @Override
    public DocumentNode visitVariable(Variable node, Void param) {
        return new Variable(node.name(), unquoted(node), node.elementType(), node.identifiedBy());
    }

    @Override
    public DocumentNode visitFormattedVariable(FormattedVariable node, Void param) {
        return new FormattedVariable(node.name(), unquoted(node), node.elementType(), node.identifiedBy(), node.format());
    }

    @Override
    public DocumentNode visitEnumVariable(EnumVariable node, Void param) {
        return new EnumVariable(node.name(), unquoted(node), node.elementType(), node.identifiedBy(), node.enumValues());
    }

    @Override
    public DocumentNode visitFormula(Formula node, Void param) {
        return new Formula(node.name(), unquoted(node), node.elementType(), node.identifiedBy(), node.code());
    }

    private static String unquoted(VariableNode node) {
        return Visitors.isQuoted(node)
               ? Visitors.unquote(node.value())
               : node.value();
    }
}
