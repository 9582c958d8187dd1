package org.pragmatica.markdown.visitor;

import org.pragmatica.markdown.tree.DocumentNode;
import org.pragmatica.markdown.tree.DocumentNode.*;

/**
 * Collapses typed variables ({@code FormattedVariable}, {@code EnumVariable}) into plain
 * {@code Variable} nodes, dropping format strings and enumerations.
 */
public final class UntypeVisitor extends RebuildingVisitor {

    @Override
    public DocumentNode visitFormattedVariable(FormattedVariable node, Void param) {
        return new Variable(node.name(), node.value(), node.elementType(), node.identifiedBy());
    }

    @Override
    public DocumentNode visitEnumVariable(EnumVariable node, Void param) {
        return new Variable(node.name(), node.value(), node.elementType(), node.identifiedBy());
    }
}
