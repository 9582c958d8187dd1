package org.pragmatica.markdown.visitor;

import org.pragmatica.markdown.error.MarkdownException;
import org.pragmatica.markdown.error.TransformError;
import org.pragmatica.markdown.tree.DocumentNode;

/**
 * Helpers shared by the visitor rule tables.
 */
public final class Visitors {
    private Visitors() {}

    /**
     * The error raised when a rule table has no rule for a node.
     */
    public static MarkdownException unhandled(DocumentNode node) {
        return new TransformError.UnhandledNodeType(node.tag()).toException();
    }

    /**
     * Text of a formatted sub-tree: follows the first child down to a {@code Text} leaf.
     * Only the first run is returned, siblings are ignored.
     */
    public static String firstText(DocumentNode node) {
        if (node instanceof DocumentNode.Text text) {
            return text.text();
        }
        if (node.nodes().isEmpty()) {
            return "";
        }
        return firstText(node.nodes().get(0));
    }

    /**
     * Strips one pair of matching outer quote characters.
     */
    public static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            if ((first == '"' || first == '\'') && value.charAt(value.length() - 1) == first) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }

    /**
     * Whether the variable's value is stored quoted.
     */
    public static boolean isQuoted(DocumentNode.VariableNode variable) {
        return "String".equals(variable.elementType()) || variable.identifiedBy();
    }
}
