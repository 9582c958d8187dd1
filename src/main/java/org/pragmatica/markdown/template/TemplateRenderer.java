package org.pragmatica.markdown.template;

import org.pragmatica.markdown.error.CompileError;
import org.pragmatica.markdown.error.TransformError;
import org.pragmatica.markdown.tree.ClauseMarkers;

import java.util.List;
import java.util.Map;

/**
 * Renders bound data back into text through the template it was parsed with.
 *
 * <p>Text is produced in canonical form: strings quoted, numbers without redundant digits,
 * temporals in ISO-8601. Clauses inside a contract are written between
 * {@link ClauseMarkers} using the clause type as {@code src} and its name as
 * {@code clauseid}. For canonical text, parsing the rendered output yields the
 * original value again.
 */
public final class TemplateRenderer {

    private TemplateRenderer() {}

    public static String render(TemplateNode root, BoundValue value) {
        var sb = new StringBuilder();
        var compound = compoundNodes(root);
        if (compound != null) {
            if (!(value instanceof BoundValue.Compound bound)) {
                throw new TransformError.MissingValue(nameOf(root)).toException();
            }
            var state = root instanceof TemplateNode.ContractBlock
                        ? BuildState.INITIAL.enterContract()
                        : BuildState.INITIAL;
            renderAll(sb, compound, bound.fields(), state);
        } else {
            renderNode(sb, root, BoundValue.fieldsOf(value), BuildState.INITIAL);
        }
        return sb.toString();
    }

    public static String render(List<TemplateNode> nodes, BoundValue value) {
        var sb = new StringBuilder();
        renderAll(sb, nodes, BoundValue.fieldsOf(value), BuildState.INITIAL);
        return sb.toString();
    }

    private static void renderAll(StringBuilder sb, List<TemplateNode> nodes, Map<String, Object> scope, BuildState state) {
        for (var node : nodes) {
            renderNode(sb, node, scope, state);
        }
    }

    private static void renderNode(StringBuilder sb, TemplateNode node, Map<String, Object> scope, BuildState state) {
        if (node instanceof TemplateNode.TextChunk chunk) {
            sb.append(chunk.value());
        } else if (node instanceof TemplateNode.Variable variable) {
            sb.append(formatVariable(variable, lookup(scope, variable.name())));
        } else if (node instanceof TemplateNode.ConditionalBlock conditional) {
            var flag = lookup(scope, conditional.name());
            sb.append(Boolean.TRUE.equals(flag)
                      ? conditional.whenTrue()
                      : conditional.whenFalse());
        } else if (node instanceof TemplateNode.UnorderedListBlock list) {
            renderAll(sb, list.nodes(), scope, state);
        } else if (node instanceof TemplateNode.ClauseBlock clause) {
            var content = new StringBuilder();
            renderAll(content, clause.nodes(), nestedScope(scope, clause.name()), state);
            sb.append(state.withinContract()
                      ? ClauseMarkers.wrap(clause.type(), clause.name(), content.toString())
                      : content.toString());
        } else if (node instanceof TemplateNode.WithBlock with) {
            renderAll(sb, with.nodes(), nestedScope(scope, with.name()), state);
        } else if (node instanceof TemplateNode.ContractBlock contract) {
            renderAll(sb, contract.nodes(), nestedScope(scope, contract.name()), state.enterContract());
        } else {
            throw new CompileError.UnknownGrammarNodeType(node.tag()).toException();
        }
    }

    static Object lookup(Map<String, Object> scope, String name) {
        if (!scope.containsKey(name)) {
            throw new TransformError.MissingValue(name).toException();
        }
        return scope.get(name);
    }

    static Map<String, Object> nestedScope(Map<String, Object> scope, String name) {
        if (lookup(scope, name) instanceof BoundValue.Compound compound) {
            return compound.fields();
        }
        throw new TransformError.MissingValue(name).toException();
    }

    static List<TemplateNode> compoundNodes(TemplateNode node) {
        if (node instanceof TemplateNode.ClauseBlock clause) {
            return clause.nodes();
        }
        if (node instanceof TemplateNode.WithBlock with) {
            return with.nodes();
        }
        if (node instanceof TemplateNode.ContractBlock contract) {
            return contract.nodes();
        }
        return null;
    }

    static String nameOf(TemplateNode node) {
        if (node instanceof TemplateNode.ClauseBlock clause) {
            return clause.name();
        }
        if (node instanceof TemplateNode.WithBlock with) {
            return with.name();
        }
        if (node instanceof TemplateNode.ContractBlock contract) {
            return contract.name();
        }
        return node.tag();
    }

    // === Values ===

    static String formatVariable(TemplateNode.Variable variable, Object value) {
        return switch (variable.type()) {
            case "String" -> "\"" + value + "\"";
            case "Integer", "Enum" -> String.valueOf(value);
            case "Double" -> formatDouble(((Number) value).doubleValue());
            case "DateTime" -> DateTimeLiteral.format(value);
            default -> throw new CompileError.UnknownVariableType(variable.name(), variable.type()).toException();
        };
    }

    static String formatDouble(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return String.valueOf((long) value);
        }
        return Double.toString(value);
    }
}
