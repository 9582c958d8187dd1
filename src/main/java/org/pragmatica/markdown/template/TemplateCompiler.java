package org.pragmatica.markdown.template;

import org.pragmatica.markdown.error.CompileError;
import org.pragmatica.markdown.parser.Combinator;
import org.pragmatica.markdown.tree.ClauseMarkers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.pragmatica.markdown.parser.Combinators.*;

/**
 * Compiles a template grammar into a parser description.
 *
 * <p>All structural checks happen here: an unknown variable type or grammar node fails the
 * compilation before any text is parsed. Clauses compiled inside a contract are wrapped in
 * {@link ClauseMarkers}.
 */
public final class TemplateCompiler {
    private static final Logger log = LoggerFactory.getLogger(TemplateCompiler.class);

    private static final Combinator CLAUSE_OPENING = sequence(literal(ClauseMarkers.OPENING_PREFIX),
                                                              quotedString(),
                                                              literal(ClauseMarkers.CLAUSE_ID),
                                                              quotedString(),
                                                              literal(ClauseMarkers.OPENING_SUFFIX));
    private static final Combinator CLAUSE_CLOSING = literal(ClauseMarkers.CLOSING);

    private TemplateCompiler() {}

    /**
     * Compile a single grammar node.
     *
     * @throws org.pragmatica.markdown.error.MarkdownException carrying a {@link CompileError}
     */
    public static TemplateParser compile(TemplateNode root) {
        log.debug("Compiling template rooted at {}", root.tag());
        return new TemplateParser(map(combinatorOf(root, BuildState.INITIAL), TemplateCompiler::asBoundValue));
    }

    /**
     * Compile a sequence of grammar nodes; parsing yields a {@link BoundValue.Sequence}.
     */
    public static TemplateParser compile(List<TemplateNode> nodes) {
        log.debug("Compiling template sequence of {} nodes", nodes.size());
        return new TemplateParser(map(childrenOf(nodes, BuildState.INITIAL), TemplateCompiler::toSequence));
    }

    static Combinator combinatorOf(TemplateNode node, BuildState state) {
        if (node instanceof TemplateNode.TextChunk chunk) {
            return literal(chunk.value());
        }
        if (node instanceof TemplateNode.Variable variable) {
            return variableOf(variable);
        }
        if (node instanceof TemplateNode.ConditionalBlock conditional) {
            return conditionalOf(conditional);
        }
        if (node instanceof TemplateNode.UnorderedListBlock list) {
            return map(childrenOf(list.nodes(), state), TemplateCompiler::toSequence);
        }
        if (node instanceof TemplateNode.ClauseBlock clause) {
            var content = compoundOf(clause.name(), clause.type(), clause.nodes(), state);
            return state.withinContract()
                   ? wrap(CLAUSE_OPENING, content, CLAUSE_CLOSING)
                   : content;
        }
        if (node instanceof TemplateNode.WithBlock with) {
            return compoundOf(with.name(), with.type(), with.nodes(), state);
        }
        if (node instanceof TemplateNode.ContractBlock contract) {
            return compoundOf(contract.name(), contract.type(), contract.nodes(), state.enterContract());
        }
        throw new CompileError.UnknownGrammarNodeType(node.tag()).toException();
    }

    private static Combinator childrenOf(List<TemplateNode> nodes, BuildState state) {
        var elements = new ArrayList<Combinator>(nodes.size());
        for (var child : nodes) {
            elements.add(combinatorOf(child, state));
        }
        return sequence(elements);
    }

    private static Combinator compoundOf(String name, String type, List<TemplateNode> nodes, BuildState state) {
        return map(childrenOf(nodes, state),
                   values -> new BoundValue.Compound(name, type, BoundValue.fieldsOf(toSequence(values))));
    }

    /**
     * A root that binds nothing (a bare text chunk) yields an empty sequence.
     */
    private static BoundValue asBoundValue(Object value) {
        return value instanceof BoundValue bound
               ? bound
               : new BoundValue.Sequence(List.of());
    }

    private static BoundValue.Sequence toSequence(Object values) {
        var bound = new ArrayList<BoundValue>();
        for (var value : (List<?>) values) {
            if (value instanceof BoundValue boundValue) {
                bound.add(boundValue);
            }
        }
        return new BoundValue.Sequence(bound);
    }

    // === Variables ===

    private static Combinator variableOf(TemplateNode.Variable variable) {
        return switch (variable.type()) {
            case "Enum" -> bind(variable, enumOf(variable.enumValues()), text -> text);
            case "Integer" -> bind(variable, digits(), Long::parseLong);
            case "Double" -> bind(variable, decimal(), Double::parseDouble);
            case "String" -> bind(variable, quotedString(), text -> text.substring(1, text.length() - 1));
            case "DateTime" -> bind(variable, DateTimeLiteral.lexeme(), DateTimeLiteral::parse);
            default -> throw new CompileError.UnknownVariableType(variable.name(), variable.type()).toException();
        };
    }

    private static Combinator enumOf(List<String> values) {
        var alternatives = new ArrayList<Combinator>(values.size());
        for (var value : values) {
            alternatives.add(literal(value));
        }
        return choice(alternatives);
    }

    private static Combinator bind(TemplateNode.Variable variable, Combinator lexeme, Function<String, Object> convert) {
        return map(lexeme,
                   text -> new BoundValue.Variable(variable.name(), variable.type(), convert.apply((String) text)));
    }

    /**
     * The longer literal is tried first, so a branch that is a prefix of the other cannot
     * shadow it.
     */
    private static Combinator conditionalOf(TemplateNode.ConditionalBlock conditional) {
        var whenTrue = literal(conditional.whenTrue());
        var whenFalse = literal(conditional.whenFalse());
        var alternatives = conditional.whenTrue().length() >= conditional.whenFalse().length()
                           ? choice(whenTrue, whenFalse)
                           : choice(whenFalse, whenTrue);
        return map(alternatives,
                   text -> new BoundValue.Variable(conditional.name(), "Boolean", conditional.whenTrue().equals(text)));
    }
}
