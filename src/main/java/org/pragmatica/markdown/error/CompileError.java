package org.pragmatica.markdown.error;

/**
 * Errors detected while compiling a template grammar, before any input text is examined.
 */
public sealed interface CompileError extends MarkdownError {

    /**
     * A variable declares a type with no known lexical grammar.
     */
    record UnknownVariableType(String name, String type) implements CompileError {
        @Override
        public String message() {
            return "Unknown variable type " + type + " for variable '" + name + "'";
        }
    }

    /**
     * A grammar node tag the compiler has no rule for.
     */
    record UnknownGrammarNodeType(String tag) implements CompileError {
        @Override
        public String message() {
            return "Unknown template grammar node " + tag;
        }
    }
}
