package org.pragmatica.markdown.parser;

/**
 * Parser interface - recovers a typed value from input text.
 *
 * <p>Implementations are immutable and may be shared between threads.
 */
public interface Parser<T> {

    /**
     * Parse the whole input.
     *
     * @throws org.pragmatica.markdown.error.MarkdownException carrying a
     *         {@link org.pragmatica.markdown.error.ParseError} on mismatch
     */
    T parse(String input);
}
