package org.pragmatica.markdown.error;

/**
 * Root of the error taxonomy. Every failure raised by the library is described by one of
 * the sealed variants and delivered to the caller inside a {@link MarkdownException}.
 */
public sealed interface MarkdownError permits CompileError, ParseError, TransformError {
    /**
     * Human-readable description.
     */
    String message();

    /**
     * Wrap this error into an exception ready to be thrown.
     */
    default MarkdownException toException() {
        return new MarkdownException(this);
    }
}
