package org.pragmatica.markdown.error;

/**
 * Unchecked exception carrying a {@link MarkdownError}. Raised synchronously, never retried
 * and never accompanied by a partial result.
 */
public final class MarkdownException extends RuntimeException {
    private final MarkdownError error;

    public MarkdownException(MarkdownError error) {
        super(error.message());
        this.error = error;
    }

    public MarkdownException(MarkdownError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public MarkdownError error() {
        return error;
    }
}
