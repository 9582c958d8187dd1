package org.pragmatica.markdown.parser;

/**
 * Position of a parse failure: line and column count from 1, offset from 0.
 */
public record SourceLocation(int line, int column, int offset) {

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
