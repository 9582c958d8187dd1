package org.pragmatica.markdown.error;

import org.pragmatica.markdown.parser.SourceLocation;

/**
 * Input text did not match a compiled template. The location is the furthest position the
 * parser reached, the expectation lists what would have been accepted there.
 */
public sealed interface ParseError extends MarkdownError {
    SourceLocation location();

    String expected();

    /**
     * Unexpected input.
     */
    record UnexpectedInput(SourceLocation location, String found, String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected '" + found + "' at " + location + ", expected " + expected;
        }
    }

    /**
     * Unexpected end of input.
     */
    record UnexpectedEof(SourceLocation location, String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected end of input at " + location + ", expected " + expected;
        }
    }

    /**
     * Render the error against the parsed text.
     *
     * <p>Example output:
     * <pre>
     * error: Unexpected 'x' at 1:9, expected '"'
     *  --> 1:9
     *   |
     * 1 | Seller: xSteve
     *   |         ^
     * </pre>
     */
    default String report(String input) {
        var lines = input.split("\n", -1);
        var loc = location();
        var lineNum = loc.line();
        var gutterWidth = String.valueOf(lineNum).length();
        var gutter = " ".repeat(gutterWidth + 1);
        var sb = new StringBuilder();

        sb.append("error: ").append(message()).append("\n");
        sb.append(" --> ").append(loc).append("\n");
        sb.append(gutter).append("|\n");
        if (lineNum >= 1 && lineNum <= lines.length) {
            sb.append(String.format("%" + gutterWidth + "d", lineNum))
              .append(" | ")
              .append(lines[lineNum - 1])
              .append("\n");
            sb.append(gutter)
              .append("| ")
              .append(" ".repeat(Math.max(0, loc.column() - 1)))
              .append("^\n");
        }
        return sb.toString();
    }
}
