package org.pragmatica.markdown.parser;

/**
 * Mutable state of a single parse call: current position and the furthest failure seen.
 * Created fresh by {@link CombinatorEngine} for every input and never shared.
 */
final class ParsingContext {

    private final String input;

    private int pos;
    private int line;
    private int column;
    private int furthestPos;
    private int furthestLine;
    private int furthestColumn;
    private String furthestExpected;

    private ParsingContext(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
        this.furthestPos = 0;
        this.furthestLine = 1;
        this.furthestColumn = 1;
        this.furthestExpected = "";
    }

    static ParsingContext create(String input) {
        return new ParsingContext(input);
    }

    // === Position Management ===

    int pos() {
        return pos;
    }

    SourceLocation location() {
        return SourceLocation.at(line, column, pos);
    }

    void restoreLocation(SourceLocation loc) {
        this.pos = loc.offset();
        this.line = loc.line();
        this.column = loc.column();
    }

    boolean isAtEnd() {
        return pos >= input.length();
    }

    int remaining() {
        return input.length() - pos;
    }

    // === Character Access ===

    char peek() {
        return input.charAt(pos);
    }

    char peek(int offset) {
        return input.charAt(pos + offset);
    }

    void advance(int count) {
        for (int i = 0; i < count; i++) {
            char c = input.charAt(pos++);
            if (c == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
    }

    String input() {
        return input;
    }

    // === Error Tracking ===

    void updateFurthest(String expected) {
        if (pos > furthestPos) {
            furthestPos = pos;
            furthestLine = line;
            furthestColumn = column;
            furthestExpected = expected;
        } else if (pos == furthestPos && !furthestExpected.contains(expected)) {
            furthestExpected = furthestExpected.isEmpty()
                               ? expected
                               : furthestExpected + " or " + expected;
        }
    }

    SourceLocation furthestLocation() {
        return SourceLocation.at(furthestLine, furthestColumn, furthestPos);
    }

    String furthestExpected() {
        return furthestExpected;
    }
}
