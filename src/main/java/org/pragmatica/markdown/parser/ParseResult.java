package org.pragmatica.markdown.parser;

/**
 * Result of evaluating one combinator - either a value with the new position, or failure.
 */
sealed interface ParseResult {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Successful match.
     */
    record Success(Object value, SourceLocation endLocation) implements ParseResult {
        @Override
        public boolean isSuccess() {
            return true;
        }

        static Success of(Object value, SourceLocation endLocation) {
            return new Success(value, endLocation);
        }
    }

    /**
     * No match at the given position.
     */
    record Failure(SourceLocation location, String expected) implements ParseResult {
        @Override
        public boolean isSuccess() {
            return false;
        }

        static Failure at(SourceLocation location, String expected) {
            return new Failure(location, expected);
        }
    }
}
