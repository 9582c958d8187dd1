package org.pragmatica.markdown.parser;

import java.util.List;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Parser description - plain immutable data interpreted by {@link CombinatorEngine}.
 * The same description can be evaluated any number of times, from any thread.
 */
public sealed interface Combinator {

    /**
     * Human-readable description used in "expected ..." messages.
     */
    String describe();

    // === Terminals ===

    /**
     * Exact text match. Result: the matched text.
     */
    record Literal(String text) implements Combinator {
        @Override
        public String describe() {
            return "'" + text + "'";
        }
    }

    /**
     * Regular-expression token anchored at the current position. Result: the matched text.
     */
    record Lexeme(Pattern pattern, String expected) implements Combinator {
        @Override
        public String describe() {
            return expected;
        }
    }

    // === Combinators ===

    /**
     * All elements in order, contiguous. Result: list of element results.
     */
    record Sequence(List<Combinator> elements) implements Combinator {
        public Sequence {
            elements = List.copyOf(elements);
        }

        @Override
        public String describe() {
            return elements.isEmpty()
                   ? "nothing"
                   : elements.get(0).describe();
        }
    }

    /**
     * Ordered choice, first matching alternative wins. Result: that alternative's result.
     */
    record Choice(List<Combinator> alternatives) implements Combinator {
        public Choice {
            alternatives = List.copyOf(alternatives);
        }

        @Override
        public String describe() {
            var sb = new StringBuilder();
            for (var alt : alternatives) {
                if (sb.length() > 0) {
                    sb.append(" or ");
                }
                sb.append(alt.describe());
            }
            return sb.toString();
        }
    }

    /**
     * Envelope: {@code before inner after}. Result: the inner result only.
     */
    record Wrap(Combinator before, Combinator inner, Combinator after) implements Combinator {
        @Override
        public String describe() {
            return before.describe();
        }
    }

    /**
     * Transforms the result of a successful match.
     */
    record Map(Combinator inner, Function<Object, Object> mapper) implements Combinator {
        @Override
        public String describe() {
            return inner.describe();
        }
    }
}
