package org.pragmatica.markdown.parser;

import java.util.List;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Factory methods for {@link Combinator} descriptions.
 */
public final class Combinators {
    private static final Combinator.Lexeme DIGITS =
        new Combinator.Lexeme(Pattern.compile("[0-9]+"), "digits");
    private static final Combinator.Lexeme DECIMAL =
        new Combinator.Lexeme(Pattern.compile("[0-9]+(\\.[0-9]+)?([eE][+-]?[0-9]+)?"), "number");
    private static final Combinator.Lexeme QUOTED_STRING =
        new Combinator.Lexeme(Pattern.compile("\"[^\"]*\""), "quoted string");

    private Combinators() {}

    public static Combinator literal(String text) {
        return new Combinator.Literal(text);
    }

    /**
     * One or more decimal digits.
     */
    public static Combinator digits() {
        return DIGITS;
    }

    /**
     * Digits with optional fractional part and optional signed exponent.
     */
    public static Combinator decimal() {
        return DECIMAL;
    }

    /**
     * A double-quoted literal, quotes included in the matched text.
     */
    public static Combinator quotedString() {
        return QUOTED_STRING;
    }

    public static Combinator lexeme(String regex, String expected) {
        return new Combinator.Lexeme(Pattern.compile(regex), expected);
    }

    public static Combinator sequence(List<Combinator> elements) {
        return new Combinator.Sequence(elements);
    }

    public static Combinator sequence(Combinator... elements) {
        return new Combinator.Sequence(List.of(elements));
    }

    public static Combinator choice(List<Combinator> alternatives) {
        return new Combinator.Choice(alternatives);
    }

    public static Combinator choice(Combinator... alternatives) {
        return new Combinator.Choice(List.of(alternatives));
    }

    public static Combinator wrap(Combinator before, Combinator inner, Combinator after) {
        return new Combinator.Wrap(before, inner, after);
    }

    public static Combinator map(Combinator inner, Function<Object, Object> mapper) {
        return new Combinator.Map(inner, mapper);
    }
}
