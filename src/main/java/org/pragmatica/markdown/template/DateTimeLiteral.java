package org.pragmatica.markdown.template;

import org.pragmatica.markdown.parser.Combinator;
import org.pragmatica.markdown.parser.Combinators;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.temporal.Temporal;

/**
 * ISO-8601 date/time literal as bound from text: {@code 2024-03-01}, {@code 2024-03-01T10:15},
 * {@code 2024-03-01T10:15:30.5+02:00}.
 *
 * <p>The matched text is kept next to the temporal value, so rendering writes back exactly the
 * precision that was parsed ({@code 10:15:00} stays {@code 10:15:00}).
 *
 * @param text  literal as it appeared in the input
 * @param value most specific temporal type for the literal
 */
public record DateTimeLiteral(String text, Temporal value) {
    private static final String REGEX =
        "[0-9]{4}-[0-9]{2}-[0-9]{2}(T[0-9]{2}:[0-9]{2}(:[0-9]{2}(\\.[0-9]+)?)?(Z|[+-][0-9]{2}:[0-9]{2})?)?";

    private static final Combinator LEXEME = Combinators.lexeme(REGEX, "date/time");

    public static Combinator lexeme() {
        return LEXEME;
    }

    /**
     * Convert matched text to a literal holding the most specific temporal type.
     *
     * @throws java.time.format.DateTimeParseException for out-of-range fields
     */
    public static DateTimeLiteral parse(String text) {
        return new DateTimeLiteral(text, temporalOf(text));
    }

    private static Temporal temporalOf(String text) {
        if (text.indexOf('T') < 0) {
            return LocalDate.parse(text);
        }
        if (text.endsWith("Z") || text.lastIndexOf('+') > 0 || text.lastIndexOf('-') > text.indexOf('T')) {
            return OffsetDateTime.parse(text);
        }
        return LocalDateTime.parse(text);
    }

    /**
     * Text for a bound date/time: the original literal, or ISO form for a plain temporal.
     */
    public static String format(Object value) {
        if (value instanceof DateTimeLiteral literal) {
            return literal.text();
        }
        return value.toString();
    }

    @Override
    public String toString() {
        return text;
    }
}
