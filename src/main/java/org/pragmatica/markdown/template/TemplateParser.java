package org.pragmatica.markdown.template;

import org.pragmatica.markdown.parser.Combinator;
import org.pragmatica.markdown.parser.CombinatorEngine;
import org.pragmatica.markdown.parser.Parser;

/**
 * A compiled template. Immutable and reusable: every call to {@link #parse(String)}
 * evaluates the same description with fresh state.
 */
public record TemplateParser(Combinator combinator) implements Parser<BoundValue> {

    @Override
    public BoundValue parse(String input) {
        return (BoundValue) CombinatorEngine.parse(combinator, normalizeNewlines(input));
    }

    /**
     * Drops carriage returns so CRLF text matches templates written with LF.
     */
    public static String normalizeNewlines(String input) {
        return input.replace("\r", "");
    }
}
