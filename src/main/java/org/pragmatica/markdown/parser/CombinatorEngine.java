package org.pragmatica.markdown.parser;

import org.pragmatica.markdown.error.MarkdownException;
import org.pragmatica.markdown.error.ParseError;

import java.util.ArrayList;
import java.util.Collections;

/**
 * Interprets {@link Combinator} descriptions against input text.
 *
 * <p>The engine is stateless; all per-call state lives in a {@link ParsingContext}.
 * Choices commit to the first successful alternative, sequences never revisit an element
 * once it matched.
 */
public final class CombinatorEngine {

    private CombinatorEngine() {}

    /**
     * Parse the whole input with the given description.
     *
     * @return the result value of the root combinator
     * @throws MarkdownException carrying a {@link ParseError} if the input does not match
     *                           or is not fully consumed
     */
    public static Object parse(Combinator root, String input) {
        var ctx = ParsingContext.create(input);
        var result = parseCombinator(ctx, root);

        if (result instanceof ParseResult.Success success) {
            if (ctx.isAtEnd()) {
                return success.value();
            }
            ctx.updateFurthest("end of input");
        }
        throw failureAtFurthest(ctx).toException();
    }

    private static ParseError failureAtFurthest(ParsingContext ctx) {
        var location = ctx.furthestLocation();
        var expected = ctx.furthestExpected().isEmpty()
                       ? "end of input"
                       : ctx.furthestExpected();
        var input = ctx.input();
        if (location.offset() >= input.length()) {
            return new ParseError.UnexpectedEof(location, expected);
        }
        return new ParseError.UnexpectedInput(location, String.valueOf(input.charAt(location.offset())), expected);
    }

    // === Dispatch ===

    private static ParseResult parseCombinator(ParsingContext ctx, Combinator combinator) {
        if (combinator instanceof Combinator.Literal lit) {
            return parseLiteral(ctx, lit);
        }
        if (combinator instanceof Combinator.Lexeme lex) {
            return parseLexeme(ctx, lex);
        }
        if (combinator instanceof Combinator.Sequence seq) {
            return parseSequence(ctx, seq);
        }
        if (combinator instanceof Combinator.Choice choice) {
            return parseChoice(ctx, choice);
        }
        if (combinator instanceof Combinator.Wrap wrap) {
            return parseWrap(ctx, wrap);
        }
        if (combinator instanceof Combinator.Map map) {
            return parseMap(ctx, map);
        }
        throw new IllegalStateException("Unexpected combinator " + combinator.getClass().getName());
    }

    // === Terminals ===

    private static ParseResult parseLiteral(ParsingContext ctx, Combinator.Literal lit) {
        var text = lit.text();
        if (ctx.remaining() < text.length()) {
            return fail(ctx, lit.describe(), matchedPrefix(ctx, text));
        }

        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) != ctx.peek(i)) {
                return fail(ctx, lit.describe(), i);
            }
        }

        ctx.advance(text.length());
        return ParseResult.Success.of(text, ctx.location());
    }

    private static int matchedPrefix(ParsingContext ctx, String text) {
        int i = 0;
        while (i < ctx.remaining() && text.charAt(i) == ctx.peek(i)) {
            i++;
        }
        return i;
    }

    private static ParseResult parseLexeme(ParsingContext ctx, Combinator.Lexeme lex) {
        var matcher = lex.pattern()
                         .matcher(ctx.input());
        matcher.region(ctx.pos(), ctx.input().length());
        if (!matcher.lookingAt()) {
            return fail(ctx, lex.describe(), 0);
        }
        var text = matcher.group();
        ctx.advance(text.length());
        return ParseResult.Success.of(text, ctx.location());
    }

    /**
     * Record a failure. Partially matched literals report the offending character
     * rather than the start of the literal.
     */
    private static ParseResult fail(ParsingContext ctx, String expected, int matched) {
        var start = ctx.location();
        if (matched > 0) {
            ctx.advance(matched);
            ctx.updateFurthest(expected);
            ctx.restoreLocation(start);
        } else {
            ctx.updateFurthest(expected);
        }
        return ParseResult.Failure.at(start, expected);
    }

    // === Combinators ===

    private static ParseResult parseSequence(ParsingContext ctx, Combinator.Sequence seq) {
        var startLoc = ctx.location();
        var values = new ArrayList<>();

        for (var element : seq.elements()) {
            var result = parseCombinator(ctx, element);
            if (result instanceof ParseResult.Success success) {
                values.add(success.value());
            } else {
                ctx.restoreLocation(startLoc);
                return result;
            }
        }

        return ParseResult.Success.of(Collections.unmodifiableList(values), ctx.location());
    }

    private static ParseResult parseChoice(ParsingContext ctx, Combinator.Choice choice) {
        var startLoc = ctx.location();
        ParseResult lastFailure = null;

        for (var alt : choice.alternatives()) {
            var result = parseCombinator(ctx, alt);
            if (result.isSuccess()) {
                return result;
            }
            lastFailure = result;
            ctx.restoreLocation(startLoc);
        }

        return lastFailure != null
               ? lastFailure
               : ParseResult.Failure.at(startLoc, "one of alternatives");
    }

    private static ParseResult parseWrap(ParsingContext ctx, Combinator.Wrap wrap) {
        var startLoc = ctx.location();

        var before = parseCombinator(ctx, wrap.before());
        if (before.isFailure()) {
            return before;
        }
        var inner = parseCombinator(ctx, wrap.inner());
        if (inner.isFailure()) {
            ctx.restoreLocation(startLoc);
            return inner;
        }
        var after = parseCombinator(ctx, wrap.after());
        if (after.isFailure()) {
            ctx.restoreLocation(startLoc);
            return after;
        }
        return ParseResult.Success.of(((ParseResult.Success) inner).value(), ctx.location());
    }

    private static ParseResult parseMap(ParsingContext ctx, Combinator.Map map) {
        var startLoc = ctx.location();
        var result = parseCombinator(ctx, map.inner());
        if (result instanceof ParseResult.Success success) {
            try {
                return ParseResult.Success.of(map.mapper().apply(success.value()), success.endLocation());
            } catch (RuntimeException e) {
                ctx.restoreLocation(startLoc);
                var expected = map.describe() + " (" + e.getMessage() + ")";
                ctx.updateFurthest(expected);
                return ParseResult.Failure.at(startLoc, expected);
            }
        }
        return result;
    }
}
