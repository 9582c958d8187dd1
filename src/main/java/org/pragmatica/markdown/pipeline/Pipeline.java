package org.pragmatica.markdown.pipeline;

import org.pragmatica.markdown.error.TransformError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs an explicit chain of conversions, each hop feeding the next.
 *
 * <p>The chain is taken as given: no search for intermediate formats is done,
 * and a hop without a registered converter fails the whole call.
 */
public final class Pipeline {
    private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

    private final FormatRegistry registry;

    public Pipeline(FormatRegistry registry) {
        this.registry = registry;
    }

    public FormatRegistry registry() {
        return registry;
    }

    /**
     * Convert {@code input} from {@code source} through each of {@code targets} in order.
     *
     * @return the value in the last target format, or {@code input} when {@code targets} is empty
     */
    public Object transform(Object input, String source, List<String> targets, TransformOptions options) {
        var sourceFormat = registry.format(source);
        if (!sourceFormat.accepts(input)) {
            throw new TransformError.UnexpectedValue(source, typeName(input)).toException();
        }
        // Resolve the whole chain before running any hop.
        var chain = new ArrayList<Converter>();
        var current = source;
        for (var target : targets) {
            registry.format(target);
            var from = current;
            chain.add(registry.converter(from, target)
                              .orElseThrow(() -> new TransformError.UnsupportedConversion(from, target).toException()));
            current = target;
        }

        var value = input;
        for (var converter : chain) {
            logHop(options, converter);
            value = converter.apply(value, options);
        }
        return value;
    }

    private static void logHop(TransformOptions options, Converter converter) {
        if (options.verbose()) {
            log.info("Converting {} to {}", converter.source(), converter.target());
        } else {
            log.debug("Converting {} to {}", converter.source(), converter.target());
        }
    }

    private static String typeName(Object value) {
        return value == null
               ? "null"
               : value.getClass()
                      .getSimpleName();
    }
}
