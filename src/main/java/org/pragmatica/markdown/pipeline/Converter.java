package org.pragmatica.markdown.pipeline;

/**
 * A single registered hop between two formats.
 */
public record Converter(String source, String target, Conversion conversion) {

    @FunctionalInterface
    public interface Conversion {
        Object apply(Object input, TransformOptions options);
    }

    public String name() {
        return source + "->" + target;
    }

    public Object apply(Object input, TransformOptions options) {
        return conversion.apply(input, options);
    }
}
