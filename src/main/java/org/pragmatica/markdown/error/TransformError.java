package org.pragmatica.markdown.error;

/**
 * Errors raised while transforming trees or running a conversion chain.
 */
public sealed interface TransformError extends MarkdownError {

    /**
     * A document node tag without a rule in the active visitor.
     */
    record UnhandledNodeType(String tag) implements TransformError {
        @Override
        public String message() {
            return "Unhandled type " + tag;
        }
    }

    /**
     * No converter is registered for the requested hop.
     */
    record UnsupportedConversion(String source, String target) implements TransformError {
        @Override
        public String message() {
            return "Unsupported transformation from " + source + " to " + target;
        }
    }

    record UnknownFormat(String name) implements TransformError {
        @Override
        public String message() {
            return "Unknown format " + name;
        }
    }

    /**
     * A converter needs an option the caller did not supply.
     */
    record MissingOption(String converter, String option) implements TransformError {
        @Override
        public String message() {
            return "Converter " + converter + " requires option '" + option + "'";
        }
    }

    /**
     * The input handed to a chain does not have the value type of its source format.
     */
    record UnexpectedValue(String format, String actualType) implements TransformError {
        @Override
        public String message() {
            return "Format " + format + " cannot hold a value of type " + actualType;
        }
    }

    /**
     * A bound value lacks a field the template needs for rendering.
     */
    record MissingValue(String name) implements TransformError {
        @Override
        public String message() {
            return "No value bound for '" + name + "'";
        }
    }

    record InvalidJson(String reason) implements TransformError {
        @Override
        public String message() {
            return "Invalid JSON tree: " + reason;
        }
    }
}
