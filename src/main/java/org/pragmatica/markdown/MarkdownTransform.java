package org.pragmatica.markdown;

import org.pragmatica.markdown.pipeline.FormatRegistry;
import org.pragmatica.markdown.pipeline.Pipeline;
import org.pragmatica.markdown.pipeline.TransformOptions;
import org.pragmatica.markdown.pipeline.TransformationDiagram;
import org.pragmatica.markdown.template.TemplateCompiler;
import org.pragmatica.markdown.template.TemplateNode;
import org.pragmatica.markdown.template.TemplateNodeCodec;
import org.pragmatica.markdown.template.TemplateParser;

import java.util.List;

/**
 * Entry point for template compilation and document conversion.
 *
 * <p>Example usage:
 * <pre>{@code
 * var parser = MarkdownTransform.compileTemplate(List.of(
 *     new TemplateNode.TextChunk("Seller: "),
 *     TemplateNode.Variable.of("seller", "String")));
 *
 * var data = parser.parse("Seller: \"Steve\"");
 *
 * var markdown = MarkdownTransform.transform(document, "ciceromark", List.of("markdown"));
 * }</pre>
 */
public final class MarkdownTransform {
    private static final Pipeline STANDARD = new Pipeline(FormatRegistry.standard());

    private MarkdownTransform() {}

    /**
     * Compile a grammar tree into a reusable parser.
     */
    public static TemplateParser compileTemplate(TemplateNode grammar) {
        return TemplateCompiler.compile(grammar);
    }

    /**
     * Compile a bare sequence of grammar nodes.
     */
    public static TemplateParser compileTemplate(List<TemplateNode> grammar) {
        return TemplateCompiler.compile(grammar);
    }

    /**
     * Compile a grammar given in its JSON form.
     */
    public static TemplateParser compileTemplate(String grammarJson) {
        return TemplateCompiler.compile(TemplateNodeCodec.fromJson(grammarJson));
    }

    public static Object transform(Object input, String source, List<String> targets) {
        return transform(input, source, targets, TransformOptions.DEFAULT);
    }

    public static Object transform(Object input, String source, List<String> targets, TransformOptions options) {
        return STANDARD.transform(input, source, targets, options);
    }

    /**
     * PlantUML diagram of the built-in formats and converters.
     */
    public static String transformationDiagram() {
        return TransformationDiagram.render(STANDARD.registry());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private TemplateNode template;
        private boolean verbose;
        private FormatRegistry registry = FormatRegistry.standard();

        private Builder() {}

        public Builder template(TemplateNode grammar) {
            this.template = grammar;
            return this;
        }

        public Builder verbose(boolean enabled) {
            this.verbose = enabled;
            return this;
        }

        public Builder registry(FormatRegistry formats) {
            this.registry = formats;
            return this;
        }

        public TransformOptions options() {
            var options = TransformOptions.DEFAULT.withVerbose(verbose);
            return template == null
                   ? options
                   : options.withTemplate(template);
        }

        public Transformer build() {
            return new Transformer(new Pipeline(registry), options());
        }
    }

    /**
     * Pipeline bound to a fixed set of options.
     */
    public record Transformer(Pipeline pipeline, TransformOptions options) {

        public Object transform(Object input, String source, List<String> targets) {
            return pipeline.transform(input, source, targets, options);
        }

        public Object transform(Object input, String source, String target) {
            return transform(input, source, List.of(target));
        }
    }
}
