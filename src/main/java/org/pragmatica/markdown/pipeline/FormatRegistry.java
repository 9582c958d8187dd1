package org.pragmatica.markdown.pipeline;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.pragmatica.markdown.error.TransformError;
import org.pragmatica.markdown.template.BoundValue;
import org.pragmatica.markdown.template.DocumentBuilder;
import org.pragmatica.markdown.template.TemplateCompiler;
import org.pragmatica.markdown.template.TemplateNode;
import org.pragmatica.markdown.template.TemplateRenderer;
import org.pragmatica.markdown.tree.DocumentNode;
import org.pragmatica.markdown.tree.DocumentNodeCodec;
import org.pragmatica.markdown.visitor.FromCommonMarkVisitor;
import org.pragmatica.markdown.visitor.MarkdownVisitor;
import org.pragmatica.markdown.visitor.PdfMakeVisitor;
import org.pragmatica.markdown.visitor.ToCommonMarkVisitor;
import org.pragmatica.markdown.visitor.UnquoteVisitor;
import org.pragmatica.markdown.visitor.UntypeVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Named formats and the converters between them.
 *
 * <p>A registry is filled once and then only read, so a populated instance may be shared.
 */
public final class FormatRegistry {
    private static final Logger log = LoggerFactory.getLogger(FormatRegistry.class);

    public static final String MARKDOWN = "markdown";
    public static final String COMMONMARK = "commonmark";
    public static final String CICEROMARK = "ciceromark";
    public static final String CICEROMARK_UNQUOTED = "ciceromark_unquoted";
    public static final String CICEROMARK_UNTYPED = "ciceromark_untyped";
    public static final String PDFMAKE = "pdfmake";
    public static final String DATA = "data";

    private final Map<String, Format> formats = new LinkedHashMap<>();
    private final Map<String, Converter> converters = new LinkedHashMap<>();

    public FormatRegistry register(Format format) {
        log.debug("Registering format {}", format.name());
        formats.put(format.name(), format);
        return this;
    }

    /**
     * Register a converter. Both ends must already be registered formats.
     */
    public FormatRegistry register(Converter converter) {
        format(converter.source());
        format(converter.target());
        log.debug("Registering converter {}", converter.name());
        converters.put(converter.name(), converter);
        return this;
    }

    public Format format(String name) {
        var format = formats.get(name);
        if (format == null) {
            throw new TransformError.UnknownFormat(name).toException();
        }
        return format;
    }

    public List<Format> formats() {
        return Collections.unmodifiableList(new ArrayList<>(formats.values()));
    }

    public Optional<Converter> converter(String source, String target) {
        return Optional.ofNullable(converters.get(source + "->" + target));
    }

    public List<Converter> converters() {
        return Collections.unmodifiableList(new ArrayList<>(converters.values()));
    }

    /**
     * Registry with the built-in formats and converters.
     */
    public static FormatRegistry standard() {
        var registry = new FormatRegistry();

        registry.register(new Format(MARKDOWN, "Markdown text with clause markers", SerializationKind.TEXT, "md", String.class))
                .register(new Format(COMMONMARK,
                                     "CommonMark tree, clauses as fenced code blocks",
                                     SerializationKind.JSON,
                                     "json",
                                     DocumentNode.class))
                .register(new Format(CICEROMARK, "Document tree with typed variables", SerializationKind.JSON, "json", DocumentNode.class))
                .register(new Format(CICEROMARK_UNQUOTED,
                                     "Document tree with unquoted variable values",
                                     SerializationKind.JSON,
                                     "json",
                                     DocumentNode.class))
                .register(new Format(CICEROMARK_UNTYPED,
                                     "Document tree with variables reduced to text",
                                     SerializationKind.JSON,
                                     "json",
                                     DocumentNode.class))
                .register(new Format(PDFMAKE, "pdfmake document definition", SerializationKind.JSON, "json", ObjectNode.class))
                .register(new Format(DATA, "Data bound by a template", SerializationKind.JSON, "json", BoundValue.class));

        registry.register(new Converter(CICEROMARK, MARKDOWN, (input, options) -> toMarkdown(input)))
                .register(new Converter(CICEROMARK, CICEROMARK_UNQUOTED,
                                        (input, options) -> new UnquoteVisitor().convert((DocumentNode) input)))
                .register(new Converter(CICEROMARK, CICEROMARK_UNTYPED,
                                        (input, options) -> new UntypeVisitor().convert((DocumentNode) input)))
                .register(new Converter(CICEROMARK, PDFMAKE, (input, options) -> toPdfMake(input)))
                .register(new Converter(CICEROMARK, COMMONMARK,
                                        (input, options) -> new ToCommonMarkVisitor().convert((DocumentNode) input)))
                .register(new Converter(COMMONMARK, CICEROMARK,
                                        (input, options) -> new FromCommonMarkVisitor().convert((DocumentNode) input)))
                .register(new Converter(COMMONMARK, MARKDOWN, (input, options) -> toMarkdown(input)))
                .register(new Converter(CICEROMARK_UNQUOTED, MARKDOWN, (input, options) -> toMarkdown(input)))
                .register(new Converter(CICEROMARK_UNQUOTED, PDFMAKE, (input, options) -> toPdfMake(input)))
                .register(new Converter(CICEROMARK_UNTYPED, MARKDOWN, (input, options) -> toMarkdown(input)))
                .register(new Converter(MARKDOWN, DATA,
                                        (input, options) -> TemplateCompiler.compile(template(options, MARKDOWN, DATA))
                                                                            .parse((String) input)))
                .register(new Converter(DATA, MARKDOWN,
                                        (input, options) -> TemplateRenderer.render(template(options, DATA, MARKDOWN),
                                                                                    (BoundValue) input)))
                .register(new Converter(DATA, CICEROMARK,
                                        (input, options) -> DocumentBuilder.build(template(options, DATA, CICEROMARK),
                                                                                  (BoundValue) input)));
        return registry;
    }

    private static String toMarkdown(Object input) {
        return new MarkdownVisitor().convert((DocumentNode) input);
    }

    private static ObjectNode toPdfMake(Object input) {
        return new PdfMakeVisitor(DocumentNodeCodec.mapper()).convert((DocumentNode) input);
    }

    private static TemplateNode template(TransformOptions options, String source, String target) {
        return options.template()
                      .orElseThrow(() -> new TransformError.MissingOption(source + "->" + target, "template").toException());
    }
}
