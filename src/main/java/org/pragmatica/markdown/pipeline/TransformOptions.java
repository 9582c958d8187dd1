package org.pragmatica.markdown.pipeline;

import org.pragmatica.markdown.template.TemplateNode;

import java.util.Optional;

/**
 * Options for a conversion chain.
 *
 * @param template grammar used by the {@code markdown <-> data} converters
 * @param verbose  log each hop at info level instead of debug
 */
public record TransformOptions(
    Optional<TemplateNode> template,
    boolean verbose
) {
    public static final TransformOptions DEFAULT = new TransformOptions(
        Optional.empty(),
        false
    );

    public TransformOptions withTemplate(TemplateNode grammar) {
        return new TransformOptions(Optional.of(grammar), verbose);
    }

    public TransformOptions withVerbose(boolean enabled) {
        return new TransformOptions(template, enabled);
    }
}
