package org.pragmatica.markdown.visitor;

/**
 * Inline formatting inherited from enclosing nodes. Immutable: children receive a modified
 * copy, so a mark set inside {@code Emph} never leaks to its siblings.
 *
 * <p>{@code code} is reserved: {@code Code} nodes are leaves and carry their own text, so no
 * built-in rule sets it. A caller-supplied initial mark set may.
 */
public record Marks(boolean emph, boolean strong, boolean code) {

    public static final Marks NONE = new Marks(false, false, false);

    public Marks withEmph() {
        return new Marks(true, strong, code);
    }

    public Marks withStrong() {
        return new Marks(emph, true, code);
    }
}
