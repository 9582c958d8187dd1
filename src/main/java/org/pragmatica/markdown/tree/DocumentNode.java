package org.pragmatica.markdown.tree;

import java.util.List;

/**
 * Document tree node - the closed catalog of CommonMark and CiceroMark node kinds.
 *
 * <p>Children are ordered; the order drives both rendering and parsing. Nodes are immutable,
 * transformations always build new trees.
 */
public sealed interface DocumentNode {

    /**
     * Schema tag name, as used in the {@code $class} field of the JSON form.
     */
    String tag();

    /**
     * Ordered children (empty for leaves).
     */
    default List<DocumentNode> nodes() {
        return List.of();
    }

    <R, P> R accept(NodeVisitor<R, P> visitor, P param);

    /**
     * Nodes which carry a variable value.
     */
    sealed interface VariableNode extends DocumentNode {
        String name();

        String value();

        String elementType();

        boolean identifiedBy();
    }

    // === Blocks ===

    record Document(List<DocumentNode> nodes) implements DocumentNode {
        public Document {
            nodes = List.copyOf(nodes);
        }

        @Override
        public String tag() {
            return "Document";
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitDocument(this, param);
        }
    }

    record Paragraph(List<DocumentNode> nodes) implements DocumentNode {
        public Paragraph {
            nodes = List.copyOf(nodes);
        }

        @Override
        public String tag() {
            return "Paragraph";
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitParagraph(this, param);
        }
    }

    /**
     * Heading; {@code level} is kept textual ("1".."6") as in the schema.
     */
    record Heading(String level, List<DocumentNode> nodes) implements DocumentNode {
        public Heading {
            nodes = List.copyOf(nodes);
        }

        @Override
        public String tag() {
            return "Heading";
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitHeading(this, param);
        }
    }

    /**
     * Plain list; {@code type} is {@code ordered} or {@code bullet}.
     */
    record ListNode(String type, String start, boolean tight, List<DocumentNode> nodes) implements DocumentNode {
        public ListNode {
            nodes = List.copyOf(nodes);
        }

        public boolean ordered() {
            return "ordered".equals(type);
        }

        @Override
        public String tag() {
            return "List";
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitList(this, param);
        }
    }

    /**
     * List bound to a template list variable.
     */
    record ListBlock(String name, String type, String start, boolean tight, List<DocumentNode> nodes)
    implements DocumentNode {
        public ListBlock {
            nodes = List.copyOf(nodes);
        }

        public boolean ordered() {
            return "ordered".equals(type);
        }

        @Override
        public String tag() {
            return "ListBlock";
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitListBlock(this, param);
        }
    }

    record Item(List<DocumentNode> nodes) implements DocumentNode {
        public Item {
            nodes = List.copyOf(nodes);
        }

        @Override
        public String tag() {
            return "Item";
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitItem(this, param);
        }
    }

    record BlockQuote(List<DocumentNode> nodes) implements DocumentNode {
        public BlockQuote {
            nodes = List.copyOf(nodes);
        }

        @Override
        public String tag() {
            return "BlockQuote";
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitBlockQuote(this, param);
        }
    }

    /**
     * Fenced code block; {@code text} includes the trailing newline.
     */
    record CodeBlock(String info, String text) implements DocumentNode {
        @Override
        public String tag() {
            return "CodeBlock";
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitCodeBlock(this, param);
        }
    }

    record HtmlBlock(String text) implements DocumentNode {
        @Override
        public String tag() {
            return "HtmlBlock";
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitHtmlBlock(this, param);
        }
    }

    record ThematicBreak() implements DocumentNode {
        @Override
        public String tag() {
            return "ThematicBreak";
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitThematicBreak(this, param);
        }
    }

    // === Inlines ===

    record Text(String text) implements DocumentNode {
        @Override
        public String tag() {
            return "Text";
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitText(this, param);
        }
    }

    record Emph(List<DocumentNode> nodes) implements DocumentNode {
        public Emph {
            nodes = List.copyOf(nodes);
        }

        @Override
        public String tag() {
            return "Emph";
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitEmph(this, param);
        }
    }

    record Strong(List<DocumentNode> nodes) implements DocumentNode {
        public Strong {
            nodes = List.copyOf(nodes);
        }

        @Override
        public String tag() {
            return "Strong";
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitStrong(this, param);
        }
    }

    record Code(String text) implements DocumentNode {
        @Override
        public String tag() {
            return "Code";
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitCode(this, param);
        }
    }

    record HtmlInline(String text) implements DocumentNode {
        @Override
        public String tag() {
            return "HtmlInline";
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitHtmlInline(this, param);
        }
    }

    record Link(String destination, String title, List<DocumentNode> nodes) implements DocumentNode {
        public Link {
            nodes = List.copyOf(nodes);
        }

        @Override
        public String tag() {
            return "Link";
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitLink(this, param);
        }
    }

    record Image(String destination, String title, List<DocumentNode> nodes) implements DocumentNode {
        public Image {
            nodes = List.copyOf(nodes);
        }

        @Override
        public String tag() {
            return "Image";
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitImage(this, param);
        }
    }

    record Linebreak() implements DocumentNode {
        @Override
        public String tag() {
            return "Linebreak";
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitLinebreak(this, param);
        }
    }

    record Softbreak() implements DocumentNode {
        @Override
        public String tag() {
            return "Softbreak";
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitSoftbreak(this, param);
        }
    }

    // === Contract structure ===

    /**
     * Clause instance; {@code src} identifies the template it was drafted from.
     */
    record Clause(String name, String src, List<DocumentNode> nodes) implements DocumentNode {
        public Clause {
            nodes = List.copyOf(nodes);
        }

        @Override
        public String tag() {
            return "Clause";
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitClause(this, param);
        }
    }

    record Contract(String name, String src, List<DocumentNode> nodes) implements DocumentNode {
        public Contract {
            nodes = List.copyOf(nodes);
        }

        @Override
        public String tag() {
            return "Contract";
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitContract(this, param);
        }
    }

    /**
     * Conditional text; {@code nodes} holds the branch already selected by {@code isTrue}.
     */
    record Conditional(String name,
                       boolean isTrue,
                       List<DocumentNode> whenTrue,
                       List<DocumentNode> whenFalse,
                       List<DocumentNode> nodes) implements DocumentNode {
        public Conditional {
            whenTrue = List.copyOf(whenTrue);
            whenFalse = List.copyOf(whenFalse);
            nodes = List.copyOf(nodes);
        }

        @Override
        public String tag() {
            return "Conditional";
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitConditional(this, param);
        }
    }

    record WithBlock(String name, List<DocumentNode> nodes) implements DocumentNode {
        public WithBlock {
            nodes = List.copyOf(nodes);
        }

        @Override
        public String tag() {
            return "WithBlock";
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitWithBlock(this, param);
        }
    }

    // === Variables ===

    record Variable(String name, String value, String elementType, boolean identifiedBy) implements VariableNode {
        @Override
        public String tag() {
            return "Variable";
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitVariable(this, param);
        }
    }

    record FormattedVariable(String name, String value, String elementType, boolean identifiedBy, String format)
    implements VariableNode {
        @Override
        public String tag() {
            return "FormattedVariable";
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitFormattedVariable(this, param);
        }
    }

    record EnumVariable(String name,
                        String value,
                        String elementType,
                        boolean identifiedBy,
                        List<String> enumValues) implements VariableNode {
        public EnumVariable {
            enumValues = List.copyOf(enumValues);
        }

        @Override
        public String tag() {
            return "EnumVariable";
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitEnumVariable(this, param);
        }
    }

    record Formula(String name, String value, String elementType, boolean identifiedBy, String code)
    implements VariableNode {
        @Override
        public String tag() {
            return "Formula";
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitFormula(this, param);
        }
    }

    // === Foreign ===

    /**
     * A node whose tag is outside this catalog, e.g. decoded from a newer schema version.
     * No visitor has a rule for it.
     */
    record Opaque(String tag, List<DocumentNode> nodes) implements DocumentNode {
        public Opaque {
            nodes = List.copyOf(nodes);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitOpaque(this, param);
        }
    }
}
