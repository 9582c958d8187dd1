package org.pragmatica.markdown.template;

import java.util.List;

/**
 * Template grammar node - literal text interleaved with typed variable slots and blocks.
 */
public sealed interface TemplateNode {

    String tag();

    /**
     * Connective text, matched literally and never bound.
     */
    record TextChunk(String value) implements TemplateNode {
        @Override
        public String tag() {
            return "TextChunk";
        }
    }

    /**
     * Typed slot. {@code enumValues} is only meaningful for type {@code Enum}.
     */
    record Variable(String name, String type, List<String> enumValues) implements TemplateNode {
        public Variable {
            enumValues = List.copyOf(enumValues);
        }

        public static Variable of(String name, String type) {
            return new Variable(name, type, List.of());
        }

        public static Variable ofEnum(String name, List<String> values) {
            return new Variable(name, "Enum", values);
        }

        @Override
        public String tag() {
            return "Variable";
        }
    }

    /**
     * Choice between two literal texts, bound as a Boolean.
     */
    record ConditionalBlock(String name, String whenTrue, String whenFalse) implements TemplateNode {
        @Override
        public String tag() {
            return "ConditionalBlock";
        }
    }

    record UnorderedListBlock(List<TemplateNode> nodes) implements TemplateNode {
        public UnorderedListBlock {
            nodes = List.copyOf(nodes);
        }

        @Override
        public String tag() {
            return "UnorderedListBlock";
        }
    }

    record ClauseBlock(String name, String type, List<TemplateNode> nodes) implements TemplateNode {
        public ClauseBlock {
            nodes = List.copyOf(nodes);
        }

        @Override
        public String tag() {
            return "ClauseBlock";
        }
    }

    /**
     * Nested compound value, never wrapped in clause markers.
     */
    record WithBlock(String name, String type, List<TemplateNode> nodes) implements TemplateNode {
        public WithBlock {
            nodes = List.copyOf(nodes);
        }

        @Override
        public String tag() {
            return "WithBlock";
        }
    }

    /**
     * Contract; clauses compiled inside it require boundary markers.
     */
    record ContractBlock(String name, String type, List<TemplateNode> nodes) implements TemplateNode {
        public ContractBlock {
            nodes = List.copyOf(nodes);
        }

        @Override
        public String tag() {
            return "ContractBlock";
        }
    }

    /**
     * Grammar node read from JSON whose tag is not part of the template language.
     */
    record Unrecognized(String tag) implements TemplateNode {}
}
