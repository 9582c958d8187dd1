package org.pragmatica.markdown.template;

/**
 * Compilation state inherited by descendants of a grammar node.
 */
record BuildState(boolean withinContract) {
    static final BuildState INITIAL = new BuildState(false);

    BuildState enterContract() {
        return new BuildState(true);
    }
}
