package org.pragmatica.markdown.pipeline;

/**
 * How values of a format are written outside the process.
 */
public enum SerializationKind {
    JSON,
    TEXT,
    BINARY
}
