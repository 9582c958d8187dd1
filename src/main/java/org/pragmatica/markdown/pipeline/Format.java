package org.pragmatica.markdown.pipeline;

/**
 * Named document format.
 *
 * @param name          registry key, e.g. {@code ciceromark}
 * @param documentation one-line description
 * @param kind          serialization kind
 * @param fileExtension usual file extension, without the dot
 * @param valueType     in-memory type of values in this format
 */
public record Format(String name, String documentation, SerializationKind kind, String fileExtension, Class<?> valueType) {

    public boolean accepts(Object value) {
        return valueType.isInstance(value);
    }
}
