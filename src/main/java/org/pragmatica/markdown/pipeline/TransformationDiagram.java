package org.pragmatica.markdown.pipeline;

/**
 * PlantUML state diagram of the registered formats and converters.
 */
public final class TransformationDiagram {

    private TransformationDiagram() {}

    public static String render(FormatRegistry registry) {
        var sb = new StringBuilder();
        sb.append("@startuml\n");
        sb.append("hide empty description\n\n");
        for (var format : registry.formats()) {
            sb.append("state \"")
              .append(format.name())
              .append("\" as ")
              .append(format.name())
              .append(" : ")
              .append(format.documentation())
              .append('\n');
        }
        sb.append('\n');
        for (var converter : registry.converters()) {
            sb.append(converter.source())
              .append(" --> ")
              .append(converter.target())
              .append('\n');
        }
        sb.append("@enduml\n");
        return sb.toString();
    }
}
