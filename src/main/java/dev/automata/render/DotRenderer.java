package dev.automata.render;

import dev.automata.engine.MembershipValidator;
import dev.automata.model.AutomatonDefinition;
import dev.automata.model.GraphTextSyntax;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a definition as directed-graph text, in the shapes the graph-text reconstructor
 * reads back. Quotes and backslashes inside quoted names and labels are backslash-escaped.
 */
public final class DotRenderer {

    private DotRenderer() {}

    public static String render(AutomatonDefinition definition) {
        return render(definition, GraphTextSyntax.defaults());
    }

    public static String render(AutomatonDefinition definition, GraphTextSyntax syntax) {
        var sb = new StringBuilder();
        sb.append("digraph finite_state_machine {\n");
        sb.append("    rankdir=LR;\n");

        if (!definition.finals().isEmpty()) {
            sb.append("    node [shape = ").append(syntax.finalShape()).append("];");
            for (String state : definition.finals()) {
                sb.append(' ').append(quote(state));
            }
            sb.append(";\n");
        }
        sb.append("    node [shape = circle];\n");
        sb.append("    ").append(syntax.sentinel()).append(" [shape = point];\n");
        sb.append("    ").append(syntax.sentinel()).append(" -> ").append(quote(definition.initial())).append(";\n");

        for (var entry : definition.transitions().entrySet()) {
            String source = quote(entry.getKey().state());
            String symbol = entry.getKey().symbol();
            for (String target : entry.getValue().states()) {
                sb.append("    ").append(source).append(" -> ").append(quote(target));
                if (!MembershipValidator.isEpsilon(symbol)) {
                    sb.append(" [label = \"").append(escape(symbol)).append("\"]");
                }
                sb.append(";\n");
            }
        }

        sb.append("}\n");
        return sb.toString();
    }

    public static void writeToFile(AutomatonDefinition definition, GraphTextSyntax syntax, Path path)
            throws IOException {
        Files.writeString(path, render(definition, syntax));
    }

    private static String quote(String id) {
        if (id.matches("[A-Za-z0-9_.]+")) {
            return id;
        }
        return "\"" + escape(id) + "\"";
    }

    private static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
