package com.github.tarcv.eregraph;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Renders a {@link GraphDescription} in the Graphviz DOT language, laid out left to right.
 * An invisible point node named {@code start} points at the start state; the accept
 * state is drawn as a double circle.
 */
public final class DotWriter {
    static final String START_MARKER = "start";

    private DotWriter() {
    }

    public static String toDot(final GraphDescription graph) {
        StringBuilder sb = new StringBuilder();
        try {
            write(graph, sb);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return sb.toString();
    }

    public static void write(final GraphDescription graph, final Appendable out) throws IOException {
        out.append("digraph {\n");
        out.append("rankdir = LR;\n");
        out.append(START_MARKER).append(" [shape = point];\n");
        for (GraphDescription.Node node : graph.getNodes()) {
            out.append(node.getName())
                    .append(" [shape = ")
                    .append(node.isAccept() ? "doublecircle" : "circle")
                    .append("];\n");
        }
        out.append(START_MARKER).append(" -> ").append(graph.getStartNode().getName()).append(";\n");
        for (GraphDescription.Edge edge : graph.getEdges()) {
            out.append(edge.getFrom())
                    .append(" -> ")
                    .append(edge.getTo())
                    .append(" [label = ")
                    .append(quote(edge.getLabel()))
                    .append("];\n");
        }
        out.append("}\n");
    }

    static String quote(final String label) {
        StringBuilder sb = new StringBuilder(label.length() + 2);
        sb.append('"');
        for (int i = 0; i < label.length(); i++) {
            char c = label.charAt(i);
            if (c == '"' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.append('"').toString();
    }
}
