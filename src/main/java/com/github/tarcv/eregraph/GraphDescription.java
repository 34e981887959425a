package com.github.tarcv.eregraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Format-neutral description of an automaton as a directed graph: nodes with start and
 * accept markers, and edges with rendered labels. Node and edge order is deterministic.
 */
public final class GraphDescription {

    public static final class Node {
        private final String name;
        private final boolean start;
        private final boolean accept;

        Node(final String name, final boolean start, final boolean accept) {
            this.name = name;
            this.start = start;
            this.accept = accept;
        }

        public String getName() {
            return name;
        }

        /**
         * @return true for the node the implicit entry arrow points to
         */
        public boolean isStart() {
            return start;
        }

        public boolean isAccept() {
            return accept;
        }

        @Override
        public boolean equals(final Object o) {
            if (!(o instanceof Node)) {
                return false;
            }
            Node other = (Node) o;
            return start == other.start && accept == other.accept && name.equals(other.name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, start, accept);
        }

        @Override
        public String toString() {
            return name + (start ? " (start)" : "") + (accept ? " (accept)" : "");
        }
    }

    public static final class Edge {
        private final String from;
        private final String to;
        private final String label;
        private final boolean epsilon;

        Edge(final String from, final String to, final String label, final boolean epsilon) {
            this.from = from;
            this.to = to;
            this.label = label;
            this.epsilon = epsilon;
        }

        public String getFrom() {
            return from;
        }

        public String getTo() {
            return to;
        }

        public String getLabel() {
            return label;
        }

        public boolean isEpsilon() {
            return epsilon;
        }

        @Override
        public boolean equals(final Object o) {
            if (!(o instanceof Edge)) {
                return false;
            }
            Edge other = (Edge) o;
            return epsilon == other.epsilon && from.equals(other.from) && to.equals(other.to)
                    && label.equals(other.label);
        }

        @Override
        public int hashCode() {
            return Objects.hash(from, to, label, epsilon);
        }

        @Override
        public String toString() {
            return from + " -> " + to + " [" + label + "]";
        }
    }

    private final List<Node> nodes;
    private final List<Edge> edges;

    GraphDescription(final List<Node> nodes, final List<Edge> edges) {
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
        this.edges = Collections.unmodifiableList(new ArrayList<>(edges));
    }

    public List<Node> getNodes() {
        return nodes;
    }

    public List<Edge> getEdges() {
        return edges;
    }

    public Node getStartNode() {
        for (Node node : nodes) {
            if (node.isStart()) {
                return node;
            }
        }
        throw new IllegalStateException("Graph has no start node");
    }

    @Override
    public boolean equals(final Object o) {
        if (!(o instanceof GraphDescription)) {
            return false;
        }
        GraphDescription other = (GraphDescription) o;
        return nodes.equals(other.nodes) && edges.equals(other.edges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, edges);
    }
}
