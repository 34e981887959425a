package com.github.tarcv.eregraph;

import com.ibm.icu.lang.UCharacter;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns an {@link Automaton} into a {@link GraphDescription}.
 * <p>
 * Nodes are named after state identifiers and listed in identifier order; edges follow
 * transition creation order. Labels are the character itself, a class summary such as
 * {@code [a-z]} or {@code ^[0-9]}, {@code ANY} for '.', or {@code ε}.
 */
public final class GraphSerializer {
    public static final String EPSILON_LABEL = "ε";
    public static final String ANY_LABEL = "ANY";

    private GraphSerializer() {
    }

    public static GraphDescription serialize(final Automaton automaton) {
        List<GraphDescription.Node> nodes = new ArrayList<>(automaton.getStateCount());
        for (NfaState state : automaton.getStates()) {
            nodes.add(new GraphDescription.Node(nodeName(state.getId()),
                    state.getId() == automaton.getStart(),
                    state.getId() == automaton.getAccept()));
        }
        List<GraphDescription.Edge> edges = new ArrayList<>(automaton.getTransitions().size());
        for (NfaTransition t : automaton.getTransitions()) {
            edges.add(new GraphDescription.Edge(nodeName(t.getFrom()), nodeName(t.getTo()),
                    formatLabel(t.getLabel()), t.getLabel().isEpsilon()));
        }
        return new GraphDescription(nodes, edges);
    }

    static String nodeName(final int stateId) {
        return Integer.toString(stateId);
    }

    public static String formatLabel(final TransitionLabel label) {
        switch (label.getKind()) {
            case EPSILON:
                return EPSILON_LABEL;
            case CHAR:
                return formatChar(label.getCodePoint());
            case CLASS:
                if (label.isAny()) {
                    return ANY_LABEL;
                }
                return (label.isNegated() ? "^" : "") + label.getSet().toPattern(true);
            default:
                throw new IllegalStateException("Unknown label kind " + label.getKind());
        }
    }

    /**
     * Printable characters stand for themselves; spaces, controls and other invisible
     * characters are written as {@code \\uXXXX} or {@code \\U00XXXXXX}.
     */
    static String formatChar(final int c) {
        boolean visible = c > 0x20 && c < 0x7f
                || c > 0x7f && UCharacter.isPrintable(c) && !UCharacter.isWhitespace(c);
        if (visible) {
            return new String(Character.toChars(c));
        }
        if (c <= 0xffff) {
            return String.format("\\u%04X", c);
        }
        return String.format("\\U%08X", c);
    }
}
