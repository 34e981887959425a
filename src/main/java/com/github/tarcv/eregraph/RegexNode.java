package com.github.tarcv.eregraph;

/**
 * A node of the parsed expression tree.
 * <p>
 * The set of node kinds is closed: all subclasses live in this package and every
 * consumer dispatches through {@link NodeVisitor}, so adding a kind breaks every
 * consumer at compile time until it handles the new kind.
 * Nodes are immutable and own their children exclusively.
 */
public abstract class RegexNode {
    RegexNode() {
    }

    public abstract <T> T accept(NodeVisitor<T> visitor);

    static String formatCodePoint(final int c) {
        if (c >= 0x20 && c < 0x7f) {
            return "'" + (char) c + "'";
        }
        return String.format("U+%04X", c);
    }
}
