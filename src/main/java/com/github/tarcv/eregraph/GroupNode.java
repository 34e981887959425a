package com.github.tarcv.eregraph;

import java.util.Objects;

/**
 * A parenthesized subexpression. Purely structural: it compiles to exactly its child.
 */
public final class GroupNode extends RegexNode {
    private final RegexNode child;

    public GroupNode(final RegexNode child) {
        this.child = Objects.requireNonNull(child);
    }

    public RegexNode getChild() {
        return child;
    }

    @Override
    public <T> T accept(final NodeVisitor<T> visitor) {
        return visitor.visitGroup(this);
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof GroupNode && child.equals(((GroupNode) o).child);
    }

    @Override
    public int hashCode() {
        return 31 * child.hashCode() + 3;
    }

    @Override
    public String toString() {
        return "Group(" + child + ")";
    }
}
