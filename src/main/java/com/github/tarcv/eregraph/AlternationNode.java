package com.github.tarcv.eregraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Matches if any of the branches matches. Branch order carries no priority.
 */
public final class AlternationNode extends RegexNode {
    private final List<RegexNode> items;

    public AlternationNode(final List<? extends RegexNode> items) {
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Alternation needs at least one branch");
        }
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
    }

    public List<RegexNode> getItems() {
        return items;
    }

    @Override
    public <T> T accept(final NodeVisitor<T> visitor) {
        return visitor.visitAlternation(this);
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof AlternationNode && items.equals(((AlternationNode) o).items);
    }

    @Override
    public int hashCode() {
        return 31 * items.hashCode() + 2;
    }

    @Override
    public String toString() {
        return "Alternation" + items;
    }
}
