package com.github.tarcv.eregraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Children matched one after another. With no children the node matches the empty string.
 */
public final class ConcatNode extends RegexNode {
    private final List<RegexNode> items;

    public ConcatNode(final List<? extends RegexNode> items) {
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
    }

    public List<RegexNode> getItems() {
        return items;
    }

    @Override
    public <T> T accept(final NodeVisitor<T> visitor) {
        return visitor.visitConcat(this);
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof ConcatNode && items.equals(((ConcatNode) o).items);
    }

    @Override
    public int hashCode() {
        return 31 * items.hashCode() + 1;
    }

    @Override
    public String toString() {
        return "Concat" + items;
    }
}
