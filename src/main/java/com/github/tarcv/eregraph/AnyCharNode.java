package com.github.tarcv.eregraph;

/**
 * The '.' wildcard.
 */
public final class AnyCharNode extends RegexNode {
    public static final AnyCharNode INSTANCE = new AnyCharNode();

    private AnyCharNode() {
    }

    @Override
    public <T> T accept(final NodeVisitor<T> visitor) {
        return visitor.visitAnyChar(this);
    }

    @Override
    public String toString() {
        return "AnyChar";
    }
}
