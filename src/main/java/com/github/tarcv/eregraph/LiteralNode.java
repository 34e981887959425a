package com.github.tarcv.eregraph;

/**
 * Matches exactly one code point.
 */
public final class LiteralNode extends RegexNode {
    private final int codePoint;

    public LiteralNode(final int codePoint) {
        if (codePoint < Character.MIN_CODE_POINT || codePoint > Character.MAX_CODE_POINT) {
            throw new IllegalArgumentException("Not a code point: " + codePoint);
        }
        this.codePoint = codePoint;
    }

    public int getCodePoint() {
        return codePoint;
    }

    @Override
    public <T> T accept(final NodeVisitor<T> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof LiteralNode && ((LiteralNode) o).codePoint == codePoint;
    }

    @Override
    public int hashCode() {
        return codePoint;
    }

    @Override
    public String toString() {
        return "Literal(" + formatCodePoint(codePoint) + ")";
    }
}
