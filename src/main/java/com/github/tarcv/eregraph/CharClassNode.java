package com.github.tarcv.eregraph;

import com.ibm.icu.text.UnicodeSet;

import java.util.Objects;

/**
 * A bracket expression.
 * <p>
 * {@link #getSet()} is the union of the listed terms; {@link #getResolvedSet()} is what the
 * node actually matches, i.e. the complement of that union against U+0000..U+10FFFF when
 * the expression was negated. Both are frozen and computed once.
 */
public final class CharClassNode extends RegexNode {
    private final UnicodeSet set;
    private final boolean negated;
    private final UnicodeSet resolvedSet;

    public CharClassNode(final UnicodeSet set, final boolean negated) {
        this.set = new UnicodeSet(set).freeze();
        this.negated = negated;
        if (negated) {
            this.resolvedSet = new UnicodeSet(set).complement().freeze();
        } else {
            this.resolvedSet = this.set;
        }
    }

    public UnicodeSet getSet() {
        return set;
    }

    public boolean isNegated() {
        return negated;
    }

    public UnicodeSet getResolvedSet() {
        return resolvedSet;
    }

    public boolean matches(final int codePoint) {
        return resolvedSet.contains(codePoint);
    }

    @Override
    public <T> T accept(final NodeVisitor<T> visitor) {
        return visitor.visitCharClass(this);
    }

    @Override
    public boolean equals(final Object o) {
        if (!(o instanceof CharClassNode)) {
            return false;
        }
        CharClassNode other = (CharClassNode) o;
        return negated == other.negated && set.equals(other.set);
    }

    @Override
    public int hashCode() {
        return Objects.hash(set, negated);
    }

    @Override
    public String toString() {
        return "CharClass(" + (negated ? "^" : "") + set.toPattern(true) + ")";
    }
}
