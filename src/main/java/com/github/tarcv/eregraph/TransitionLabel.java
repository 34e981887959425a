package com.github.tarcv.eregraph;

import com.ibm.icu.text.UnicodeSet;

import java.util.Objects;

/**
 * What a transition consumes: nothing (epsilon), one character, or one character out of a set.
 * <p>
 * A class label keeps the set as written together with the negation flag, and the
 * resolved set it actually matches.
 */
public final class TransitionLabel {
    public enum Kind {
        EPSILON,
        CHAR,
        CLASS
    }

    private static final TransitionLabel EPSILON = new TransitionLabel(Kind.EPSILON, -1, null, false, null);
    private static final TransitionLabel ANY = ofClass(RegexStaticSets.INSTANCE.fAlphabet, false);

    private final Kind kind;
    private final int codePoint;
    private final UnicodeSet set;
    private final boolean negated;
    private final UnicodeSet resolvedSet;

    private TransitionLabel(final Kind kind, final int codePoint, final UnicodeSet set, final boolean negated,
                            final UnicodeSet resolvedSet) {
        this.kind = kind;
        this.codePoint = codePoint;
        this.set = set;
        this.negated = negated;
        this.resolvedSet = resolvedSet;
    }

    public static TransitionLabel epsilon() {
        return EPSILON;
    }

    public static TransitionLabel ofChar(final int codePoint) {
        return new TransitionLabel(Kind.CHAR, codePoint, null, false, null);
    }

    public static TransitionLabel ofClass(final UnicodeSet set, final boolean negated) {
        UnicodeSet frozen = set.isFrozen() ? set : new UnicodeSet(set).freeze();
        UnicodeSet resolved = negated ? new UnicodeSet(frozen).complement().freeze() : frozen;
        return new TransitionLabel(Kind.CLASS, -1, frozen, negated, resolved);
    }

    /**
     * @return label matching every code point, used for '.'
     */
    public static TransitionLabel any() {
        return ANY;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isEpsilon() {
        return kind == Kind.EPSILON;
    }

    /**
     * @return the character of a CHAR label
     */
    public int getCodePoint() {
        checkKind(Kind.CHAR);
        return codePoint;
    }

    /**
     * @return the set of a CLASS label as written, before negation
     */
    public UnicodeSet getSet() {
        checkKind(Kind.CLASS);
        return set;
    }

    public boolean isNegated() {
        return negated;
    }

    /**
     * @return true for a CLASS label that matches the whole alphabet
     */
    public boolean isAny() {
        return kind == Kind.CLASS && resolvedSet.equals(RegexStaticSets.INSTANCE.fAlphabet);
    }

    /**
     * @return whether this label consumes {@code c}; always false for epsilon
     */
    public boolean matches(final int c) {
        switch (kind) {
            case EPSILON:
                return false;
            case CHAR:
                return codePoint == c;
            case CLASS:
                return resolvedSet.contains(c);
            default:
                throw new IllegalStateException("Unknown kind " + kind);
        }
    }

    private void checkKind(final Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Label is " + kind + ", not " + expected);
        }
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TransitionLabel)) {
            return false;
        }
        TransitionLabel other = (TransitionLabel) o;
        return kind == other.kind
                && codePoint == other.codePoint
                && negated == other.negated
                && Objects.equals(set, other.set);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, codePoint, set, negated);
    }

    @Override
    public String toString() {
        switch (kind) {
            case EPSILON:
                return "eps";
            case CHAR:
                return RegexNode.formatCodePoint(codePoint);
            case CLASS:
                return (negated ? "^" : "") + set.toPattern(true);
            default:
                throw new IllegalStateException("Unknown kind " + kind);
        }
    }
}
