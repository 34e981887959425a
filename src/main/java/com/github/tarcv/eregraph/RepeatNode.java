package com.github.tarcv.eregraph;

import java.util.Objects;

/**
 * {@code child} repeated between {@code min} and {@code max} times.
 * <p>
 * ? is (0, 1), * is (0, UNBOUNDED), + is (1, UNBOUNDED), {n} is (n, n),
 * {n,} is (n, UNBOUNDED) and {n,m} is (n, m).
 */
public final class RepeatNode extends RegexNode {
    public static final int UNBOUNDED = -1;

    private final RegexNode child;
    private final int min;
    private final int max;

    public RepeatNode(final RegexNode child, final int min, final int max) {
        if (min < 0) {
            throw new IllegalArgumentException("Negative minimum: " + min);
        }
        if (max != UNBOUNDED && max < min) {
            throw new IllegalArgumentException("Maximum " + max + " is less than minimum " + min);
        }
        this.child = Objects.requireNonNull(child);
        this.min = min;
        this.max = max;
    }

    public RegexNode getChild() {
        return child;
    }

    public int getMin() {
        return min;
    }

    /**
     * @return the upper bound, or {@link #UNBOUNDED}
     */
    public int getMax() {
        return max;
    }

    public boolean isUnbounded() {
        return max == UNBOUNDED;
    }

    @Override
    public <T> T accept(final NodeVisitor<T> visitor) {
        return visitor.visitRepeat(this);
    }

    @Override
    public boolean equals(final Object o) {
        if (!(o instanceof RepeatNode)) {
            return false;
        }
        RepeatNode other = (RepeatNode) o;
        return min == other.min && max == other.max && child.equals(other.child);
    }

    @Override
    public int hashCode() {
        return Objects.hash(child, min, max);
    }

    @Override
    public String toString() {
        return "Repeat(" + child + ", " + min + ", " + (isUnbounded() ? "inf" : Integer.toString(max)) + ")";
    }
}
