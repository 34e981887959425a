package com.github.tarcv.eregraph;

import java.util.Objects;

public final class NfaTransition {
    private final int from;
    private final int to;
    private final TransitionLabel label;

    NfaTransition(final int from, final int to, final TransitionLabel label) {
        this.from = from;
        this.to = to;
        this.label = Objects.requireNonNull(label);
    }

    public int getFrom() {
        return from;
    }

    public int getTo() {
        return to;
    }

    public TransitionLabel getLabel() {
        return label;
    }

    @Override
    public boolean equals(final Object o) {
        if (!(o instanceof NfaTransition)) {
            return false;
        }
        NfaTransition other = (NfaTransition) o;
        return from == other.from && to == other.to && label.equals(other.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to, label);
    }

    @Override
    public String toString() {
        return from + " -" + label + "-> " + to;
    }
}
