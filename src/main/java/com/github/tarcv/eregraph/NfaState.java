package com.github.tarcv.eregraph;

import java.util.List;

/**
 * A state of an {@link Automaton}. Identifiers are dense and follow creation order.
 */
public final class NfaState {
    private final int id;
    private final List<NfaTransition> outgoing;

    NfaState(final int id, final List<NfaTransition> outgoing) {
        this.id = id;
        this.outgoing = outgoing;
    }

    public int getId() {
        return id;
    }

    public List<NfaTransition> getOutgoing() {
        return outgoing;
    }

    @Override
    public String toString() {
        return "NfaState{" + id + ", outgoing=" + outgoing + '}';
    }
}
