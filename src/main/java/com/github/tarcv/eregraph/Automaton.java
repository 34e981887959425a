package com.github.tarcv.eregraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An immutable NFA with epsilon transitions, one start state and one accept state.
 * <p>
 * States are numbered 0..n-1 in creation order and transitions are kept in creation
 * order, so two automata built from the same expression are identical.
 * For the empty expression the start state is also the accept state.
 */
public final class Automaton {
    private final int start;
    private final int accept;
    private final List<NfaState> states;
    private final List<NfaTransition> transitions;

    private Automaton(final int start, final int accept, final List<NfaState> states,
                      final List<NfaTransition> transitions) {
        this.start = start;
        this.accept = accept;
        this.states = states;
        this.transitions = transitions;
    }

    public int getStart() {
        return start;
    }

    public int getAccept() {
        return accept;
    }

    public List<NfaState> getStates() {
        return states;
    }

    public NfaState getState(final int id) {
        return states.get(id);
    }

    public int getStateCount() {
        return states.size();
    }

    public List<NfaTransition> getTransitions() {
        return transitions;
    }

    @Override
    public String toString() {
        return "Automaton{start=" + start + ", accept=" + accept + ", transitions=" + transitions + '}';
    }

    /**
     * Accumulates states and transitions. Not thread safe; one builder per compilation.
     */
    static final class Builder {
        private final List<MutableVector32> outgoing = new ArrayList<>();
        private final List<NfaTransition> transitions = new ArrayList<>();

        int newState() {
            outgoing.add(new MutableVector32());
            return outgoing.size() - 1;
        }

        void addTransition(final int from, final int to, final TransitionLabel label) {
            checkState(from);
            checkState(to);
            if (from == to) {
                throw new IllegalStateException("Self loop on state " + from + " labeled " + label);
            }
            outgoing.get(from).addElement(transitions.size());
            transitions.add(new NfaTransition(from, to, label));
        }

        void addEpsilon(final int from, final int to) {
            addTransition(from, to, TransitionLabel.epsilon());
        }

        /**
         * @throws IllegalStateException if a state can't be reached from {@code start}
         */
        Automaton build(final int start, final int accept) {
            checkState(start);
            checkState(accept);
            checkReachable(start);

            List<NfaState> states = new ArrayList<>(outgoing.size());
            for (int id = 0; id < outgoing.size(); id++) {
                int[] indices = outgoing.get(id).toArray();
                List<NfaTransition> stateTransitions = new ArrayList<>(indices.length);
                for (int index : indices) {
                    stateTransitions.add(transitions.get(index));
                }
                states.add(new NfaState(id, Collections.unmodifiableList(stateTransitions)));
            }
            return new Automaton(start, accept, Collections.unmodifiableList(states),
                    Collections.unmodifiableList(new ArrayList<>(transitions)));
        }

        private void checkState(final int id) {
            if (id < 0 || id >= outgoing.size()) {
                throw new IllegalStateException("No state " + id);
            }
        }

        private void checkReachable(final int start) {
            boolean[] seen = new boolean[outgoing.size()];
            MutableVector32 stack = new MutableVector32(outgoing.size());
            seen[start] = true;
            stack.push(start);
            int seenCount = 1;
            while (!stack.isEmpty()) {
                MutableVector32 edges = outgoing.get(stack.popi());
                for (int i = 0; i < edges.size(); i++) {
                    int to = transitions.get(edges.elementAti(i)).getTo();
                    if (!seen[to]) {
                        seen[to] = true;
                        seenCount++;
                        stack.push(to);
                    }
                }
            }
            if (seenCount != seen.length) {
                for (int id = 0; id < seen.length; id++) {
                    if (!seen[id]) {
                        throw new IllegalStateException("State " + id + " is not reachable from " + start);
                    }
                }
            }
        }
    }
}
