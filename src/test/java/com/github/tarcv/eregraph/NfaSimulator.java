package com.github.tarcv.eregraph;

import java.util.BitSet;

/**
 * Runs an automaton over an input by tracking the set of live states. Used only to check
 * which language a compiled automaton accepts.
 */
final class NfaSimulator {
    private NfaSimulator() {
    }

    static boolean accepts(final Automaton automaton, final String input) {
        BitSet current = new BitSet(automaton.getStateCount());
        current.set(automaton.getStart());
        epsilonClosure(automaton, current);

        int i = 0;
        while (i < input.length() && !current.isEmpty()) {
            int c = input.codePointAt(i);
            i += Character.charCount(c);

            BitSet next = new BitSet(automaton.getStateCount());
            for (int s = current.nextSetBit(0); s >= 0; s = current.nextSetBit(s + 1)) {
                for (NfaTransition t : automaton.getState(s).getOutgoing()) {
                    if (t.getLabel().matches(c)) {
                        next.set(t.getTo());
                    }
                }
            }
            epsilonClosure(automaton, next);
            current = next;
        }
        return i >= input.length() && current.get(automaton.getAccept());
    }

    private static void epsilonClosure(final Automaton automaton, final BitSet states) {
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int s = states.nextSetBit(0); s >= 0; s = states.nextSetBit(s + 1)) {
                for (NfaTransition t : automaton.getState(s).getOutgoing()) {
                    if (t.getLabel().isEpsilon() && !states.get(t.getTo())) {
                        states.set(t.getTo());
                        changed = true;
                    }
                }
            }
        }
    }
}
