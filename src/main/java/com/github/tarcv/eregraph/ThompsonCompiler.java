package com.github.tarcv.eregraph;

/**
 * Builds an {@link Automaton} from an expression tree with Thompson's construction.
 * <p>
 * Every node compiles to a fragment with one entry and one exit. Instead of creating a
 * fresh entry and joining fragments with epsilon transitions, each node is compiled
 * against the state its predecessor ended in, which merges the predecessor's exit with
 * its own entry. All other states are fresh for every node, including every copy of a
 * repeated subtree, so no two fragments share a state.
 * <p>
 * The compiler is total over trees the parser produces; a failure here is a bug.
 */
final class ThompsonCompiler implements NodeVisitor<Integer> {
    private final Automaton.Builder builder;
    private int entry;

    private ThompsonCompiler(final Automaton.Builder builder) {
        this.builder = builder;
    }

    /**
     * @throws RegexException REGEX_INTERNAL_ERROR if the tree breaks an invariant the parser guarantees
     */
    static Automaton compile(final RegexNode root) {
        Automaton.Builder builder = new Automaton.Builder();
        int start = builder.newState();
        try {
            int accept = new ThompsonCompiler(builder).compile(root, start);
            return builder.build(start, accept);
        } catch (IllegalStateException e) {
            throw new RegexException(RegexErrorCode.REGEX_INTERNAL_ERROR, "Can't compile " + root, e);
        }
    }

    /**
     * @return exit state of the fragment compiled for {@code node} starting at {@code entryState}
     */
    private int compile(final RegexNode node, final int entryState) {
        entry = entryState;
        return node.accept(this);
    }

    private int single(final TransitionLabel label) {
        int in = entry;
        int out = builder.newState();
        builder.addTransition(in, out, label);
        return out;
    }

    @Override
    public Integer visitLiteral(final LiteralNode node) {
        return single(TransitionLabel.ofChar(node.getCodePoint()));
    }

    @Override
    public Integer visitAnyChar(final AnyCharNode node) {
        return single(TransitionLabel.any());
    }

    @Override
    public Integer visitCharClass(final CharClassNode node) {
        return single(TransitionLabel.ofClass(node.getSet(), node.isNegated()));
    }

    @Override
    public Integer visitConcat(final ConcatNode node) {
        // an empty sequence passes straight through its entry
        int current = entry;
        for (RegexNode item : node.getItems()) {
            current = compile(item, current);
        }
        return current;
    }

    @Override
    public Integer visitAlternation(final AlternationNode node) {
        int in = entry;
        int[] branchExits = new int[node.getItems().size()];
        int i = 0;
        for (RegexNode branch : node.getItems()) {
            int branchEntry = builder.newState();
            builder.addEpsilon(in, branchEntry);
            branchExits[i++] = compile(branch, branchEntry);
        }
        int out = builder.newState();
        for (int branchExit : branchExits) {
            builder.addEpsilon(branchExit, out);
        }
        return out;
    }

    @Override
    public Integer visitRepeat(final RepeatNode node) {
        RegexNode child = node.getChild();
        int current = entry;
        for (int i = 0; i < node.getMin(); i++) {
            current = compile(child, current);
        }
        if (node.isUnbounded()) {
            current = star(child, current);
        } else {
            for (int i = node.getMin(); i < node.getMax(); i++) {
                current = optional(child, current);
            }
        }
        return current;
    }

    // zero or more: bypass to the exit, or run the child and loop back to the entry
    private int star(final RegexNode child, final int in) {
        int childEntry = builder.newState();
        builder.addEpsilon(in, childEntry);
        int childExit = compile(child, childEntry);
        builder.addEpsilon(childExit, in);
        int out = builder.newState();
        builder.addEpsilon(in, out);
        return out;
    }

    // zero or one: bypass to the exit, or run the child once
    private int optional(final RegexNode child, final int in) {
        int childEntry = builder.newState();
        builder.addEpsilon(in, childEntry);
        int childExit = compile(child, childEntry);
        int out = builder.newState();
        builder.addEpsilon(childExit, out);
        builder.addEpsilon(in, out);
        return out;
    }

    @Override
    public Integer visitGroup(final GroupNode node) {
        return compile(node.getChild(), entry);
    }
}
