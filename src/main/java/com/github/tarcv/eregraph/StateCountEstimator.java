package com.github.tarcv.eregraph;

/**
 * Computes how many states {@link ThompsonCompiler} allocates for a subtree, not counting the
 * entry state it is handed. Results saturate at {@link Long#MAX_VALUE}.
 */
final class StateCountEstimator implements NodeVisitor<Long> {

    /**
     * @return number of states in the automaton compiled from {@code root}
     */
    long totalStates(final RegexNode root) {
        return add(1, root.accept(this));
    }

    @Override
    public Long visitLiteral(final LiteralNode node) {
        return 1L;
    }

    @Override
    public Long visitAnyChar(final AnyCharNode node) {
        return 1L;
    }

    @Override
    public Long visitCharClass(final CharClassNode node) {
        return 1L;
    }

    @Override
    public Long visitConcat(final ConcatNode node) {
        long count = 0;
        for (RegexNode item : node.getItems()) {
            count = add(count, item.accept(this));
        }
        return count;
    }

    @Override
    public Long visitAlternation(final AlternationNode node) {
        // the shared exit, plus a fresh entry for every branch
        long count = 1;
        for (RegexNode item : node.getItems()) {
            count = add(count, add(1, item.accept(this)));
        }
        return count;
    }

    @Override
    public Long visitRepeat(final RepeatNode node) {
        long child = node.getChild().accept(this);
        long count = multiply(node.getMin(), child);
        // star and optional copies wrap the child in a fresh entry and exit
        long wrapped = add(2, child);
        if (node.isUnbounded()) {
            count = add(count, wrapped);
        } else {
            count = add(count, multiply(node.getMax() - node.getMin(), wrapped));
        }
        return count;
    }

    @Override
    public Long visitGroup(final GroupNode node) {
        return node.getChild().accept(this);
    }

    private static long add(final long a, final long b) {
        long sum = a + b;
        return sum < 0 ? Long.MAX_VALUE : sum;
    }

    private static long multiply(final long a, final long b) {
        if (a == 0 || b == 0) {
            return 0;
        }
        if (a > Long.MAX_VALUE / b) {
            return Long.MAX_VALUE;
        }
        return a * b;
    }
}
