package com.github.tarcv.eregraph;

import java.util.Collection;

public enum RegexSyntaxFlag {
    /**
     * Recognize the control escapes \n \r \t \a \e \f \v.
     * Without this flag every escaped character stands for itself, so "\n" matches the letter n.
     */
    CONTROL_ESCAPES(1),

    /**
     * If set, treat the entire pattern as a literal string.
     * Metacharacters or escape sequences in the pattern are given
     * no special meaning.
     * <p>
     * The other flags become superfluous.
     */
    LITERAL(16);

    final long flag;

    RegexSyntaxFlag(final int flag) {
        this.flag = flag;
    }

    static long toBits(final Collection<RegexSyntaxFlag> flags) {
        long bits = 0;
        for (RegexSyntaxFlag f : flags) {
            if (f == null) {
                throw new IllegalArgumentException("Null syntax flag");
            }
            bits |= f.flag;
        }
        return bits;
    }
}
