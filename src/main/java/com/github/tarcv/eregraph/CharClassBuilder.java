package com.github.tarcv.eregraph;

import com.ibm.icu.text.UnicodeSet;

/**
 * Collects the terms of one bracket expression into a single set.
 * <p>
 * The backing {@link UnicodeSet} keeps its ranges sorted, disjoint and
 * non-adjacent, so the result is normalized whatever order the terms came in.
 */
final class CharClassBuilder {
    private final UnicodeSet set = new UnicodeSet();

    CharClassBuilder addChar(final int c) {
        set.add(c);
        return this;
    }

    /**
     * @throws RegexException REGEX_INVALID_RANGE if {@code first} is greater than {@code last}
     */
    CharClassBuilder addRange(final int first, final int last) {
        if (first > last) {
            throw new RegexException(RegexErrorCode.REGEX_INVALID_RANGE,
                    String.format("range start U+%04X is greater than range end U+%04X", first, last));
        }
        set.add(first, last);
        return this;
    }

    CharClassBuilder addClass(final PosixClass posixClass) {
        set.addAll(posixClass.members());
        return this;
    }

    /**
     * @throws RegexException REGEX_UNKNOWN_CLASS if there is no POSIX class with this name
     */
    CharClassBuilder addClass(final String className) {
        PosixClass posixClass = PosixClass.forName(className);
        if (posixClass == null) {
            throw new RegexException(RegexErrorCode.REGEX_UNKNOWN_CLASS, "unknown class [:" + className + ":]");
        }
        return addClass(posixClass);
    }

    CharClassNode build(final boolean negated) {
        return new CharClassNode(set, negated);
    }
}
