package com.github.tarcv.eregraph;

public enum RegexErrorCode {
    /*
     * Codes in the range 0x10300-0x103ff are reserved for pattern errors.
     */
    REGEX_INTERNAL_ERROR(0x10300),        /**< An internal error (bug) was detected.                  */
    REGEX_UNTERMINATED_ESCAPE,            /**< Backslash at the very end of the pattern.              */
    REGEX_UNMATCHED_PAREN,                /**< Unclosed '(' or a ')' with no open group.              */
    REGEX_UNMATCHED_BRACKET,              /**< Bracket expression without its closing ']'.            */
    REGEX_UNEXPECTED_EOF,                 /**< Pattern ends inside a class name, range or interval.   */
    REGEX_INVALID_QUANTIFIER_RANGE,       /**< In {min,max}, max is less than min, or a bound is missing. */
    REGEX_UNEXPECTED_QUANTIFIER,          /**< Quantifier directly after another quantifier.          */
    REGEX_DANGLING_QUANTIFIER,            /**< Quantifier with nothing before it to repeat.           */
    REGEX_INVALID_RANGE,                  /**< In a character range [x-y], x is greater than y.       */
    REGEX_UNKNOWN_CLASS,                  /**< [:name:] with a name that is not a POSIX class.        */
    REGEX_EXPANSION_TOO_LARGE,            /**< The automaton would exceed the configured state limit. */
    REGEX_UNSUPPORTED_FEATURE,            /**< Anchors, equivalence classes or collating symbols.     */
    REGEX_PATTERN_TOO_BIG,                /**< Groups nested deeper than the parser allows.           */
    ;

    private final int index;

    RegexErrorCode(final int index) {
        this.index = index;
    }

    RegexErrorCode() {
        this.index = -1;
    }

    public int getIndex() {
        if (index >= 0) {
            return index;
        } else {
            return RegexErrorCode.values()[ordinal() - 1].getIndex() + 1;
        }
    }
}
