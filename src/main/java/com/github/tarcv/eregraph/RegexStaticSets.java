package com.github.tarcv.eregraph;

import com.ibm.icu.text.UnicodeSet;

enum RegexStaticSets { // 'enum' here implements the singleton pattern
    INSTANCE;

    // "Rule Char" Characters are those with special meaning outside of a bracket
    //    expression, and therefore need to be escaped to appear as literals.
    //    A lone ']' is an ordinary character.
    final static String gRuleSet_rule_chars = "*?+[(){}^$|\\.";

    // Characters that start a quantifier.
    final static String gQuantifierChars = "*?+{";

    //
    //   The backslash escapes recognized with RegexSyntaxFlag.CONTROL_ESCAPES,
    //   and the characters they stand for, position by position.
    //
    final static String gControlEscapeChars = "nrtaefv";
    final static String gControlEscapeValues = "\n\r\t\u0007\u001b\f\u000b";

    final UnicodeSet fRuleChars;
    final UnicodeSet fQuantifierChars;
    final UnicodeSet fControlEscapeChars;

    /**
     * Every code point a pattern can match: U+0000..U+10FFFF.
     */
    final UnicodeSet fAlphabet;

    RegexStaticSets() {
        fRuleChars = new UnicodeSet().addAll(gRuleSet_rule_chars).freeze();
        fQuantifierChars = new UnicodeSet().addAll(gQuantifierChars).freeze();
        fControlEscapeChars = new UnicodeSet().addAll(gControlEscapeChars).freeze();
        fAlphabet = new UnicodeSet(UnicodeSet.MIN_VALUE, UnicodeSet.MAX_VALUE).freeze();
    }

    /**
     * @return the character a control escape stands for, or -1 if c is not a control escape letter
     */
    int controlEscapeValue(final int c) {
        if (!fControlEscapeChars.contains(c)) {
            return -1;
        }
        return gControlEscapeValues.charAt(gControlEscapeChars.indexOf(c));
    }
}
