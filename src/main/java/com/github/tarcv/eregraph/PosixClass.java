package com.github.tarcv.eregraph;

import com.ibm.icu.text.UnicodeSet;

import java.util.HashMap;
import java.util.Map;

/**
 * Named character classes usable as [:name:] inside a bracket expression.
 * Members follow the POSIX locale, so every class is a subset of ASCII.
 */
public enum PosixClass {
    ALNUM("alnum", "alphanumeric", "[0-9A-Za-z]"),
    ALPHA("alpha", "alpha", "[A-Za-z]"),
    BLANK("blank", "blank", "[\\u0009\\u0020]"),
    CNTRL("cntrl", "control", "[\\u0000-\\u001F\\u007F]"),
    DIGIT("digit", "digit", "[0-9]"),
    GRAPH("graph", "graph", "[\\u0021-\\u007E]"),
    LOWER("lower", "lowercase", "[a-z]"),
    PRINT("print", "printable", "[\\u0020-\\u007E]"),
    PUNCT("punct", "punctuation", "[\\u0021-\\u002F\\u003A-\\u0040\\u005B-\\u0060\\u007B-\\u007E]"),
    SPACE("space", "whitespace", "[\\u0009-\\u000D\\u0020]"),
    UPPER("upper", "uppercase", "[A-Z]"),
    XDIGIT("xdigit", "hexadecimal", "[0-9A-Fa-f]");

    private static final Map<String, PosixClass> BY_NAME = new HashMap<>();

    static {
        for (PosixClass c : values()) {
            BY_NAME.put(c.className, c);
        }
    }

    private final String className;
    private final String description;
    private final UnicodeSet members;

    PosixClass(final String className, final String description, final String pattern) {
        this.className = className;
        this.description = description;
        this.members = new UnicodeSet().applyPattern(pattern).freeze();
    }

    /**
     * @return the class for a name as written between "[:" and ":]", or null if there is none
     */
    public static PosixClass forName(final String className) {
        return BY_NAME.get(className);
    }

    public String className() {
        return className;
    }

    public String description() {
        return description;
    }

    /**
     * @return frozen set of the class members
     */
    public UnicodeSet members() {
        return members;
    }
}
