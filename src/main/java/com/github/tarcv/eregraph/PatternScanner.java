package com.github.tarcv.eregraph;

import com.ibm.icu.lang.UCharacter;

/**
 * Walks a pattern one code point at a time and resolves backslash escapes.
 * <p>
 * The scanner decides only whether a character was escaped; what an unescaped
 * character means is up to the caller, which knows whether it is in the main
 * grammar or inside a bracket expression.
 */
final class PatternScanner {
    static final int U_SENTINEL = -1;

    /**
     * One pattern character after escape resolution.
     */
    static final class CodeAndOffset {
        final int code;
        final int offset;
        final boolean escaped;

        CodeAndOffset(final int code, final int offset, final boolean escaped) {
            this.code = code;
            this.offset = offset;
            this.escaped = escaped;
        }
    }

    private final String targetString;
    private final int chunkLength;
    private final boolean controlEscapes;
    private int chunkOffset;

    PatternScanner(final String targetString, final boolean controlEscapes) {
        this.targetString = targetString;
        this.chunkLength = targetString.length();
        this.controlEscapes = controlEscapes;
    }

    String pattern() {
        return targetString;
    }

    int offset() {
        return chunkOffset;
    }

    void setOffset(final int offset) {
        if (offset < chunkOffset || offset > chunkLength) {
            throw new IllegalArgumentException("Can't move from " + chunkOffset + " to " + offset);
        }
        chunkOffset = offset;
    }

    boolean atEnd() {
        return chunkOffset >= chunkLength;
    }

    int current32() {
        if (chunkOffset >= chunkLength) {
            return U_SENTINEL;
        }
        return UCharacter.codePointAt(targetString, chunkOffset);
    }

    /**
     * @return the code point {@code delta} code points after the current one, or U_SENTINEL past the end
     */
    int peek32(final int delta) {
        int index = chunkOffset;
        for (int i = 0; i < delta; i++) {
            if (index >= chunkLength) {
                return U_SENTINEL;
            }
            index += UCharacter.charCount(UCharacter.codePointAt(targetString, index));
        }
        if (index >= chunkLength) {
            return U_SENTINEL;
        }
        return UCharacter.codePointAt(targetString, index);
    }

    int next32() {
        int result = current32();
        if (result == U_SENTINEL) {
            return U_SENTINEL;
        }
        chunkOffset += UCharacter.charCount(result);
        return result;
    }

    boolean match(final int c) {
        if (current32() == c) {
            next32();
            return true;
        }
        return false;
    }

    int indexOf(final String str) {
        return targetString.indexOf(str, chunkOffset);
    }

    /**
     * Reads one character. A backslash makes the following character a literal,
     * with the control escapes mapped when they are enabled.
     *
     * @throws RegexParseException REGEX_UNTERMINATED_ESCAPE for a backslash at the end of the pattern
     */
    CodeAndOffset nextChar() {
        int start = chunkOffset;
        int c = next32();
        if (c == U_SENTINEL) {
            throw error(RegexErrorCode.REGEX_UNEXPECTED_EOF, start, "character expected");
        }
        if (c != '\\') {
            return new CodeAndOffset(c, start, false);
        }
        int escaped = next32();
        if (escaped == U_SENTINEL) {
            throw error(RegexErrorCode.REGEX_UNTERMINATED_ESCAPE, start, "nothing follows '\\'");
        }
        if (controlEscapes) {
            int value = RegexStaticSets.INSTANCE.controlEscapeValue(escaped);
            if (value >= 0) {
                escaped = value;
            }
        }
        return new CodeAndOffset(escaped, start, true);
    }

    /**
     * @return true if {@code c} has to be interpreted by the main grammar rather than taken as a literal.
     * Inside a bracket expression only the position of a character decides, so this does not apply there.
     */
    static boolean isRuleChar(final CodeAndOffset c) {
        return !c.escaped && RegexStaticSets.INSTANCE.fRuleChars.contains(c.code);
    }

    RegexParseException error(final RegexErrorCode code, final int offset, final String detail) {
        return new RegexParseException(code, targetString, offset, detail);
    }
}
