package com.github.tarcv.eregraph;

/**
 * A pattern was rejected by the parser. Only the leftmost error is reported.
 */
public class RegexParseException extends RegexException {
    static final int PARSE_CONTEXT_LEN = 16;

    private final int offset;
    private final int line;
    private final int column;
    private final String preContext;
    private final String postContext;

    RegexParseException(final RegexErrorCode errorCode, final String pattern, final int offset, final String detail) {
        super(errorCode, errorCode + " at offset " + offset + ": " + detail);
        this.offset = offset;

        int lineNumber = 1;
        int lineStart = 0;
        for (int i = 0; i < offset && i < pattern.length(); i++) {
            if (pattern.charAt(i) == '\n') {
                lineNumber++;
                lineStart = i + 1;
            }
        }
        this.line = lineNumber;
        this.column = pattern.codePointCount(lineStart, Math.min(offset, pattern.length())) + 1;

        this.preContext = pattern.substring(Math.max(0, offset - PARSE_CONTEXT_LEN), Math.min(offset, pattern.length()));
        this.postContext = offset >= pattern.length()
                ? ""
                : pattern.substring(offset, Math.min(pattern.length(), offset + PARSE_CONTEXT_LEN));
    }

    /**
     * @return index (in UTF-16 units) of the pattern character where the error was detected
     */
    public int getOffset() {
        return offset;
    }

    /**
     * @return 1-based line of the error
     */
    public int getLine() {
        return line;
    }

    /**
     * @return 1-based column (in code points) of the error within its line
     */
    public int getColumn() {
        return column;
    }

    public String getPreContext() {
        return preContext;
    }

    public String getPostContext() {
        return postContext;
    }
}
