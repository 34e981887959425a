package com.github.tarcv.eregraph;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import static com.github.tarcv.eregraph.PatternScanner.U_SENTINEL;
import static com.github.tarcv.eregraph.RegexErrorCode.*;
import static com.github.tarcv.eregraph.RegexSyntaxFlag.CONTROL_ESCAPES;
import static com.github.tarcv.eregraph.RegexSyntaxFlag.LITERAL;

/**
 * Recursive descent parser for the extended regular expression grammar:
 * <pre>
 *   re         := branch ( "|" branch )*
 *   branch     := simple-re*
 *   simple-re  := basic-re quantifier?
 *   basic-re   := "(" re ")" | "." | bracket | literal
 *   quantifier := "?" | "*" | "+" | "{" number ( "," number? )? "}"
 *   bracket    := "[" "^"? list "]"
 * </pre>
 * The pattern is consumed left to right with at most two characters of lookahead.
 * The first error stops the parse; no partial tree is returned.
 */
final class RegexParser {
    private static final Logger LOGGER = Logger.getLogger(RegexParser.class.getName());

    /**
     * Deepest group nesting accepted. Parsing, state counting and compilation all recurse once per level.
     */
    static final int MAX_NESTING_DEPTH = 1000;

    private final PatternScanner scanner;
    private final long flags;
    private final int stateLimit;
    private final StateCountEstimator estimator = new StateCountEstimator();
    private int depth;

    private RegexParser(final String pattern, final long flags, final int stateLimit) {
        this.scanner = new PatternScanner(pattern, (flags & CONTROL_ESCAPES.flag) != 0);
        this.flags = flags;
        this.stateLimit = stateLimit;
    }

    /**
     * @throws RegexParseException if the pattern is malformed, uses an unsupported feature
     *                             or would compile to more than {@code stateLimit} states
     */
    static RegexNode parse(final String pattern, final long flags, final int stateLimit) {
        RegexParser parser = new RegexParser(pattern, flags, stateLimit);
        try {
            return parser.parsePattern();
        } catch (RegexParseException e) {
            LOGGER.fine(() -> "Rejected pattern \"" + pattern + "\": " + e.getMessage());
            throw e;
        }
    }

    private RegexNode parsePattern() {
        RegexNode root;
        if ((flags & LITERAL.flag) != 0) {
            root = parseLiteralPattern();
        } else {
            root = parseRe();
            if (!scanner.atEnd()) {
                // parseRe() stops early only at a ')' it has no group for
                throw scanner.error(REGEX_UNMATCHED_PAREN, scanner.offset(), "')' without a matching '('");
            }
        }
        checkStateLimit(root, 0);
        return root;
    }

    private RegexNode parseLiteralPattern() {
        List<RegexNode> items = new ArrayList<>();
        while (!scanner.atEnd()) {
            items.add(new LiteralNode(scanner.next32()));
        }
        return items.size() == 1 ? items.get(0) : new ConcatNode(items);
    }

    private RegexNode parseRe() {
        List<RegexNode> branches = new ArrayList<>();
        branches.add(parseBranch());
        while (scanner.match('|')) {
            branches.add(parseBranch());
        }
        return branches.size() == 1 ? branches.get(0) : new AlternationNode(branches);
    }

    private RegexNode parseBranch() {
        List<RegexNode> items = new ArrayList<>();
        while (!scanner.atEnd()) {
            int c = scanner.current32();
            if (c == '|' || c == ')') {
                break;
            }
            items.add(parseSimpleRe());
        }
        // an empty branch stays an empty Concat, which matches the empty string
        return items.size() == 1 ? items.get(0) : new ConcatNode(items);
    }

    private RegexNode parseSimpleRe() {
        RegexNode atom = parseBasicRe();
        if (!isQuantifierStart(scanner.current32())) {
            return atom;
        }
        int quantifierOffset = scanner.offset();
        RegexNode repeat = parseQuantifier(atom);
        if (isQuantifierStart(scanner.current32())) {
            throw scanner.error(REGEX_UNEXPECTED_QUANTIFIER, scanner.offset(),
                    "a quantifier can't follow another quantifier");
        }
        checkStateLimit(repeat, quantifierOffset);
        return repeat;
    }

    private RegexNode parseBasicRe() {
        PatternScanner.CodeAndOffset c = scanner.nextChar();
        if (!PatternScanner.isRuleChar(c)) {
            return new LiteralNode(c.code);
        }
        switch (c.code) {
            case '(':
                return parseGroup(c.offset);
            case '[':
                return parseBracket(c.offset);
            case '.':
                return AnyCharNode.INSTANCE;
            case '^':
            case '$':
                throw scanner.error(REGEX_UNSUPPORTED_FEATURE, c.offset, "anchors are not supported");
            case '*':
            case '+':
            case '?':
            case '{':
                throw scanner.error(REGEX_DANGLING_QUANTIFIER, c.offset, "nothing to repeat");
            case '}':
                throw scanner.error(REGEX_DANGLING_QUANTIFIER, c.offset, "'}' without an opening '{'");
            default:
                // '|' and ')' end a branch before reaching here
                throw new IllegalStateException("Unexpected rule character " + RegexNode.formatCodePoint(c.code));
        }
    }

    private RegexNode parseGroup(final int openOffset) {
        if (++depth > MAX_NESTING_DEPTH) {
            throw scanner.error(REGEX_PATTERN_TOO_BIG, openOffset,
                    "groups are nested deeper than " + MAX_NESTING_DEPTH + " levels");
        }
        RegexNode inner = parseRe();
        if (!scanner.match(')')) {
            throw scanner.error(REGEX_UNMATCHED_PAREN, openOffset, "'(' is never closed");
        }
        depth--;
        return new GroupNode(inner);
    }

    private static boolean isQuantifierStart(final int c) {
        return c != U_SENTINEL && RegexStaticSets.INSTANCE.fQuantifierChars.contains(c);
    }

    private RegexNode parseQuantifier(final RegexNode atom) {
        int c = scanner.next32();
        switch (c) {
            case '?':
                return new RepeatNode(atom, 0, 1);
            case '*':
                return new RepeatNode(atom, 0, RepeatNode.UNBOUNDED);
            case '+':
                return new RepeatNode(atom, 1, RepeatNode.UNBOUNDED);
            case '{':
                return parseInterval(atom);
            default:
                throw new IllegalStateException("Not a quantifier: " + RegexNode.formatCodePoint(c));
        }
    }

    // The opening '{' has been consumed.
    private RegexNode parseInterval(final RegexNode atom) {
        int min = parseNumber();
        int max = min;
        if (scanner.match(',')) {
            if (scanner.current32() == '}') {
                max = RepeatNode.UNBOUNDED;
            } else {
                int maxOffset = scanner.offset();
                max = parseNumber();
                if (max < min) {
                    throw scanner.error(REGEX_INVALID_QUANTIFIER_RANGE, maxOffset,
                            "maximum " + max + " is less than minimum " + min);
                }
            }
        }
        if (scanner.atEnd()) {
            throw scanner.error(REGEX_UNEXPECTED_EOF, scanner.offset(), "'}' expected");
        }
        if (!scanner.match('}')) {
            throw scanner.error(REGEX_INVALID_QUANTIFIER_RANGE, scanner.offset(), "'}' expected");
        }
        return new RepeatNode(atom, min, max);
    }

    private int parseNumber() {
        int start = scanner.offset();
        if (scanner.atEnd()) {
            throw scanner.error(REGEX_UNEXPECTED_EOF, start, "number expected");
        }
        long value = 0;
        while (isDigit(scanner.current32())) {
            value = value * 10 + (scanner.next32() - '0');
            if (value > Integer.MAX_VALUE) {
                throw scanner.error(REGEX_EXPANSION_TOO_LARGE, start, "number is too big");
            }
        }
        if (scanner.offset() == start) {
            throw scanner.error(REGEX_INVALID_QUANTIFIER_RANGE, start, "number expected");
        }
        return (int) value;
    }

    private static boolean isDigit(final int c) {
        return c >= '0' && c <= '9';
    }

    // The opening '[' has been consumed.
    private RegexNode parseBracket(final int openOffset) {
        boolean negated = scanner.match('^');
        CharClassBuilder builder = new CharClassBuilder();
        boolean first = true;
        while (true) {
            if (scanner.atEnd()) {
                throw scanner.error(REGEX_UNMATCHED_BRACKET, openOffset, "'[' is never closed");
            }
            int c = scanner.current32();
            if (c == ']' && !first) {
                scanner.next32();
                break;
            }
            if (c == '[' && isClassIntroducer(scanner.peek32(1))) {
                parseNamedClass(builder);
            } else {
                parseBracketTerm(builder);
            }
            first = false;
        }
        return builder.build(negated);
    }

    private static boolean isClassIntroducer(final int c) {
        return c == ':' || c == '=' || c == '.';
    }

    // A single character or a range. A leading ']' and a '-' that can't start a range are literals.
    private void parseBracketTerm(final CharClassBuilder builder) {
        PatternScanner.CodeAndOffset first = scanner.nextChar();
        if (scanner.current32() != '-') {
            builder.addChar(first.code);
            return;
        }
        int afterDash = scanner.peek32(1);
        if (afterDash == ']') {
            // trailing '-' is picked up as a literal by the next term
            builder.addChar(first.code);
            return;
        }
        scanner.next32();
        if (afterDash == U_SENTINEL) {
            throw scanner.error(REGEX_UNEXPECTED_EOF, scanner.offset(), "range end expected");
        }
        if (afterDash == '[' && isClassIntroducer(scanner.peek32(1))) {
            throw scanner.error(REGEX_INVALID_RANGE, scanner.offset(), "a range can't end with a class");
        }
        PatternScanner.CodeAndOffset last = scanner.nextChar();
        try {
            builder.addRange(first.code, last.code);
        } catch (RegexException e) {
            throw withOffset(e, first.offset);
        }
    }

    // At "[:", "[=" or "[.".
    private void parseNamedClass(final CharClassBuilder builder) {
        int start = scanner.offset();
        scanner.next32();
        int kind = scanner.next32();
        if (kind == '=') {
            throw scanner.error(REGEX_UNSUPPORTED_FEATURE, start, "equivalence classes are not supported");
        }
        if (kind == '.') {
            throw scanner.error(REGEX_UNSUPPORTED_FEATURE, start, "collating symbols are not supported");
        }
        int nameStart = scanner.offset();
        int close = scanner.indexOf(":]");
        if (close < 0) {
            throw scanner.error(REGEX_UNEXPECTED_EOF, scanner.pattern().length(), "':]' expected");
        }
        String name = scanner.pattern().substring(nameStart, close);
        try {
            builder.addClass(name);
        } catch (RegexException e) {
            throw withOffset(e, nameStart);
        }
        scanner.setOffset(close + 2);
    }

    private RegexParseException withOffset(final RegexException e, final int offset) {
        RegexParseException positioned = scanner.error(e.getErrorCode(), offset, e.getMessage());
        positioned.initCause(e);
        return positioned;
    }

    private void checkStateLimit(final RegexNode node, final int offset) {
        long states = estimator.totalStates(node);
        if (states > stateLimit) {
            throw scanner.error(REGEX_EXPANSION_TOO_LARGE, offset,
                    "automaton would need " + (states == Long.MAX_VALUE ? "too many" : Long.toString(states))
                            + " states, the limit is " + stateLimit);
        }
    }
}
