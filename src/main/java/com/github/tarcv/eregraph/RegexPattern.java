package com.github.tarcv.eregraph;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Class `RegexPattern` represents a compiled regular expression: the parsed expression
 * tree and the Thompson NFA built from it. It includes factory methods for creating a
 * RegexPattern object from the source (string) form of a regular expression, and methods
 * for rendering the automaton as a graph.
 * <p>
 * A pattern is immutable once compiled. Nothing is shared between compilations, so
 * independent patterns can be compiled concurrently without synchronization.
 */
public final class RegexPattern {
    private static final Logger LOGGER = Logger.getLogger(RegexPattern.class.getName());

    /**
     * Default upper bound on the number of automaton states one pattern may compile to.
     */
    public static final int DEFAULT_STATE_LIMIT = 100_000;

    /**
     * The original pattern string.
     */
    private final String fPattern;
    /**
     * The flags used when compiling the pattern.
     */
    private final long fFlags;
    private final RegexNode fRoot;
    private final Automaton fAutomaton;

    private RegexPattern(final String fPattern, final long fFlags, final RegexNode fRoot, final Automaton fAutomaton) {
        this.fPattern = fPattern;
        this.fFlags = fFlags;
        this.fRoot = fRoot;
        this.fAutomaton = fAutomaton;
    }

    /**
     * Compiles the regular expression in string form into a RegexPattern
     * object using the specified {@link RegexSyntaxFlag} flags and state limit.
     *
     * @param regex      The regular expression to be compiled.
     * @param flags      The {@link RegexSyntaxFlag} flags to be used, e.g. {@link RegexSyntaxFlag#CONTROL_ESCAPES}.
     * @param stateLimit Maximum number of automaton states; larger expansions fail with
     *                   {@link RegexErrorCode#REGEX_EXPANSION_TOO_LARGE}.
     * @return A RegexPattern object for the compiled pattern.
     * @throws RegexParseException if the pattern is rejected
     */
    public static RegexPattern compile(final String regex,
                                       final Collection<RegexSyntaxFlag> flags,
                                       final int stateLimit) {
        Objects.requireNonNull(regex, "regex");
        if (stateLimit < 1) {
            throw new IllegalArgumentException("State limit must be positive: " + stateLimit);
        }
        long bits = RegexSyntaxFlag.toBits(flags);

        RegexNode root = RegexParser.parse(regex, bits, stateLimit);
        Automaton automaton = ThompsonCompiler.compile(root);
        LOGGER.fine(() -> "Compiled \"" + regex + "\" to " + automaton.getStateCount() + " states and "
                + automaton.getTransitions().size() + " transitions");
        return new RegexPattern(regex, bits, root, automaton);
    }

    /**
     * Compiles the regular expression in string form into a RegexPattern
     * object using the specified {@link RegexSyntaxFlag} flags and the default state limit.
     */
    public static RegexPattern compile(final String regex, final Collection<RegexSyntaxFlag> flags) {
        return compile(regex, flags, DEFAULT_STATE_LIMIT);
    }

    /**
     * Compiles the regular expression in string form into a RegexPattern
     * object. All flags are off.
     */
    public static RegexPattern compile(final String regex) {
        return compile(regex, Collections.emptySet());
    }

    /**
     * Parses the regular expression without building an automaton.
     *
     * @return the expression tree
     * @throws RegexParseException if the pattern is rejected
     */
    public static RegexNode parse(final String regex, final Collection<RegexSyntaxFlag> flags) {
        Objects.requireNonNull(regex, "regex");
        return RegexParser.parse(regex, RegexSyntaxFlag.toBits(flags), DEFAULT_STATE_LIMIT);
    }

    /**
     * Returns the regular expression from which this pattern was compiled.
     */
    public String pattern() {
        return fPattern;
    }

    public Set<RegexSyntaxFlag> flags() {
        EnumSet<RegexSyntaxFlag> result = EnumSet.noneOf(RegexSyntaxFlag.class);
        for (RegexSyntaxFlag f : RegexSyntaxFlag.values()) {
            if ((fFlags & f.flag) != 0) {
                result.add(f);
            }
        }
        return result;
    }

    public RegexNode root() {
        return fRoot;
    }

    public Automaton automaton() {
        return fAutomaton;
    }

    public GraphDescription toGraph() {
        return GraphSerializer.serialize(fAutomaton);
    }

    /**
     * @return the automaton in the Graphviz DOT language
     */
    public String toDot() {
        return DotWriter.toDot(toGraph());
    }

    /**
     * Two RegexPattern objects are considered equal if they were compiled from
     * identical source patterns using the same {@link RegexSyntaxFlag} settings.
     */
    @Override
    public boolean equals(final Object that) {
        if (!(that instanceof RegexPattern)) {
            return false;
        }
        final RegexPattern other = (RegexPattern) that;
        return this.fFlags == other.fFlags && this.fPattern.equals(other.fPattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fFlags, fPattern);
    }

    @Override
    public String toString() {
        return fPattern;
    }
}
