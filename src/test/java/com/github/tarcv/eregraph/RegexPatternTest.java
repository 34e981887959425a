package com.github.tarcv.eregraph;

import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

public class RegexPatternTest {
    private static final Logger LOGGER = Logger.getLogger(RegexPatternTest.class.getName());

    @Test
    public void Accessors() {
        RegexPattern pattern = RegexPattern.compile("a|b");
        Assert.assertEquals("a|b", pattern.pattern());
        Assert.assertEquals("a|b", pattern.toString());
        Assert.assertTrue(pattern.flags().isEmpty());
        Assert.assertEquals(RegexPattern.parse("a|b", Collections.emptySet()), pattern.root());
        Assert.assertEquals(6, pattern.automaton().getStateCount());
        Assert.assertEquals(GraphSerializer.serialize(pattern.automaton()), pattern.toGraph());

        RegexPattern withFlags = RegexPattern.compile("\\t", EnumSet.of(RegexSyntaxFlag.CONTROL_ESCAPES));
        Assert.assertEquals(EnumSet.of(RegexSyntaxFlag.CONTROL_ESCAPES), withFlags.flags());
        Assert.assertEquals(new LiteralNode('\t'), withFlags.root());
    }

    @Test
    public void Equality() {
        RegexPattern a1 = RegexPattern.compile("a+");
        RegexPattern a2 = RegexPattern.compile("a+", Collections.emptySet());
        RegexPattern literal = RegexPattern.compile("a+", EnumSet.of(RegexSyntaxFlag.LITERAL));
        Assert.assertEquals(a1, a2);
        Assert.assertEquals(a1.hashCode(), a2.hashCode());
        Assert.assertNotEquals(a1, literal);
        Assert.assertNotEquals(a1, RegexPattern.compile("a*"));
        Assert.assertNotEquals(a1, "a+");
    }

    @Test
    public void LiteralPatterns() {
        RegexPattern pattern = RegexPattern.compile("(a|b)*", EnumSet.of(RegexSyntaxFlag.LITERAL));
        Assert.assertEquals(7, pattern.automaton().getStateCount());
        Assert.assertTrue(NfaSimulator.accepts(pattern.automaton(), "(a|b)*"));
        Assert.assertFalse(NfaSimulator.accepts(pattern.automaton(), "a"));
    }

    @Test
    public void StateLimit() {
        try {
            RegexPattern.compile("a", Collections.emptySet(), 0);
            Assert.fail();
        } catch (IllegalArgumentException expected) {
            // expected
        }

        RegexPattern.compile("a{99999}");
        try {
            RegexPattern.compile("a{100000}");
            Assert.fail();
        } catch (RegexParseException e) {
            Assert.assertEquals(RegexErrorCode.REGEX_EXPANSION_TOO_LARGE, e.getErrorCode());
            Assert.assertEquals(1, e.getOffset());
        }

        try {
            RegexPattern.compile("x(a{10}){10}", Collections.emptySet(), 50);
            Assert.fail();
        } catch (RegexParseException e) {
            Assert.assertEquals(RegexErrorCode.REGEX_EXPANSION_TOO_LARGE, e.getErrorCode());
            Assert.assertEquals(8, e.getOffset());
        }
    }

    @Test
    public void ErrorCodes() {
        Assert.assertEquals(0x10300, RegexErrorCode.REGEX_INTERNAL_ERROR.getIndex());
        Assert.assertEquals(0x10300 + 11, RegexErrorCode.REGEX_UNSUPPORTED_FEATURE.getIndex());
        Assert.assertEquals(0x10300 + 12, RegexErrorCode.REGEX_PATTERN_TOO_BIG.getIndex());
        for (RegexErrorCode code : RegexErrorCode.values()) {
            Assert.assertEquals(0x10300 + code.ordinal(), code.getIndex());
        }
    }

    @Test
    public void DeeplyNestedPatternCompiles() {
        int depth = RegexParser.MAX_NESTING_DEPTH;
        String pattern = "(".repeat(depth) + "a*" + ")".repeat(depth) + "b";
        RegexPattern compiled = RegexPattern.compile(pattern);
        Assert.assertEquals(5, compiled.automaton().getStateCount());
        Assert.assertTrue(NfaSimulator.accepts(compiled.automaton(), "aab"));
        Assert.assertTrue(compiled.toDot().startsWith("digraph {"));
    }

    @Test
    public void InvalidArguments() {
        try {
            RegexPattern.compile(null);
            Assert.fail();
        } catch (NullPointerException expected) {
            // expected
        }
    }

    @Test
    public void RejectionsAreLogged() {
        Logger parserLogger = Logger.getLogger(RegexParser.class.getName());
        List<LogRecord> records = new ArrayList<>();
        Handler handler = new Handler() {
            @Override
            public void publish(final LogRecord record) {
                records.add(record);
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        handler.setLevel(Level.ALL);
        Level oldLevel = parserLogger.getLevel();
        parserLogger.setLevel(Level.FINE);
        parserLogger.addHandler(handler);
        try {
            RegexPattern.compile("a**");
            Assert.fail();
        } catch (RegexParseException e) {
            Assert.assertEquals(1, records.size());
            Assert.assertEquals(Level.FINE, records.get(0).getLevel());
            Assert.assertTrue(records.get(0).getMessage(), records.get(0).getMessage().contains("a**"));
        } finally {
            parserLogger.removeHandler(handler);
            parserLogger.setLevel(oldLevel);
        }
    }

    @Test
    public void ConcurrentCompilation() throws Exception {
        final String[] patterns = {"(a|b)*abb", "[[:alpha:]_][[:alnum:]_]*", "x{2,40}", "fo+(bar)?", ".*z"};
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Callable<String>> tasks = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                final String pattern = patterns[i % patterns.length];
                tasks.add(() -> RegexPattern.compile(pattern).toDot());
            }
            List<Future<String>> results = executor.invokeAll(tasks);
            for (int i = 0; i < results.size(); i++) {
                String expected = RegexPattern.compile(patterns[i % patterns.length]).toDot();
                Assert.assertEquals(expected, results.get(i).get());
            }
        } finally {
            executor.shutdown();
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                LOGGER.warning("Compile workers did not stop in time");
            }
        }
    }
}
