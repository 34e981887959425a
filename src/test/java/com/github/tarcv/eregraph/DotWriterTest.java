package com.github.tarcv.eregraph;

import org.junit.Assert;
import org.junit.Test;

import java.io.IOException;
import java.io.StringWriter;

public class DotWriterTest {

    @Test
    public void SingleCharacter() {
        Assert.assertEquals("digraph {\n"
                        + "rankdir = LR;\n"
                        + "start [shape = point];\n"
                        + "0 [shape = circle];\n"
                        + "1 [shape = doublecircle];\n"
                        + "start -> 0;\n"
                        + "0 -> 1 [label = \"a\"];\n"
                        + "}\n",
                RegexPattern.compile("a").toDot());
    }

    @Test
    public void EmptyPattern() {
        Assert.assertEquals("digraph {\n"
                        + "rankdir = LR;\n"
                        + "start [shape = point];\n"
                        + "0 [shape = doublecircle];\n"
                        + "start -> 0;\n"
                        + "}\n",
                RegexPattern.compile("").toDot());
    }

    @Test
    public void Star() {
        Assert.assertEquals("digraph {\n"
                        + "rankdir = LR;\n"
                        + "start [shape = point];\n"
                        + "0 [shape = circle];\n"
                        + "1 [shape = circle];\n"
                        + "2 [shape = circle];\n"
                        + "3 [shape = doublecircle];\n"
                        + "start -> 0;\n"
                        + "0 -> 1 [label = \"ε\"];\n"
                        + "1 -> 2 [label = \"a\"];\n"
                        + "2 -> 0 [label = \"ε\"];\n"
                        + "0 -> 3 [label = \"ε\"];\n"
                        + "}\n",
                RegexPattern.compile("a*").toDot());
    }

    @Test
    public void Quoting() {
        Assert.assertEquals("\"a\"", DotWriter.quote("a"));
        Assert.assertEquals("\"\\\"\"", DotWriter.quote("\""));
        Assert.assertEquals("\"\\\\\"", DotWriter.quote("\\"));
        Assert.assertEquals("\"[\\\\-\\\\]]\"", DotWriter.quote("[\\-\\]]"));

        String dot = RegexPattern.compile("\\\"| ").toDot();
        Assert.assertTrue(dot, dot.contains("1 -> 2 [label = \"\\\"\"];\n"));
        Assert.assertTrue(dot, dot.contains("3 -> 4 [label = \"\\\\u0020\"];\n"));
    }

    @Test
    public void WritesToAppendable() throws IOException {
        RegexPattern pattern = RegexPattern.compile("x|y*");
        StringWriter writer = new StringWriter();
        DotWriter.write(pattern.toGraph(), writer);
        Assert.assertEquals(pattern.toDot(), writer.toString());
    }
}
