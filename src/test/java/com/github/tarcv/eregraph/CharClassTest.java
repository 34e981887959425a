package com.github.tarcv.eregraph;

import com.ibm.icu.text.UnicodeSet;
import org.junit.Assert;
import org.junit.Test;

import java.util.Collections;

import static com.github.tarcv.eregraph.LambdaAssert.assertTrue;

public class CharClassTest {

    static CharClassNode bracket(final String pattern) {
        RegexNode node = RegexPattern.parse(pattern, Collections.emptySet());
        Assert.assertTrue(node.toString(), node instanceof CharClassNode);
        return (CharClassNode) node;
    }

    @Test
    public void RangesAreNormalized() {
        CharClassNode node = bracket("[d-fa-ce]");
        Assert.assertEquals(1, node.getSet().getRangeCount());
        Assert.assertEquals('a', node.getSet().getRangeStart(0));
        Assert.assertEquals('f', node.getSet().getRangeEnd(0));

        Assert.assertEquals(bracket("[a-z]"), bracket("[a-mn-z]"));
        Assert.assertEquals(bracket("[a-z]"), bracket("[a-zbcq]"));
        Assert.assertEquals(bracket("[xa]"), bracket("[ax]"));
        Assert.assertEquals(3, bracket("[0-9.[:lower:]]").getSet().getRangeCount());
    }

    @Test
    public void NegationIsComplement() {
        CharClassNode plain = bracket("[a-z[:digit:]]");
        CharClassNode negated = bracket("[^a-z[:digit:]]");
        Assert.assertFalse(plain.isNegated());
        Assert.assertTrue(negated.isNegated());
        Assert.assertEquals(plain.getSet(), negated.getSet());

        int[] probes = {0, 'a', 'z', '5', 'A', '-', 0x7f, 0xe9, 0xffff, 0x10000, 0x1f600, 0x10ffff};
        for (int c : probes) {
            assertTrue(() -> "Exactly one of the classes matches " + RegexNode.formatCodePoint(c),
                    plain.matches(c) != negated.matches(c));
        }
        Assert.assertEquals(0x110000,
                plain.getResolvedSet().size() + negated.getResolvedSet().size());
    }

    @Test
    public void PosixClasses() {
        Assert.assertEquals(12, PosixClass.values().length);
        for (PosixClass posixClass : PosixClass.values()) {
            Assert.assertSame(posixClass, PosixClass.forName(posixClass.className()));
            assertTrue(() -> posixClass + " stays within ASCII",
                    new UnicodeSet(0, 0x7f).containsAll(posixClass.members()));
            Assert.assertEquals(posixClass.members(),
                    bracket("[[:" + posixClass.className() + ":]]").getSet());
        }
        Assert.assertNull(PosixClass.forName("foo"));
        Assert.assertNull(PosixClass.forName("ALPHA"));

        Assert.assertEquals(62, PosixClass.ALNUM.members().size());
        Assert.assertEquals(32, PosixClass.PUNCT.members().size());
        Assert.assertEquals(95, PosixClass.PRINT.members().size());
        Assert.assertEquals(94, PosixClass.GRAPH.members().size());
        Assert.assertEquals(33, PosixClass.CNTRL.members().size());
        Assert.assertEquals(22, PosixClass.XDIGIT.members().size());
        Assert.assertEquals(6, PosixClass.SPACE.members().size());
        Assert.assertTrue(PosixClass.BLANK.members().contains('\t'));
        Assert.assertFalse(PosixClass.BLANK.members().contains('\n'));
        Assert.assertEquals("hexadecimal", PosixClass.XDIGIT.description());
    }

    @Test
    public void Builder() {
        CharClassBuilder builder = new CharClassBuilder()
                .addChar('x')
                .addRange('a', 'c')
                .addRange('q', 'q')
                .addClass(PosixClass.DIGIT);
        CharClassNode node = builder.build(false);
        Assert.assertEquals(new UnicodeSet("[0-9a-cqx]"), node.getSet());

        try {
            new CharClassBuilder().addRange('b', 'a');
            Assert.fail();
        } catch (RegexException e) {
            Assert.assertEquals(RegexErrorCode.REGEX_INVALID_RANGE, e.getErrorCode());
        }
        try {
            new CharClassBuilder().addClass("word");
            Assert.fail();
        } catch (RegexException e) {
            Assert.assertEquals(RegexErrorCode.REGEX_UNKNOWN_CLASS, e.getErrorCode());
        }
    }

    @Test
    public void NodeIsImmutable() {
        UnicodeSet source = new UnicodeSet("[a-c]");
        CharClassNode node = new CharClassNode(source, false);
        source.add('z');
        Assert.assertFalse(node.matches('z'));
        Assert.assertTrue(node.getSet().isFrozen());
        Assert.assertEquals("CharClass(^[a-c])", new CharClassNode(new UnicodeSet("[a-c]"), true).toString());
    }
}
