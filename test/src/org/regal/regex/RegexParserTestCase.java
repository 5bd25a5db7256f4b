/* @LICENSE@
 */

package org.regal.regex;

import static org.regal.regex.RegexAssert.*;

import org.regal.regex.AST.Concat;
import org.regal.regex.AST.Node;
import org.regal.regex.AST.Star;
import org.regal.regex.AST.Symbol;
import org.regal.regex.AST.Union;

public class RegexParserTestCase extends AbstractRxTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(RegexParserTestCase.class);
    }

    public RegexParserTestCase(String name) {
        super(name);
    }

    private static Node parse(String regex) {
        return new RegexParser().parse(regex);
    }

    private static void assertRoundTrip(String regex) {
        assertEquals(regex, Regex.parse(regex).toString());
    }

    public void testRoundTrip() {
        assertRoundTrip("a");
        assertRoundTrip(EPSILON);
        assertRoundTrip(EMPTY);
        assertRoundTrip("ab");
        assertRoundTrip("a*");
        assertRoundTrip("a**");
        assertRoundTrip("a|b");
        assertRoundTrip("(ab)*");
        assertRoundTrip("(a|b)*c");
        assertRoundTrip(EPSILON + "|a*b");
        assertRoundTrip("(0|(1(01*(00)*0)*1)*)*");
    }

    public void testRedundantParens() {
        assertEquals("abc", Regex.parse("(ab)c").toString());
        assertEquals("a|b|c", Regex.parse("((a|b))|c").toString());
        assertEquals("a*", Regex.parse("(a)*").toString());
    }

    public void testStarBindsTighterThanConcat() {
        Node root = parse("ab*");
        assertTrue(root instanceof Concat);
        assertTrue(((Concat) root).first instanceof Symbol);
        assertTrue(((Concat) root).second instanceof Star);
    }

    public void testConcatBindsTighterThanUnion() {
        Node root = parse("ab|c");
        assertTrue(root instanceof Union);
        assertTrue(((Union) root).first instanceof Concat);
        assertTrue(((Union) root).second instanceof Symbol);
    }

    public void testRightAssociative() {
        Node root = parse("a|b|c");
        assertTrue(((Union) root).first instanceof Symbol);
        assertTrue(((Union) root).second instanceof Union);

        root = parse("abc");
        assertEquals('a', ((Symbol) ((Concat) root).first).symbol);
        assertTrue(((Concat) root).second instanceof Concat);
    }

    public void testLiterals() {
        assertTrue(parse(EPSILON) instanceof AST.Epsilon);
        assertTrue(parse(EMPTY) instanceof AST.Empty);
        // anything but the meta characters is a symbol
        assertEquals('.', ((Symbol) parse(".")).symbol);
        assertEquals(' ', ((Symbol) parse(" ")).symbol);
    }

    public void testTreeString() {
        Regex r = Regex.concat(
            Regex.star(Regex.concat(
                Regex.union(Regex.symbol('a'), Regex.symbol('b'), Regex.epsilon()),
                Regex.empty())),
            Regex.symbol('c'));
        assertEquals("((a|b|" + EPSILON + ")" + EMPTY + ")*c", r.toString());
        String ls = Misc.LS;
        assertEquals(
            "&" + ls +
            "    *" + ls +
            "        &" + ls +
            "            |" + ls +
            "                a {0}" + ls +
            "                |" + ls +
            "                    b {1}" + ls +
            "                    " + EPSILON + " {2}" + ls +
            "            " + EMPTY + " {3}" + ls +
            "    c {4}" + ls,
            r.toTreeString());
    }

    public void testSyntaxErrors() {
        assertSyntaxError("", 0);
        assertSyntaxError("a|", 2);
        assertSyntaxError("|a", 0);
        assertSyntaxError("(a", 2);
        assertSyntaxError("(a|b", 4);
        assertSyntaxError("a)", 1);
        assertSyntaxError("(a*)*)b", 5);
        assertSyntaxError("*a", 0);
        assertSyntaxError("()", 1);
        assertSyntaxError("a||b", 2);
    }

    public void testNull() {
        try {
            Regex.parse(null);
            fail("should throw");
        } catch (NullPointerException e) {}
    }
}
