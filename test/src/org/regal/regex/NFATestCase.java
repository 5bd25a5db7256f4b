/* @LICENSE@
 */

package org.regal.regex;

import static org.regal.regex.RegexAssert.*;

import java.util.Arrays;
import java.util.TreeSet;

public class NFATestCase extends AbstractRxTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(NFATestCase.class);
    }

    public NFATestCase(String name) {
        super(name);
    }

    public void testRecognize() {
        NFA nfa = aStarbStarNFA();
        assertRecognized(nfa, "a", "aa", "b", "bb", "aab", "abb", "aabb", "");
        assertRejected(nfa, "aba", "abab", "c");
        assertFalse(nfa.recognizeEmpty());
    }

    public void testEpsilonClosure() {
        NFA nfa = new NFA(4)
            .addEpsilonTransition(0, 1)
            .addEpsilonTransition(1, 2)
            .addEpsilonTransition(2, 0)
            .addTransition(2, 'x', 3);
        assertEquals(StateSet.of(4, 0, 1, 2), nfa.epsilonClosure(StateSet.of(4, 1)));
        assertEquals(StateSet.of(4, 3), nfa.epsilonClosure(StateSet.of(4, 3)));
        assertTrue(nfa.epsilonClosure(new StateSet(4)).isEmpty());
        assertEquals(StateSet.of(4, 3), nfa.delta(StateSet.of(4, 0), 'x'));
        assertTrue(nfa.delta(StateSet.of(4, 3), 'x').isEmpty());
        try {
            nfa.epsilonClosure(new StateSet(5));
            fail("should throw");
        } catch (IllegalArgumentException e) {}
    }

    public void testNondeterminism() {
        // words over {a,b} whose second to last symbol is a
        NFA nfa = new NFA(3)
            .addTransition(0, 'a', 0)
            .addTransition(0, 'b', 0)
            .addTransition(0, 'a', 1)
            .addTransition(1, 'a', 2)
            .addTransition(1, 'b', 2)
            .addFinalState(2);
        assertEquals(StateSet.of(3, 0, 1), nfa.destinations(0, 'a'));
        assertRecognized(nfa, "ab", "aa", "bab", "bbaa");
        assertRejected(nfa, "", "a", "b", "abb", "ba");
    }

    public void testOutOfRange() {
        NFA nfa = new NFA(2);
        try {
            nfa.addTransition(0, 'a', 2);
            fail("should throw");
        } catch (IndexOutOfBoundsException e) {}
        try {
            nfa.addTransition(-1, 'a', 0);
            fail("should throw");
        } catch (IndexOutOfBoundsException e) {}
        try {
            nfa.addEpsilonTransition(2, 0);
            fail("should throw");
        } catch (IndexOutOfBoundsException e) {}
        try {
            new NFA(0);
            fail("should throw");
        } catch (IllegalArgumentException e) {}
    }

    public void testRecognizeEmpty() {
        assertTrue(new NFA(2).addTransition(0, 'a', 1).recognizeEmpty());
        // accepting state not reachable
        assertTrue(new NFA(3).addTransition(0, 'a', 1).addFinalState(2).recognizeEmpty());
        // reachable only through epsilon
        assertFalse(new NFA(3).addEpsilonTransition(0, 2).addFinalState(2).recognizeEmpty());
        assertFalse(new NFA(1).addFinalState(0).recognizeEmpty());
    }

    public void testAlphabet() {
        NFA nfa = NFA.thompson("(b|a)*c" + EPSILON);
        assertEquals(new TreeSet<Character>(Arrays.asList('a', 'b', 'c')), nfa.alphabet());
    }

    public void testShift() {
        NFA nfa = aStarbStarNFA().shift(3);
        assertEquals(5, nfa.stateCount());
        assertEquals(3, nfa.initialState());
        assertEquals(StateSet.of(5, 4), nfa.finalStates());
        assertEquals(StateSet.of(5, 4), nfa.epsilonDestinations(3));
        assertRecognized(nfa, "", "ab", "aabb");
        assertRejected(nfa, "ba");
    }

    public void testThompson() {
        NFA nfa = NFA.thompson("(a*c)|" + EPSILON);
        assertRecognized(nfa, "aaac", "c", "");
        assertRejected(nfa, "aaa", "aca");
    }

    public void testThompsonStructure() {
        assertEquals(2, NFA.thompson("a").stateCount());
        assertEquals(4, NFA.thompson("ab").stateCount());
        assertEquals(6, NFA.thompson("a|b").stateCount());
        assertEquals(4, NFA.thompson("a*").stateCount());

        // exactly one accepting state, never the initial one
        for (String regex : new String[] {"a", EPSILON, "ab|c", "(ab)*", "a*b*"}) {
            NFA nfa = NFA.thompson(regex);
            assertEquals(regex, 1, nfa.finalStates().size());
            assertFalse(regex, nfa.isFinal(nfa.initialState()));
        }
    }

    public void testThompsonLanguages() {
        assertRecognized(NFA.thompson("(ab)*"), "", "ab", "abab");
        assertRejected(NFA.thompson("(ab)*"), "a", "aba", "ba");
        assertRecognized(NFA.thompson("a**"), "", "a", "aaa");
        assertRecognized(NFA.thompson(EPSILON + "*"), "");
        assertRejected(NFA.thompson(EPSILON + "*"), "a");
        assertRecognized(NFA.thompson("a|b|c"), "a", "b", "c");
        assertRejected(NFA.thompson("a|b|c"), "", "ab");
    }

    public void testThompsonEmpty() {
        try {
            NFA.thompson(EMPTY);
            fail("should throw");
        } catch (IllegalArgumentException e) {}
        try {
            NFA.thompson("a|b" + EMPTY);
            fail("should throw");
        } catch (IllegalArgumentException e) {}

        NFA nfa = Regex.parse("a|b" + EMPTY).withoutEmpty().toNFA();
        assertRecognized(nfa, "a");
        assertRejected(nfa, "b", "");
    }

    public void testGlushkov() {
        NFA nfa = NFA.glushkov(Regex.parse("ab|a"));
        assertEquals(4, nfa.stateCount());
        assertEquals(0, nfa.initialState());
        assertEquals(StateSet.of(4, 2, 3), nfa.finalStates());
        assertEquals(StateSet.of(4, 1, 3), nfa.destinations(0, 'a'));
        for (int s = 0; s < nfa.stateCount(); ++s) {
            assertTrue(nfa.epsilonDestinations(s).isEmpty());
        }
        assertRecognized(nfa, "a", "ab");
        assertRejected(nfa, "", "b", "aa", "abb");

        NFA epsilon = NFA.glushkov(Regex.parse(EPSILON));
        assertEquals(1, epsilon.stateCount());
        assertRecognized(epsilon, "");

        try {
            NFA.glushkov(Regex.parse("a" + EMPTY));
            fail("should throw");
        } catch (IllegalArgumentException e) {}
    }

    public void testGlushkovAgreesWithThompson() {
        for (String regex : new String[] {
                "(a*c)|" + EPSILON, "(a|b)*abb", "a*b*", "(ab|b)*a|" + EPSILON}) {
            NFA t = NFA.thompson(regex);
            NFA g = NFA.glushkov(Regex.parse(regex));
            for (String w : words("abc", 5)) {
                assertEquals(regex + " on \"" + w + "\"", t.isRecognized(w), g.isRecognized(w));
            }
        }
    }

    public void testToDot() {
        String dot = aStarbStarNFA().toDot("a*b*");
        assertTrue(dot, dot.startsWith("digraph \"a*b*\" {"));
        assertTrue(dot, dot.contains("node [shape = doublecircle]; 1;"));
        assertTrue(dot, dot.contains("qi -> 0;"));
        assertTrue(dot, dot.contains("0 -> 1 [label = \"" + EPSILON + "\"];"));
        assertTrue(dot, dot.contains("1 -> 1 [label = \"b\"];"));
        assertTrue(dot, dot.endsWith("}"));
    }

    public void testReplaceFinalStates() {
        NFA nfa = aStarbStarNFA();
        nfa.finalStates(StateSet.of(2, 0));
        assertEquals(StateSet.of(2, 0), nfa.finalStates());
        assertRecognized(nfa, "", "aa");
        assertRejected(nfa, "b", "ab");

        nfa.finalStates(new StateSet(2));
        assertTrue(nfa.recognizeEmpty());
        try {
            nfa.finalStates(new StateSet(3));
            fail("should throw");
        } catch (IllegalArgumentException e) {}
    }
}
