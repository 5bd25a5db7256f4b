/* @LICENSE@
 */

package org.regal.regex;

import static org.regal.regex.RegexAssert.*;

public class DeterminizationTestCase extends AbstractRxTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(DeterminizationTestCase.class);
    }

    public DeterminizationTestCase(String name) {
        super(name);
    }

    private static final String[] REGEXES = {
        "a",
        EPSILON,
        "a*b*",
        "(a*c)|" + EPSILON,
        "(a|b)*abb",
        "(ab|b)*a|" + EPSILON,
        "a**|b(c|a)*",
        "(a|b|c)*a(a|b|c)",
    };

    public void testSameLanguage() {
        for (String regex : REGEXES) {
            NFA nfa = NFA.thompson(regex);
            assertSameLanguage(nfa, nfa.toDFA(), "abc", 5);
        }
    }

    public void testGlushkovSameLanguage() {
        for (String regex : REGEXES) {
            NFA nfa = NFA.glushkov(Regex.parse(regex));
            assertSameLanguage(nfa, nfa.toDFA(), "abc", 5);
        }
    }

    public void testHandBuilt() {
        DFA dfa = aStarbStarNFA().toDFA();
        assertEquals(2, dfa.stateCount());
        assertEquals(0, dfa.initialState());
        assertTrue(dfa.isFinal(0));
        assertTrue(dfa.isFinal(1));
        assertEquals(0, dfa.delta(0, 'a'));
        assertEquals(1, dfa.delta(0, 'b'));
        assertEquals(DFA.BLOCKED, dfa.delta(1, 'a'));
    }

    public void testEmptyLanguage() {
        DFA dfa = new NFA(2).addTransition(0, 'a', 1).toDFA();
        assertEquals(2, dfa.stateCount());
        assertTrue(dfa.finalStates().isEmpty());
        assertTrue(dfa.recognizeEmpty());
    }

    public void testNoDeadSubset() {
        // every discovered subset is non empty, so no state is a trap
        DFA dfa = NFA.thompson("(a|b)*abb").toDFA();
        assertTrue(dfa.stateCount() >= 4);
        for (int s = 0; s < dfa.stateCount(); ++s) {
            DFA from = DFA.copy(dfa).initialState(s);
            assertFalse("state " + s, from.recognizeEmpty());
        }
    }

    public void testBudget() {
        NFA nfa = NFA.thompson("(a|b)*a(a|b)(a|b)(a|b)");
        try {
            nfa.toDFA(4);
            fail("should throw");
        } catch (ConstructionException e) {}
        DFA dfa = nfa.toDFA();
        assertTrue(dfa.stateCount() >= 16);
        assertSameLanguage(nfa, dfa, "ab", 6);

        try {
            NFA.thompson("a").toDFA(1);
            fail("should throw");
        } catch (ConstructionException e) {}
        assertEquals(2, NFA.thompson("a").toDFA(2).stateCount());
    }

    public void testDefaultBudget() {
        assertEquals(
            Integer.getInteger("org.regal.regex.maxDfaStates", 10 * 1000).intValue(),
            NFA.MAX_DFA_STATES);
    }

    public void testLogging() {
        logRx();
        DFA dfa = NFA.thompson("(a|b)*abb").toDFA();
        assertRecognized(dfa, "abb", "babb");
    }
}
