/* @LICENSE@
 */

package org.regal.regex;

import static org.regal.regex.Misc.LS;
import static org.regal.regex.Misc.iterize;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.regal.regex.Misc.BreadthFirstVisitor;

/**
 * A deterministic finite automaton over the states
 * <code>0..stateCount()-1</code>. The transition function is partial unless
 * the automaton has been {@linkplain #makeComplete() completed}: a missing
 * transition is reported as {@link #BLOCKED}, and blocking rejects the word.
 * <p>
 * {@link #makeComplete()} and {@link #makeComplementary()} mutate in place;
 * apply them to a {@linkplain #copy(DFA) copy} when the original must
 * survive. Instances are not safe for concurrent mutation.
 */
public final class DFA {

    private static final Logger logger = Logger.getLogger("org.regal.regex");
    private static final Level level = Level.FINER;

    /**
     * The non-state: destination of a missing transition.
     */
    public static final int BLOCKED = -1;

    private final List<SortedMap<Character, Integer>> rows;
    private int initialState = 0;
    private final SortedSet<Integer> finalStates = new TreeSet<Integer>();

    public DFA(int stateCount) {
        if (stateCount < 1) {
            throw new IllegalArgumentException(
                "an automaton has at least one state: " + stateCount);
        }
        rows = new ArrayList<SortedMap<Character, Integer>>(stateCount);
        for (int i = 0; i < stateCount; ++i) {
            rows.add(new TreeMap<Character, Integer>());
        }
    }

    public int stateCount() {
        return rows.size();
    }

    /**
     * @return the number of the new state, which has no transitions
     */
    public int addState() {
        rows.add(new TreeMap<Character, Integer>());
        return rows.size() - 1;
    }

    public int initialState() {
        return initialState;
    }

    public DFA initialState(int state) {
        Misc.checkIndex(state, stateCount(), "initial state");
        this.initialState = state;
        return this;
    }

    public DFA addFinalState(int state) {
        Misc.checkIndex(state, stateCount(), "final state");
        finalStates.add(state);
        return this;
    }

    public boolean isFinal(int state) {
        Misc.checkIndex(state, stateCount(), "state");
        return finalStates.contains(state);
    }

    public SortedSet<Integer> finalStates() {
        return Collections.unmodifiableSortedSet(finalStates);
    }

    /**
     * Sets the destination of <code>(from, symbol)</code>, replacing any
     * previous one.
     */
    public DFA addTransition(int from, char symbol, int to) {
        Misc.checkIndex(from, stateCount(), "origin state");
        Misc.checkIndex(to, stateCount(), "destination state");
        rows.get(from).put(symbol, to);
        return this;
    }

    /**
     * @return the destination of <code>(from, symbol)</code>, or
     *         {@link #BLOCKED}
     */
    public int delta(int from, char symbol) {
        Misc.checkIndex(from, stateCount(), "origin state");
        Integer to = rows.get(from).get(symbol);
        return to == null ? BLOCKED : to;
    }

    public boolean isRecognized(CharSequence word) {
        int state = initialState;
        for (char c : iterize(word)) {
            state = delta(state, c);
            if (state == BLOCKED) {
                return false;
            }
        }
        return finalStates.contains(state);
    }

    /**
     * @return every symbol labeling some transition, in ascending order
     */
    public SortedSet<Character> alphabet() {
        SortedSet<Character> ret = new TreeSet<Character>();
        for (SortedMap<Character, Integer> row : rows) {
            ret.addAll(row.keySet());
        }
        return ret;
    }

    /**
     * @return true iff every state has a transition on every symbol of
     *         <code>sigma</code>
     */
    public boolean isComplete(Set<Character> sigma) {
        for (SortedMap<Character, Integer> row : rows) {
            if (!row.keySet().containsAll(sigma)) return false;
        }
        return true;
    }

    /**
     * Completes over the automaton's own {@linkplain #alphabet() alphabet}.
     *
     * @see #makeComplete(Set)
     */
    public DFA makeComplete() {
        return makeComplete(alphabet());
    }

    /**
     * Adds one non accepting sink state, looping on itself, and routes every
     * missing <code>(state, symbol)</code> transition for <code>sigma</code>
     * to it. The sink is added even if nothing is routed to it.
     *
     * @return this automaton
     */
    public DFA makeComplete(Set<Character> sigma) {
        final SortedSet<Character> symbols = new TreeSet<Character>(sigma);
        final int sink = addState();
        for (SortedMap<Character, Integer> row : rows) {
            for (char c : symbols) {
                if (!row.containsKey(c)) {
                    row.put(c, sink);
                }
            }
        }
        assert isComplete(symbols);
        return this;
    }

    /**
     * Turns every accepting state into a non accepting one and vice versa.
     * The automaton must be complete over the alphabet of interest, or the
     * words that block are rejected both before and after.
     *
     * @return this automaton
     */
    public DFA makeComplementary() {
        assert isComplete(alphabet()) : "complementing an incomplete DFA";
        final SortedSet<Integer> old = new TreeSet<Integer>(finalStates);
        finalStates.clear();
        for (int s = 0; s < stateCount(); ++s) {
            if (!old.contains(s)) {
                finalStates.add(s);
            }
        }
        return this;
    }

    /**
     * @return true iff no accepting state is reachable from the initial state
     */
    public boolean recognizeEmpty() {
        final boolean[] found = new boolean[1];
        new BreadthFirstVisitor() {
            @Override
            protected Iterable<Integer> successors(int vertex) {
                return rows.get(vertex).values();
            }
            @Override
            protected boolean visit(int vertex) {
                return !(found[0] = finalStates.contains(vertex));
            }
        }.start(initialState);
        return !found[0];
    }

    /**
     * @return an independent deep copy of <code>dfa</code>
     */
    public static DFA copy(DFA dfa) {
        DFA ret = new DFA(dfa.stateCount());
        for (int s = 0; s < dfa.stateCount(); ++s) {
            ret.rows.get(s).putAll(dfa.rows.get(s));
        }
        ret.initialState = dfa.initialState;
        ret.finalStates.addAll(dfa.finalStates);
        return ret;
    }

    /**
     * The product construction: state <code>(i, j)</code> is numbered
     * <code>i * b.stateCount() + j</code>, a transition exists where both
     * operands have one, and a state accepts where both do. The result
     * recognizes the intersection of the two languages.
     *
     * @throws ArithmeticException if the state count overflows an int
     */
    public static DFA product(DFA a, DFA b) {
        final int nb = b.stateCount();
        DFA ret = new DFA(Math.multiplyExact(a.stateCount(), nb));
        for (int i = 0; i < a.stateCount(); ++i) {
            for (Map.Entry<Character, Integer> e : a.rows.get(i).entrySet()) {
                for (int j = 0; j < nb; ++j) {
                    Integer to = b.rows.get(j).get(e.getKey());
                    if (to != null) {
                        ret.rows.get(i * nb + j).put(e.getKey(), e.getValue() * nb + to);
                    }
                }
            }
        }
        ret.initialState = a.initialState * nb + b.initialState;
        for (int i : a.finalStates) {
            for (int j : b.finalStates) {
                ret.finalStates.add(i * nb + j);
            }
        }
        return ret;
    }

    /**
     * Decides <code>L(a) &sube; L(b)</code> as the emptiness of
     * <code>L(a) &cap; complement(L(b))</code>, the complement being taken
     * over the union of both alphabets. Neither operand is modified.
     */
    public static boolean isLanguageIncluded(DFA a, DFA b) {
        final SortedSet<Character> sigma = a.alphabet();
        sigma.addAll(b.alphabet());
        DFA ca = copy(a).makeComplete(sigma);
        DFA cb = copy(b).makeComplete(sigma).makeComplementary();
        boolean ret = product(ca, cb).recognizeEmpty();
        if (logger.isLoggable(level)) {
            logger.log(level, "inclusion over " + sigma + ": " + ret);
        }
        return ret;
    }

    public static boolean areLanguageEqual(DFA a, DFA b) {
        return isLanguageIncluded(a, b) && isLanguageIncluded(b, a);
    }

    /**
     * @return GraphViz source for this automaton
     */
    public String toDot(String name) {
        Dot dot = new Dot(name, finalStates, initialState);
        for (int s = 0; s < stateCount(); ++s) {
            for (Map.Entry<Character, Integer> e : rows.get(s).entrySet()) {
                dot.edge(s, e.getValue(), e.getKey());
            }
        }
        return dot.toString();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("total states: ").append(stateCount())
            .append(" initial: ").append(initialState)
            .append(" final: ").append(finalStates)
            .append(LS);
        for (int s = 0; s < stateCount(); ++s) {
            sb.append("state: ").append(s).append(' ').append(rows.get(s)).append(LS);
        }
        return sb.toString();
    }
}
