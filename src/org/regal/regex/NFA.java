/*
 * @LICENSE@
 */

/**
 * NFA: Nondeterministic Finite Automata - with epsilon transitions.
 */
package org.regal.regex;

import static org.regal.regex.Misc.LS;
import static org.regal.regex.Misc.iterize;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.regal.regex.AST.Concat;
import org.regal.regex.AST.Empty;
import org.regal.regex.AST.Epsilon;
import org.regal.regex.AST.Fold;
import org.regal.regex.AST.Star;
import org.regal.regex.AST.Symbol;
import org.regal.regex.AST.Union;
import org.regal.regex.AST.Visitor;
import org.regal.regex.AST.Visitor.TraversalOrder;
import org.regal.regex.Misc.BreadthFirstVisitor;

/**
 * A nondeterministic finite automaton with epsilon transitions, over the
 * states <code>0..stateCount()-1</code>. A (state, symbol) pair may lead to
 * any number of states. Every {@link StateSet} held or accepted by an
 * instance has <code>stateCount()</code> as its capacity.
 * <p>
 * Automata are built incrementally and then queried. Instances are not safe
 * for concurrent mutation.
 */
public final class NFA {

    private static final Logger logger = Logger.getLogger("org.regal.regex");
    private static final Level level = Level.FINER;

    /**
     * Default limit on the number of states the subset construction may
     * discover; system property <code>org.regal.regex.maxDfaStates</code>.
     */
    public static final int MAX_DFA_STATES =
        Integer.getInteger("org.regal.regex.maxDfaStates", 10 * 1000);

    private final int stateCount;
    private int initialState = 0;
    private final StateSet finalStates;
    private final StateSet[] epsilon;                           // null if none
    private final List<SortedMap<Character, StateSet>> arcs;

    public NFA(int stateCount) {
        if (stateCount < 1) {
            throw new IllegalArgumentException(
                "an automaton has at least one state: " + stateCount);
        }
        this.stateCount = stateCount;
        this.finalStates = new StateSet(stateCount);
        this.epsilon = new StateSet[stateCount];
        this.arcs = new ArrayList<SortedMap<Character, StateSet>>(stateCount);
        for (int i = 0; i < stateCount; ++i) {
            arcs.add(new TreeMap<Character, StateSet>());
        }
    }

    public int stateCount() {
        return stateCount;
    }

    public int initialState() {
        return initialState;
    }

    public NFA initialState(int state) {
        Misc.checkIndex(state, stateCount, "initial state");
        this.initialState = state;
        return this;
    }

    /**
     * @return a copy of the accepting states
     */
    public StateSet finalStates() {
        return finalStates.copy();
    }

    /**
     * Replaces the accepting states.
     */
    public NFA finalStates(StateSet states) {
        if (states.capacity() != stateCount) {
            throw new IllegalArgumentException(
                "final states capacity " + states.capacity()
                + " != state count " + stateCount);
        }
        finalStates.clear();
        finalStates.union(states);
        return this;
    }

    public NFA addFinalState(int state) {
        finalStates.add(state);
        return this;
    }

    public boolean isFinal(int state) {
        return finalStates.contains(state);
    }

    /**
     * Adds <code>to</code> to the destinations of <code>(from, symbol)</code>.
     */
    public NFA addTransition(int from, char symbol, int to) {
        Misc.checkIndex(from, stateCount, "origin state");
        Misc.checkIndex(to, stateCount, "destination state");
        SortedMap<Character, StateSet> row = arcs.get(from);
        StateSet dest = row.get(symbol);
        if (dest == null) {
            row.put(symbol, dest = new StateSet(stateCount));
        }
        dest.add(to);
        return this;
    }

    /**
     * Adds <code>to</code> to the states reachable from <code>from</code>
     * without consuming input.
     */
    public NFA addEpsilonTransition(int from, int to) {
        Misc.checkIndex(from, stateCount, "origin state");
        Misc.checkIndex(to, stateCount, "destination state");
        if (epsilon[from] == null) {
            epsilon[from] = new StateSet(stateCount);
        }
        epsilon[from].add(to);
        return this;
    }

    /**
     * @return the destinations of <code>(from, symbol)</code>; empty if none
     */
    public StateSet destinations(int from, char symbol) {
        Misc.checkIndex(from, stateCount, "origin state");
        StateSet dest = arcs.get(from).get(symbol);
        return dest == null ? new StateSet(stateCount) : dest.copy();
    }

    /**
     * @return the epsilon destinations of <code>from</code>; empty if none
     */
    public StateSet epsilonDestinations(int from) {
        Misc.checkIndex(from, stateCount, "origin state");
        return epsilon[from] == null ? new StateSet(stateCount) : epsilon[from].copy();
    }

    /**
     * @return every symbol labeling some transition, in ascending order
     */
    public SortedSet<Character> alphabet() {
        SortedSet<Character> ret = new TreeSet<Character>();
        for (SortedMap<Character, StateSet> row : arcs) {
            ret.addAll(row.keySet());
        }
        return Collections.unmodifiableSortedSet(ret);
    }

    private void checkCapacity(StateSet states) {
        if (states.capacity() != stateCount) {
            throw new IllegalArgumentException(
                "state set capacity " + states.capacity()
                + " != state count " + stateCount);
        }
    }

    /**
     * @param states any set of states of this automaton
     * @return the states reachable from <code>states</code> through epsilon
     *         transitions only, <code>states</code> included
     */
    public StateSet epsilonClosure(StateSet states) {
        checkCapacity(states);
        StateSet closure = states.copy();
        Deque<Integer> stack = new ArrayDeque<Integer>();
        for (int s : states) {
            stack.push(s);
        }
        while (!stack.isEmpty()) {
            StateSet next = epsilon[stack.pop()];
            if (next == null) continue;
            for (int t : next) {
                if (!closure.contains(t)) {
                    closure.add(t);
                    stack.push(t);
                }
            }
        }
        return closure;
    }

    /**
     * The transition function lifted to sets: epsilon-close the argument,
     * follow the <code>symbol</code> transitions of every member, and
     * epsilon-close the result.
     */
    public StateSet delta(StateSet states, char symbol) {
        StateSet after = new StateSet(stateCount);
        for (int s : epsilonClosure(states)) {
            StateSet dest = arcs.get(s).get(symbol);
            if (dest != null) {
                after.union(dest);
            }
        }
        return epsilonClosure(after);
    }

    public boolean isRecognized(CharSequence word) {
        StateSet current = StateSet.of(stateCount, initialState);
        for (char c : iterize(word)) {
            current = delta(current, c);
            if (current.isEmpty()) {
                return false;       // blocked
            }
        }
        if (word.length() == 0) {
            current = epsilonClosure(current);
        }
        return current.intersects(finalStates);
    }

    /**
     * @return true iff no accepting state is reachable from the initial state
     */
    public boolean recognizeEmpty() {
        final boolean[] found = new boolean[1];
        new BreadthFirstVisitor() {
            @Override
            protected Iterable<Integer> successors(int vertex) {
                StateSet ret = epsilonDestinations(vertex);
                for (StateSet dest : arcs.get(vertex).values()) {
                    ret.union(dest);
                }
                return ret;
            }
            @Override
            protected boolean visit(int vertex) {
                return !(found[0] = finalStates.contains(vertex));
            }
        }.start(initialState);
        return !found[0];
    }

    /**
     * Renumbers every state <code>i</code> as <code>i + offset</code>. States
     * <code>0..offset-1</code> of the result are isolated.
     *
     * @return a new automaton with <code>stateCount() + offset</code> states
     */
    public NFA shift(int offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("negative offset: " + offset);
        }
        NFA ret = new NFA(stateCount + offset);
        ret.initialState = initialState + offset;
        for (int s : finalStates) {
            ret.finalStates.add(s + offset);
        }
        for (int s = 0; s < stateCount; ++s) {
            if (epsilon[s] != null) {
                for (int t : epsilon[s]) {
                    ret.addEpsilonTransition(s + offset, t + offset);
                }
            }
            for (Map.Entry<Character, StateSet> e : arcs.get(s).entrySet()) {
                for (int t : e.getValue()) {
                    ret.addTransition(s + offset, e.getKey(), t + offset);
                }
            }
        }
        return ret;
    }

    /*
     * a Thompson fragment: its entry and its single accepting state
     */
    private static final class Fragment {
        final int initial;
        final int accept;
        Fragment(int initial, int accept) {
            this.initial = initial;
            this.accept = accept;
        }
    }

    private static final int EPSILON_EDGE = -1;

    /**
     * Thompson's construction. Every fragment has exactly one accepting
     * state; Union and Star add a fresh initial and a fresh accepting state,
     * Concat links the two fragments with an epsilon transition.
     * <p>
     * States are numbered as the fragments are created and the transitions
     * are recorded as they go, so the automaton is allocated once, at the end.
     *
     * @param regex an expression free of &#x2205;
     * @throws IllegalArgumentException if the expression contains &#x2205;;
     *         see {@link Regex#withoutEmpty()}
     */
    public static NFA fromRegex(Regex regex) {
        final List<int[]> edges = new ArrayList<int[]>();   // {from, symbol, to}

        final class Builder extends Fold<Fragment> {

            private int states = 0;

            private int newState() {
                return states++;
            }

            private void edge(int from, int symbol, int to) {
                edges.add(new int[] {from, symbol, to});
            }

            @Override
            protected void visit(Empty node) {
                throw new IllegalArgumentException(
                    "\u2205 must be eliminated before Thompson's construction");
            }
            @Override
            protected void visit(Epsilon node) {
                int i = newState(), f = newState();
                edge(i, EPSILON_EDGE, f);
                push(new Fragment(i, f));
            }
            @Override
            protected void visit(Symbol node) {
                int i = newState(), f = newState();
                edge(i, node.symbol, f);
                push(new Fragment(i, f));
            }
            @Override
            protected void visit(Union node) {
                Fragment b = pop(), a = pop();
                int i = newState(), f = newState();
                edge(i, EPSILON_EDGE, a.initial);
                edge(i, EPSILON_EDGE, b.initial);
                edge(a.accept, EPSILON_EDGE, f);
                edge(b.accept, EPSILON_EDGE, f);
                push(new Fragment(i, f));
            }
            @Override
            protected void visit(Concat node) {
                Fragment b = pop(), a = pop();
                edge(a.accept, EPSILON_EDGE, b.initial);
                push(new Fragment(a.initial, b.accept));
            }
            @Override
            protected void visit(Star node) {
                Fragment a = pop();
                int i = newState(), f = newState();
                edge(i, EPSILON_EDGE, a.initial);
                edge(i, EPSILON_EDGE, f);
                edge(a.accept, EPSILON_EDGE, a.initial);    // repeat
                edge(a.accept, EPSILON_EDGE, f);            // stop
                push(new Fragment(i, f));
            }
        }
        final Builder builder = new Builder();
        final Fragment root = builder.fold(regex.root);

        NFA ret = new NFA(builder.states)
            .initialState(root.initial)
            .addFinalState(root.accept);
        for (int[] e : edges) {
            if (e[1] == EPSILON_EDGE) {
                ret.addEpsilonTransition(e[0], e[2]);
            } else {
                ret.addTransition(e[0], (char) e[1], e[2]);
            }
        }

        if (logger.isLoggable(level)) {
            logger.log(level, "thompson " + regex + ": " + ret.stateCount + " states");
        }
        return ret;
    }

    /**
     * Parses <code>regex</code>, then applies {@link #fromRegex(Regex)}.
     */
    public static NFA thompson(String regex) {
        return fromRegex(Regex.parse(regex));
    }

    /**
     * Glushkov's (position) construction: an epsilon free automaton with one
     * state per symbol occurrence, plus the initial state 0.
     *
     * @param regex an expression free of &#x2205;
     * @throws IllegalArgumentException if the expression contains &#x2205;
     */
    public static NFA glushkov(Regex regex) {
        new Visitor(TraversalOrder.TOP_DOWN) {
            @Override
            protected void visit(Empty node) {
                throw new IllegalArgumentException(
                    "\u2205 must be eliminated before Glushkov's construction");
            }
        }.traverse(regex.root);
        Linearization lin = regex.linearize();
        Regex linear = lin.linear();
        NFA ret = new NFA(1 + lin.size());
        for (char x : linear.first()) {
            ret.addTransition(0, lin.original(x), 1 + lin.position(x));
        }
        for (String xy : linear.factors()) {
            char x = xy.charAt(0), y = xy.charAt(1);
            ret.addTransition(1 + lin.position(x), lin.original(y), 1 + lin.position(y));
        }
        for (char x : linear.last()) {
            ret.addFinalState(1 + lin.position(x));
        }
        if (linear.containsEpsilon()) {
            ret.addFinalState(0);
        }
        if (logger.isLoggable(level)) {
            logger.log(level, "glushkov " + regex + ": " + ret.stateCount + " states");
        }
        return ret;
    }

    /**
     * Subset construction, limited to {@link #MAX_DFA_STATES} states.
     *
     * @see #toDFA(int)
     */
    public DFA toDFA() {
        return toDFA(MAX_DFA_STATES);
    }

    /**
     * Subset construction. DFA state 0 is the epsilon closure of the initial
     * state; every other DFA state is the image of a discovered one under
     * {@link #delta(StateSet, char)}, for a symbol leaving one of its members.
     * States are numbered in discovery order and identified by their
     * {@linkplain StateSet#canonicalKey() canonical key}, so each set is
     * explored once. A DFA state accepts iff its set meets the accepting
     * states.
     *
     * @param maxStates the number of DFA states the construction may discover
     * @throws ConstructionException when more states would be needed
     */
    public DFA toDFA(final int maxStates) {

        final DFA dfa = new DFA(1);

        final class StateFactory {

            private final Map<StateSet.Key, Integer> map =
                new HashMap<StateSet.Key, Integer>();
            private final List<StateSet> sets = new ArrayList<StateSet>();

            private int stateFrom(StateSet nfaStates, Deque<Integer> work) {
                StateSet.Key key = nfaStates.canonicalKey();
                Integer state = map.get(key);
                if (state == null) {
                    if (sets.size() >= maxStates) {
                        logger.log(Level.FINE,
                            "DFA state count exceeded: " + maxStates);
                        throw new ConstructionException(
                            "DFA state count exceeded: " + maxStates);
                    }
                    state = sets.isEmpty() ? 0 : dfa.addState();
                    assert state == sets.size();
                    map.put(key, state);
                    sets.add(nfaStates);
                    if (nfaStates.intersects(finalStates)) {
                        dfa.addFinalState(state);
                    }
                    work.add(state);
                }
                return state;
            }
        }
        final StateFactory factory = new StateFactory();

        /*
         * worklist, not recursion: there may be exponentially many sets
         */
        final Deque<Integer> work = new ArrayDeque<Integer>();
        dfa.initialState(factory.stateFrom(
            epsilonClosure(StateSet.of(stateCount, initialState)), work));

        final SortedSet<Character> sigma = new TreeSet<Character>();
        while (!work.isEmpty()) {
            final int state = work.remove();
            final StateSet nfaStates = factory.sets.get(state);

            sigma.clear();
            for (int s : nfaStates) {
                sigma.addAll(arcs.get(s).keySet());
            }
            for (char c : sigma) {
                StateSet next = delta(nfaStates, c);
                assert !next.isEmpty();
                dfa.addTransition(state, c, factory.stateFrom(next, work));
            }
        }

        if (logger.isLoggable(Level.FINEST)) {
            logger.log(Level.FINEST, "dfa: " + dfa);
        } else if (logger.isLoggable(level)) {
            logger.log(level, "dfa: " + dfa.stateCount() + " states from "
                + stateCount + " nfa states");
        }
        return dfa;
    }

    /**
     * @return GraphViz source for this automaton
     */
    public String toDot(String name) {
        Dot dot = new Dot(name, finalStates, initialState);
        for (int s = 0; s < stateCount; ++s) {
            if (epsilon[s] != null) {
                for (int t : epsilon[s]) {
                    dot.epsilonEdge(s, t);
                }
            }
            for (Map.Entry<Character, StateSet> e : arcs.get(s).entrySet()) {
                for (int t : e.getValue()) {
                    dot.edge(s, t, e.getKey());
                }
            }
        }
        return dot.toString();
    }

    private static final String INDENT = "    ";

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("total states: ").append(stateCount)
            .append(" initial: ").append(initialState)
            .append(" final: ").append(finalStates)
            .append(LS);
        for (int s = 0; s < stateCount; ++s) {
            sb.append("state: ").append(s).append(LS);
            if (epsilon[s] != null) {
                sb.append(INDENT).append(Misc.EPSILON).append(" -> ")
                    .append(epsilon[s]).append(LS);
            }
            for (Map.Entry<Character, StateSet> e : arcs.get(s).entrySet()) {
                sb.append(INDENT).append(e.getKey()).append(" -> ")
                    .append(e.getValue()).append(LS);
            }
        }
        return sb.toString();
    }
}
