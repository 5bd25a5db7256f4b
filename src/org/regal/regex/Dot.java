/* @LICENSE@
 */
package org.regal.regex;

import static org.regal.regex.Misc.LS;
import static org.regal.regex.Misc.Esc.DOT;

/**
 * Accumulates the GraphViz source of an automaton: double circles for the
 * accepting states, a point-shaped, unlabeled start node <code>qi</code>
 * with an arrow to the initial state, and one labeled edge per transition.
 * Render with <code>dot -Tsvg automaton.dot &gt; automaton.svg</code>.
 */
final class Dot {

    private final StringBuilder sb = new StringBuilder();

    Dot(String name, Iterable<Integer> finals, int initial) {
        sb.append("digraph \"").append(DOT.esc(name)).append("\" {").append(LS);
        sb.append("rankdir=LR;").append(LS);
        sb.append("node [shape = doublecircle];");
        final int mark = sb.length();
        for (int state : finals) {
            sb.append(' ').append(state);
        }
        sb.append(sb.length() == mark ? "" : ";").append(LS);
        sb.append("node [shape = point ]; qi").append(LS);
        sb.append("node [shape = circle];").append(LS);
        sb.append("qi -> ").append(initial).append(';').append(LS);
    }

    Dot edge(int from, int to, char label) {
        return edge(from, to, String.valueOf(label));
    }

    Dot epsilonEdge(int from, int to) {
        return edge(from, to, String.valueOf(Misc.EPSILON));
    }

    private Dot edge(int from, int to, String label) {
        sb.append(from).append(" -> ").append(to)
            .append(" [label = \"").append(DOT.esc(label)).append("\"];")
            .append(LS);
        return this;
    }

    @Override
    public String toString() {
        return sb.toString() + "}";
    }
}
