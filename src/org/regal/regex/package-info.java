/*
 * @LICENSE@
 */

/**
 * <h3><b>regal</b> - exact reasoning about regular languages with finite
 * automata.</h3>
 * <p>
 * <h4>Motivation.</h4>
 * <p>
 * Where the {@linkplain java.util.regex regex} package answers "does this
 * string match?", <b>regal</b> answers questions about the patterns
 * themselves: does every string matched by one pattern also match another, do
 * two patterns denote the same language, is a pattern satisfiable at all.
 * Such questions come up in policy and pattern compilers, and when checking
 * that a rewritten pattern still means what the original did.
 * <p>
 * <h4>Pipeline.</h4>
 * <p>
 * Text is parsed by {@link org.regal.regex.Regex#parse(String)} into an
 * immutable syntax tree, compiled to an {@link org.regal.regex.NFA} with
 * epsilon transitions by Thompson's construction (or an epsilon free one by
 * Glushkov's), and determinized by the subset construction into a
 * {@link org.regal.regex.DFA}. DFAs are then combined: product
 * (intersection), completion, complementation, emptiness, and from those,
 * language inclusion and equivalence.
 * <p>
 * The syntax is deliberately small: symbols, <code>|</code>, juxtaposition,
 * postfix <code>*</code>, parentheses, and the literals &#x03B5; and
 * &#x2205;. There is no escaping.
 * <p>
 * <h4>Resource limits.</h4>
 * <p>
 * The subset construction may discover exponentially many states. It stops
 * with a {@link org.regal.regex.ConstructionException} after
 * {@link org.regal.regex.NFA#MAX_DFA_STATES} states, a limit set with the
 * system property <code>org.regal.regex.maxDfaStates</code>.
 * <p>
 * <h4>Logging.</h4>
 * <p>
 * Constructions log to the <code>org.regal.regex</code>
 * {@linkplain java.util.logging.Logger logger}: automaton sizes at
 * <code>FINER</code>, syntax trees and automaton dumps at
 * <code>FINEST</code>.
 * <p>
 * <h4>References:</h4>
 * <ul>
 * <li>For the theory behind regular expressions and their implementation as
 * automata, see the first chapters of the <a
 * href="http://en.wikipedia.org/wiki/Compilers:_Principles,_Techniques,_and_Tools">Dragon
 * Book.</a></li>
 * <li>Russ Cox's <a href="http://swtch.com/~rsc/regexp/regexp1.html">article</a>
 * on Thompson's construction and automaton based matching.</li>
 * <li>For a full featured automaton library in Java, with intersection and
 * negation of regular expressions, see <a
 * href="http://www.brics.dk/automaton/">dk.brics.automaton</a>.</li>
 * </ul>
 */
package org.regal.regex;
