/* @LICENSE@
 */
package org.regal.regex;

/**
 * A runtime exception thrown when an automaton construction exceeds one of
 * its resource limits - typically the subset construction discovering more
 * DFA states than allowed.
 */
public final class ConstructionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConstructionException(String msg) {
        super(msg);
    }
}
