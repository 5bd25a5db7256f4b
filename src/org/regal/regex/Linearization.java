/*
 * @LICENSE@
 */

package org.regal.regex;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.regal.regex.AST.CopyVisitor;
import org.regal.regex.AST.Symbol;

/**
 * A linear regular expression - one in which every symbol occurs at most once
 * - together with the table that maps its synthetic symbols back to the
 * symbols of the expression it was derived from.
 * <p>
 * Synthetic symbols are allocated in left to right order of the occurrences
 * they replace, starting at {@link #FIRST_SYNTHETIC} (U+E000) in the Unicode
 * private use area.
 */
public final class Linearization {

    public static final char FIRST_SYNTHETIC = '\uE000';
    public static final char LAST_SYNTHETIC = '\uF8FF';

    private final Regex linear;
    private final Map<Character, Character> table;

    Linearization(Regex regex) {
        final Map<Character, Character> map =
            new LinkedHashMap<Character, Character>();
        this.linear = new Regex(new CopyVisitor() {

            char next = FIRST_SYNTHETIC;

            @Override
            protected void visit(Symbol node) {
                if (map.size() > LAST_SYNTHETIC - FIRST_SYNTHETIC) {
                    throw new ConstructionException(
                        "too many symbol occurrences to linearize: > "
                        + (LAST_SYNTHETIC - FIRST_SYNTHETIC + 1));
                }
                map.put(next, node.symbol);
                push(AST.symbol(next++));
            }
        }.copy(regex.root));
        this.table = Collections.unmodifiableMap(map);
    }

    /**
     * @return the linear expression
     */
    public Regex linear() {
        return linear;
    }

    /**
     * @return synthetic symbol to original symbol, in allocation order
     */
    public Map<Character, Character> table() {
        return table;
    }

    /**
     * @return the number of symbol occurrences (positions)
     */
    public int size() {
        return table.size();
    }

    /**
     * @param synthetic a symbol of the linear expression
     * @return the position of the symbol, numbered from zero
     */
    public int position(char synthetic) {
        original(synthetic);
        return synthetic - FIRST_SYNTHETIC;
    }

    /**
     * @param synthetic a symbol of the linear expression
     * @return the symbol it replaced
     * @throws IllegalArgumentException if the symbol was not allocated here
     */
    public char original(char synthetic) {
        Character ret = table.get(synthetic);
        if (ret == null) {
            throw new IllegalArgumentException(
                "not a synthetic symbol of this linearization: "
                + Misc.Esc.JAVA.esc(synthetic));
        }
        return ret;
    }

    /**
     * @return the linear expression with every synthetic symbol replaced by
     *         its original
     */
    public Regex unLinearize() {
        return new Regex(new CopyVisitor() {
            @Override
            protected void visit(Symbol node) {
                push(AST.symbol(original(node.symbol)));
            }
        }.copy(linear.root));
    }

    @Override
    public String toString() {
        return linear + " " + Misc.Esc.JAVA.esc(table.toString());
    }
}
