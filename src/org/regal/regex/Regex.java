/*
 * @LICENSE@
 */

package org.regal.regex;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

import org.regal.regex.AST.Concat;
import org.regal.regex.AST.Empty;
import org.regal.regex.AST.Epsilon;
import org.regal.regex.AST.Fold;
import org.regal.regex.AST.Node;
import org.regal.regex.AST.Star;
import org.regal.regex.AST.Symbol;
import org.regal.regex.AST.Union;

/**
 * An immutable regular expression over <code>char</code> symbols.
 * <p>
 * <strong>Syntax:</strong> any character other than the meta characters is a
 * literal symbol. <code>|</code> is union, juxtaposition is concatenation,
 * postfix <code>*</code> is the Kleene star, and parentheses group.
 * <code>*</code> binds tighter than concatenation, which binds tighter than
 * union; both binary operators associate to the right. The literal
 * <code>&#x03B5;</code> (U+03B5) denotes the empty word and
 * <code>&#x2205;</code> (U+2205) the empty language. There is no escape
 * syntax, so <code>| ( ) *</code> can never be matched.
 * <p>
 * <strong>Printing:</strong> {@link #toString()} is the inverse of
 * {@link #parse(String)} up to the language denoted: the text is
 * re-parenthesized only where precedence requires it, so for canonically
 * parenthesized input <code>parse(r).toString().equals(r)</code>.
 * <p>
 * <strong>Local languages:</strong> {@link #first()}, {@link #last()} and
 * {@link #factors()} are the sets P, D and F of Glushkov's construction. They
 * are meaningful for trees without &#x2205; and are usually computed on a
 * {@linkplain #linearize() linearized} expression.
 */
public final class Regex {

    final Node root;

    Regex(Node root) {
        assert root != null;
        this.root = root;
    }

    /**
     * Parses a regular expression.
     *
     * @param regex the expression text
     * @return the parsed expression
     * @throws java.util.regex.PatternSyntaxException on unexpected end of
     *         input, a meta character where a symbol is expected, or
     *         unconsumed trailing input
     */
    public static Regex parse(String regex) {
        if (regex == null) {
            throw new NullPointerException("regex");
        }
        return new Regex(new RegexParser().parse(regex));
    }

    /*
     * programmatic construction
     */

    public static Regex empty() {
        return new Regex(AST.empty());
    }

    public static Regex epsilon() {
        return new Regex(AST.epsilon());
    }

    public static Regex symbol(char c) {
        if (c == Misc.EPSILON || c == Misc.EMPTY) {
            throw new IllegalArgumentException(
                "reserved literal cannot be a symbol: " + c);
        }
        return new Regex(AST.symbol(c));
    }

    public static Regex union(Regex... operands) {
        return new Regex(AST.union(roots(operands)));
    }

    public static Regex concat(Regex... operands) {
        return new Regex(AST.concat(roots(operands)));
    }

    public static Regex star(Regex operand) {
        return new Regex(AST.star(operand.root.copy()));
    }

    /*
     * operands are copied, trees are never shared
     */
    private static Node[] roots(Regex[] operands) {
        if (operands.length == 0) {
            throw new IllegalArgumentException("no operands");
        }
        Node[] ret = new Node[operands.length];
        for (int i = 0; i < operands.length; ++i) {
            ret[i] = operands[i].root.copy();
        }
        return ret;
    }

    /**
     * @return true iff the expression denotes the empty language
     */
    public boolean isEmpty() {
        return root.isEmpty();
    }

    /**
     * Union holds the empty word iff a child does, Concat iff both children
     * do. A Star holds it unless its body {@linkplain #isEmpty() is empty}.
     */
    public boolean containsEpsilon() {
        return root.containsEpsilon();
    }

    /**
     * P: the symbols that can begin a word of the language.
     */
    public SortedSet<Character> first() {
        return Collections.unmodifiableSortedSet(new Fold<SortedSet<Character>>() {
            @Override
            protected void visit(Empty node) {
                push(new TreeSet<Character>());
            }
            @Override
            protected void visit(Epsilon node) {
                push(new TreeSet<Character>());
            }
            @Override
            protected void visit(Symbol node) {
                SortedSet<Character> ret = new TreeSet<Character>();
                ret.add(node.symbol);
                push(ret);
            }
            @Override
            protected void visit(Union node) {
                SortedSet<Character> second = pop();
                SortedSet<Character> ret = pop();
                ret.addAll(second);
                push(ret);
            }
            @Override
            protected void visit(Concat node) {
                SortedSet<Character> second = pop();
                SortedSet<Character> ret = pop();
                if (node.first.containsEpsilon()) {
                    ret.addAll(second);
                }
                push(ret);
            }
            @Override
            protected void visit(Star node) {
                // same as the child
            }
        }.fold(root));
    }

    /**
     * D: the symbols that can end a word of the language.
     */
    public SortedSet<Character> last() {
        return Collections.unmodifiableSortedSet(new Fold<SortedSet<Character>>() {
            @Override
            protected void visit(Empty node) {
                push(new TreeSet<Character>());
            }
            @Override
            protected void visit(Epsilon node) {
                push(new TreeSet<Character>());
            }
            @Override
            protected void visit(Symbol node) {
                SortedSet<Character> ret = new TreeSet<Character>();
                ret.add(node.symbol);
                push(ret);
            }
            @Override
            protected void visit(Union node) {
                SortedSet<Character> second = pop();
                SortedSet<Character> ret = pop();
                ret.addAll(second);
                push(ret);
            }
            @Override
            protected void visit(Concat node) {
                SortedSet<Character> ret = pop();
                SortedSet<Character> first = pop();
                if (node.second.containsEpsilon()) {
                    ret.addAll(first);
                }
                push(ret);
            }
            @Override
            protected void visit(Star node) {
                // same as the child
            }
        }.fold(root));
    }

    /**
     * F: the two-symbol factors that can occur inside a word of the language,
     * each one as a string of length two.
     */
    public SortedSet<String> factors() {
        return Collections.unmodifiableSortedSet(new Fold<SortedSet<String>>() {
            @Override
            protected void visit(Empty node) {
                push(new TreeSet<String>());
            }
            @Override
            protected void visit(Epsilon node) {
                push(new TreeSet<String>());
            }
            @Override
            protected void visit(Symbol node) {
                push(new TreeSet<String>());
            }
            @Override
            protected void visit(Union node) {
                SortedSet<String> second = pop();
                SortedSet<String> ret = pop();
                ret.addAll(second);
                push(ret);
            }
            @Override
            protected void visit(Concat node) {
                SortedSet<String> second = pop();
                SortedSet<String> ret = pop();
                ret.addAll(second);
                ret.addAll(pairs(
                    new Regex(node.first).last(),
                    new Regex(node.second).first()));
                push(ret);
            }
            @Override
            protected void visit(Star node) {
                SortedSet<String> ret = pop();
                Regex child = new Regex(node.child);
                ret.addAll(pairs(child.last(), child.first()));
                push(ret);
            }
        }.fold(root));
    }

    private static SortedSet<String> pairs(
            SortedSet<Character> lhs, SortedSet<Character> rhs) {
        SortedSet<String> ret = new TreeSet<String>();
        for (char x : lhs) {
            for (char y : rhs) {
                ret.add(new String(new char[] {x, y}));
            }
        }
        return ret;
    }

    /**
     * Replaces every symbol occurrence by a distinct synthetic symbol.
     *
     * @return the linear expression and the table mapping back
     * @throws ConstructionException if the expression has more symbol
     *         occurrences than there are synthetic symbols
     */
    public Linearization linearize() {
        return new Linearization(this);
    }

    /**
     * Eliminates &#x2205; wherever it can be eliminated: it is the unit of
     * Union, absorbing for Concat, and <code>&#x2205;*</code> is
     * <code>&#x03B5;</code>.
     *
     * @return an expression denoting the same language which is either a lone
     *         &#x2205; or free of &#x2205; altogether
     */
    public Regex withoutEmpty() {
        return new Regex(new Fold<Node>() {
            @Override
            protected void visit(Empty node) {
                push(AST.empty());
            }
            @Override
            protected void visit(Epsilon node) {
                push(AST.epsilon());
            }
            @Override
            protected void visit(Symbol node) {
                push(AST.symbol(node.symbol));
            }
            @Override
            protected void visit(Union node) {
                Node second = pop();
                Node first = pop();
                if (first instanceof Empty) {
                    push(second);
                } else if (second instanceof Empty) {
                    push(first);
                } else {
                    push(AST.union(first, second));
                }
            }
            @Override
            protected void visit(Concat node) {
                Node second = pop();
                Node first = pop();
                if (first instanceof Empty) {
                    push(first);
                } else if (second instanceof Empty) {
                    push(second);
                } else {
                    push(AST.concat(first, second));
                }
            }
            @Override
            protected void visit(Star node) {
                Node child = pop();
                push(child instanceof Empty ? AST.epsilon() : AST.star(child));
            }
        }.fold(root));
    }

    /**
     * Thompson's construction.
     *
     * @see NFA#fromRegex(Regex)
     */
    public NFA toNFA() {
        return NFA.fromRegex(this);
    }

    /**
     * @return an indented, one node per line rendering of the syntax tree
     */
    public String toTreeString() {
        return root.toTreeString();
    }

    @Override
    public String toString() {
        return root.toString();
    }
}
