/* @LICENSE@
 */

package org.regal.regex;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.regal.regex.AST.Node;
import org.regal.regex.AST.Visitor;
import org.regal.regex.AST.Visitor.TraversalOrder;

import static org.regal.regex.AST.*;
import static org.regal.regex.Misc.LS;

/**
 * Predictive parser for the grammar
 * <pre>
 *     R -> C | C "|" R                  union, right associative
 *     C -> B | B C                      concatenation, right associative
 *     B -> S {"*"} | "(" R ")" {"*"}
 *     S -> symbol | "&#x03B5;" | "&#x2205;"
 * </pre>
 * One token of look-ahead decides every choice; the parser never backtracks.
 * Repetition and nesting are handled with loops and an explicit stack of open
 * groups rather than by recursion, so pattern length is bounded by memory only.
 * There is no escape mechanism: the meta characters <code>| ( ) *</code>
 * cannot be matched literally.
 */
final class RegexParser {

    private static final Logger logger = Logger.getLogger("org.regal.regex");
    private static final Level level = Level.FINEST;

    private static final int EOX = -1;  // end of expression

    private String regex;

    /*
     * state for nextToken() and peekToken()
     */
    private int iNext;
    private int iCurrent;
    private int token;

    private void init() {
        iNext = 0;
        iCurrent = -1;
        token = EOX;
    }

    Node parse(String regex) {

        this.regex = regex;
        init();

        final Node root = regex();

        assert new Visitor(TraversalOrder.TOP_DOWN) {

            boolean noReconvergence() {
                traverse(root);
                return !reconvergence;
            }

            boolean reconvergence = false;
            private final Map<Node, Object> id =     // in case Node.equals()
                new IdentityHashMap<Node, Object>(); // is ever defined

            @Override
            protected void visit(Node node) {
                if (id.put(node, new Object()) != null) reconvergence = true;
                super.visit(node);
            }

        }.noReconvergence();

        if (logger.isLoggable(level)) {
            logger.log(level, "parsed " + regex + LS + root.toTreeString());
        }
        return root;
    }

    /*
     * A parenthesized group, or the whole expression, still being read: the
     * alternatives completed so far and the factors of the current one.
     */
    private static final class Group {

        private final List<Node> terms = new ArrayList<Node>();
        private final List<Node> factors = new ArrayList<Node>();

        /*
         * C -> B | B C, right nested
         */
        void endTerm() {
            assert !factors.isEmpty();
            terms.add(concat(factors.toArray(new Node[factors.size()])));
            factors.clear();
        }

        /*
         * R -> C | C "|" R, right nested
         */
        Node close() {
            endTerm();
            return union(terms.toArray(new Node[terms.size()]));
        }
    }

    private Node regex() {
        final Deque<Group> open = new ArrayDeque<Group>();
        Group group = new Group();
        Node node = null;                       // the factor just completed

        while (true) {
            if (node == null) {
                /*
                 * B -> S {"*"} | "(" R ")" {"*"}
                 */
                nextToken();
                switch(token) {
                case EOX:
                    syntaxError("unexpected end of input", iCurrent);
                    break;
                case '(':
                    open.push(group);
                    group = new Group();
                    continue;
                default:
                    node = base();
                }
            }
            while (peekToken() == '*') {
                nextToken();
                node = star(node);
            }
            group.factors.add(node);
            node = null;

            switch(peekToken()) {
            case '|':
                nextToken();
                group.endTerm();
                break;
            case ')':
                if (open.isEmpty()) {
                    syntaxError("unbalanced parenthesis", iNext);
                }
                nextToken();
                node = group.close();
                group = open.pop();
                break;
            case EOX:
                if (!open.isEmpty()) {
                    nextToken();
                    syntaxError("unexpected end of input: missing ')'", iCurrent);
                }
                return group.close();
            default:
                // juxtaposition: another factor follows
            }
        }
    }

    /*
     * S -> symbol | epsilon | empty
     */
    private Node base() {
        switch(token) {
        case Misc.EPSILON:
            return epsilon();
        case Misc.EMPTY:
            return empty();
        case '|':
        case ')':
        case '*':
            syntaxError("unexpected symbol '" + (char) token + "'", iCurrent);
            return null;
        default:
            assert ((char) token) == token;
            return symbol((char) token);
        }
    }

    private int peekToken() {
        return iNext < regex.length() ? regex.charAt(iNext) : EOX;
    }

    private void nextToken() {
        if (iNext < regex.length()) {
            iCurrent = iNext;
            token = regex.charAt(iNext++);
        } else {
            iCurrent = regex.length();
            token = EOX;
        }
    }

    private void syntaxError(String msg, int index) {
        throw new java.util.regex.PatternSyntaxException(msg, regex, index);
    }
}
