/* @LICENSE@
 */
package org.regal.regex;

import static org.regal.regex.Misc.LS;
import static org.regal.regex.Misc.clear;

import java.io.Flushable;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Stack;

import org.regal.regex.AST.Visitor.TraversalOrder;

/**
 *
 * Uninstantiable class which serves as a source container for the static
 * classes and static methods used the construction of Abstract Syntax Trees.
 * <p>
 * Trees are immutable, and every Node is exclusively owned by its parent: no
 * sharing, no cycles. Union and Concat are strictly binary; n-ary forms are
 * nested to the right, so a tree is as deep as its pattern is long. No tree
 * walk here recurses on the call stack.
 *
 * @author ndw
 *
 */
final class AST {

    static abstract class Node {

        final Node copy() {
            return new CopyVisitor().copy(this);
        }

        final String toTreeString() {
            final StringBuilder sb = new StringBuilder();
            new AbstractTreePrinter(sb) {
                @Override
                protected Formatter newFormatter() {
                    return new Formatter() {
                        private int nspace = 0;
                        private void indent() {
                            try {
                                for (int i=0; i<nspace; ++i) {
                                    a.append(' ');
                                }
                            } catch (IOException e) {
                                throw new RuntimeException(e);
                            }
                        }
                        @Override
                        void push() {
                            nspace += 4;
                        }
                        @Override
                        void pop() {
                            nspace -= 4;
                        }
                        @Override
                        void appendNonTerminal(String label) {
                            try {
                                indent();
                                a.append(label).append(LS);
                            } catch (IOException e) {
                                throw new RuntimeException(e);
                            }
                        };
                        @Override
                        void appendTerminal(int position, String label) {
                            try {
                                indent();
                                a.append(label).append(' ')
                                    .append('{')
                                        .append(Integer.toString(position))
                                    .append('}')
                                    .append(LS);
                            } catch (IOException e) {
                                throw new RuntimeException(e);
                            }
                        }
                    };
                }
            }.print(Node.this);
            return sb.toString();
        }

        final boolean isEmpty() {
            return new Fold<Boolean>() {
                @Override
                protected void visit(Empty node) {
                    push(true);
                }
                @Override
                protected void visit(Epsilon node) {
                    push(false);
                }
                @Override
                protected void visit(Symbol node) {
                    push(false);
                }
                @Override
                protected void visit(Union node) {
                    boolean second = pop(), first = pop();
                    push(first && second);
                }
                @Override
                protected void visit(Concat node) {
                    boolean second = pop(), first = pop();
                    push(first || second);
                }
                @Override
                protected void visit(Star node) {
                    pop();
                    push(false);        // at least the empty word
                }
            }.fold(this);
        }

        final boolean containsEpsilon() {
            return new Fold<Boolean>() {
                @Override
                protected void visit(Empty node) {
                    push(false);
                }
                @Override
                protected void visit(Epsilon node) {
                    push(true);
                }
                @Override
                protected void visit(Symbol node) {
                    push(false);
                }
                @Override
                protected void visit(Union node) {
                    boolean second = pop(), first = pop();
                    push(first || second);
                }
                @Override
                protected void visit(Concat node) {
                    boolean second = pop(), first = pop();
                    push(first && second);
                }
                @Override
                protected void visit(Star node) {
                    pop();
                    push(!node.child.isEmpty());
                }
            }.fold(this);
        }

        /**
         * The equals relation is always the identity relation for all Node
         * subclasses.
         */
        @Override
        public final boolean equals(Object o) {
            return super.equals(o);
        }
        @Override
        public final int hashCode() {
            return super.hashCode();
        }

        /**
         * Re-parenthesizes Union below Concat or Star, and Concat below Star,
         * so that parsing the result denotes the same language.
         */
        @Override
        public final String toString() {

            return new Visitor(TraversalOrder.SUBCLASS_DEFINED) {

                private final StringBuilder sb = new StringBuilder();
                /*
                 * Nodes still to print, and the punctuation between them
                 */
                private final Deque<Object> agenda = new ArrayDeque<Object>();

                @Override
                public String toString() {
                    clear(sb);
                    agenda.push(Node.this);
                    while (!agenda.isEmpty()) {
                        Object next = agenda.pop();
                        if (next instanceof Node) {
                            visit((Node) next);
                        } else {
                            sb.append(next);
                        }
                    }
                    return sb.toString();
                }

                @Override
                protected void visit(Concat node) {
                    later(node.second, node.second instanceof Union);
                    later(node.first, node.first instanceof Union);
                }

                @Override
                protected void visit(Union node) {
                    agenda.push(node.second);
                    agenda.push('|');
                    agenda.push(node.first);
                }

                @Override
                protected void visit(Star node) {
                    agenda.push('*');
                    later(node.child,
                            node.child instanceof Union
                            || node.child instanceof Concat);
                }

                @Override
                protected void visit(Empty node) {
                    sb.append(Misc.EMPTY);
                }

                @Override
                protected void visit(Epsilon node) {
                    sb.append(Misc.EPSILON);
                }

                @Override
                protected void visit(Symbol node) {
                    sb.append(node.symbol);
                }

                /*
                 * pushed in reverse: the agenda is a stack
                 */
                private void later(Node child, boolean paren) {
                    if (paren) {
                        agenda.push(')');
                    }
                    agenda.push(child);
                    if (paren) {
                        agenda.push('(');
                    }
                }
            }.toString();
        }
    }

    static abstract class Terminal extends Node {
    }

    /**
     * The empty language.
     */
    static final class Empty extends Terminal {
        private Empty() {}
    }

    /**
     * The language holding only the empty word.
     */
    static final class Epsilon extends Terminal {
        private Epsilon() {}
    }

    static final class Symbol extends Terminal {

        final char symbol;

        private Symbol(char symbol) {
            assert symbol != Misc.EPSILON && symbol != Misc.EMPTY;
            this.symbol = symbol;
        }
    }

    static abstract class NonTerminal extends Node {

        abstract Node[] children();
    }

    static abstract class Unary extends NonTerminal {

        final Node child;
        private Unary(Node child) {
            assert child != null;
            this.child = child;
        }

        @Override
        final Node[] children() {
            return new Node[] {child};
        }
    }

    static final class Star extends Unary {

        private Star(Node child) {
            super(child);
        }
    }

    static abstract class Binary extends NonTerminal {

        final Node first, second;

        private Binary(Node first, Node second) {
            assert first != null && second != null;
            this.first = first;
            this.second = second;
        }

        @Override
        final Node[] children() {
            return new Node[] {first, second};
        }
    }

    static final class Concat extends Binary {

        private Concat(Node first, Node second) {
            super(first, second);
        }
    }

    static final class Union extends Binary {

        private Union(Node first, Node second) {
            super(first, second);
        }
    }

    static abstract class Visitor {

        enum TraversalOrder {
            TOP_DOWN,
            BOTTOM_UP,
            SUBCLASS_DEFINED;
        }

        private final TraversalOrder order;

        protected Visitor(TraversalOrder order) {
            this.order = order;
        }

        /*
         * marks a NonTerminal whose children have all been walked
         */
        private static final class Leave {
            final NonTerminal node;
            Leave(NonTerminal node) {
                this.node = node;
            }
        }

        /**
         * Walks the tree below <code>root</code> with an explicit stack,
         * children left to right. Every node is visited once: before its
         * children when TOP_DOWN, after them when BOTTOM_UP. Every NonTerminal
         * is {@linkplain #leave(NonTerminal) left} after its children. A
         * SUBCLASS_DEFINED visitor gets the root only.
         */
        final void traverse(Node root) {
            if (order == TraversalOrder.SUBCLASS_DEFINED) {
                visit(root);
                return;
            }
            final Deque<Object> work = new ArrayDeque<Object>();
            work.push(root);
            while (!work.isEmpty()) {
                Object top = work.pop();
                if (top instanceof Leave) {
                    NonTerminal node = ((Leave) top).node;
                    if (order == TraversalOrder.BOTTOM_UP) {
                        visit((Node) node);
                    }
                    leave(node);
                    continue;
                }
                Node node = (Node) top;
                if (node instanceof NonTerminal) {
                    if (order == TraversalOrder.TOP_DOWN) {
                        visit(node);
                    }
                    work.push(new Leave((NonTerminal) node));
                    Node[] children = ((NonTerminal) node).children();
                    for (int i = children.length - 1; i >= 0; --i) {
                        work.push(children[i]);
                    }
                } else {
                    visit(node);
                }
            }
        }

        protected void leave(NonTerminal node) {}


        /*
         * single node multi-dispatch, no descent:
         * - allows Visitor subclasses to deal with the exact granularity they want.
         * - "instanceof" dispatch is ugly but it's only in one place - here.
         */

        protected void visit(Node node) {
            if (node instanceof NonTerminal) {
                visit((NonTerminal) node);
            } else if (node instanceof Terminal) {
                visit((Terminal) node);
            } else {
                error(node);
            }
        }

        protected void visit(NonTerminal node) {
            if (node instanceof Binary) {
                visit((Binary) node);
            } else if (node instanceof Unary){
                visit((Unary) node);
            } else {
                error(node);
            }
        }

        protected void visit(Binary node) {
            if (node instanceof Concat) {
                visit((Concat) node);
            } else if (node instanceof Union) {
                visit((Union) node);
            } else {
                error(node);
            }
        }

        protected void visit(Unary node) {
            if (node instanceof Star) {
                visit((Star) node);
            } else error(node);
        }

        protected void visit(Terminal node) {
            if (node instanceof Symbol) {
                visit((Symbol) node);
            } else if (node instanceof Epsilon) {
                visit((Epsilon) node);
            } else if (node instanceof Empty) {
                visit((Empty) node);
            } else error(node);
        }

        protected void visit(Concat node) {}
        protected void visit(Union node) {}
        protected void visit(Star node) {}

        protected void visit(Symbol node) {}
        protected void visit(Epsilon node) {}
        protected void visit(Empty node) {}

        private static void error(Node node) {
            assert false : "unknown node type " + node;
        }
    }

    /**
     * Bottom up evaluation of a tree: each visit pops the results of the
     * children (last child first) and pushes the result for the node.
     */
    static abstract class Fold<T> extends Visitor {

        private final Stack<T> kids = new Stack<T>();

        protected Fold() {
            super(TraversalOrder.BOTTOM_UP);
        }

        protected final void push(T t) {
            kids.push(t);
        }

        protected final T pop() {
            return kids.pop();
        }

        T fold(Node node) {
            assert node != null;
            kids.clear();
            traverse(node);
            assert kids.size() == 1;
            return kids.pop();
        }
    }

    static abstract class AbstractTreePrinter extends Visitor {

        protected abstract class Formatter {

            abstract void appendNonTerminal(String label);
            abstract void appendTerminal(int position, String label);
            abstract void push();
            abstract void pop();
        }

        protected final Appendable a;

        protected AbstractTreePrinter(Appendable a) {
            super(TraversalOrder.TOP_DOWN);
            this.a = a;
            formatter = newFormatter();
        }

        final void print(Node root) {
            position = 0;
            traverse(root);
            if (a instanceof Flushable) {
                try {
                    ((Flushable) a).flush();
                } catch (IOException e) {
                    throw new RuntimeException(e);
                }
            }
        }

        private final Formatter formatter;
        protected abstract Formatter newFormatter();

        protected int position = 0;

        @Override
        protected final void leave(NonTerminal node) {
            formatter.pop();
        }

        @Override
        protected final void visit(Concat node) {
            formatter.appendNonTerminal("&");
            formatter.push();
        }

        @Override
        protected final void visit(Union node) {
            formatter.appendNonTerminal("|");
            formatter.push();
        }

        @Override
        protected final void visit(Star node) {
            formatter.appendNonTerminal("*");
            formatter.push();
        }

        @Override
        protected final void visit(Terminal node) {
            formatter.appendTerminal(position++, node.toString());
        }
        /*
         * prevent subclasses from overriding
         */
        @Override
        protected final void visit(Node node) {
            super.visit(node);
        }
        @Override
        protected final void visit(Binary node) {
            super.visit(node);
        }
        @Override
        protected final void visit(Unary node) {
            super.visit(node);
        }
    }


    /*
     * static factories of convenience for parser and testing
     */

    static Empty empty() {
        return new Empty();
    }

    static Epsilon epsilon() {
        return new Epsilon();
    }

    static Symbol symbol(char c) {
        return new Symbol(c);
    }

    static Node concat(Node... nodes) {
        Node root = null;
        for (int i = nodes.length - 1; i >= 0; --i) {
            root = root == null ? nodes[i] : new Concat(nodes[i], root);
        }
        return root;
    }

    static Node union(Node... nodes) {
        Node root = null;
        for (int i = nodes.length - 1; i >= 0; --i) {
            root = root == null ? nodes[i] : new Union(nodes[i], root);
        }
        return root;
    }

    static Star star(Node child) {
        return new Star(child);
    }

    static class CopyVisitor extends Visitor {

        protected final Stack<Node> kids = new Stack<Node>();

        CopyVisitor() {
            super(TraversalOrder.BOTTOM_UP);
        }

        protected final void push(Node node) {
            kids.push(node);
        }

        Node copy(Node node) {
            assert node != null;
            traverse(node);
            assert kids.size() == 1;
            return kids.pop();
        }

        @Override
        protected void visit(Symbol node) {
            push(new Symbol(node.symbol));
        }
        @Override
        protected void visit(Epsilon node) {
            push(new Epsilon());
        }
        @Override
        protected void visit(Empty node) {
            push(new Empty());
        }
        @Override
        protected void visit(Concat node) {
            Node second = kids.pop();
            Node first = kids.pop();
            push(new Concat(first, second));
        }
        @Override
        protected void visit(Union node) {
            Node second = kids.pop();
            Node first = kids.pop();
            push(new Union(first, second));
        }
        @Override
        protected void visit(Star node) {
            push(new Star(kids.pop()));
        }
    }

    private AST() {}    // uninstantiable
}
