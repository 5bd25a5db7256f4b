/*
 * @LICENSE@
 */

package org.regal.regex;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Queue;


/**
 * This class implements a bunch of possibly reusable, miscelaneous static
 * objects, interfaces, classes, and methods.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");

    public static final char EPSILON = '\u03B5';    // the empty word
    public static final char EMPTY = '\u2205';      // the empty language

    /*
     * idiom suppression for clearing StringBuilders
     */
    public static void clear(StringBuilder sb) {
        sb.delete(0, sb.length());
    }

    /*
     * So many iterators don't suport remove()
     */
    public static abstract class ImmutableIterator<E> implements Iterator<E> {
        public final void remove() {
            throw new UnsupportedOperationException("sorry!");
        }
    }

    /*
     * idiom suppression for Strings
     */
    static Iterable<Character> iterize(final CharSequence cs) {
        return new Iterable<Character>() {
            public Iterator<Character> iterator() {
                return new ImmutableIterator<Character>() {
                    private int i = 0;

                    public boolean hasNext() {
                        return i < cs.length();
                    }

                    public Character next() {
                        return cs.charAt(i++);
                    }
                };
            }
        };
    }

    static void checkIndex(int index, int size, String what) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException(
                what + " " + index + " out of range [0, " + size + ")");
        }
    }

    private static abstract class Escaper {
        abstract boolean esc(StringBuilder sb, int c);
    }

    private static final class MapEscaper extends Escaper {
        private final Map<Character, String> map =
                new HashMap<Character, String>();

        public boolean esc(StringBuilder sb, int c) {
            boolean ret = (c == (char) c) ? map.containsKey((char) c) : false;
            if (ret)
                sb.append(map.get((char) c));
            return ret;
        }

        MapEscaper map(Character c, String s) {
            map.put(c, s);
            return this;
        }
    }

    private static final MapEscaper jsEscaper =
            new MapEscaper().map('\\', "\\\\").map('"', "\\\"");

    private static final Escaper unicodeEscaper = new Escaper() {
        public boolean esc(StringBuilder sb, int c) {
            boolean ret = false;
            if (c < 32 || 126 < c) {
                int mark = sb.length();
                sb.append(Integer.toHexString(c));
                while (sb.length() - mark < 4) {
                    sb.insert(mark, "0");
                }
                sb.insert(mark, "\\u");
                ret = true;
            }
            return ret;
        }
    };

    /**
     * A collection of singleton objects which implement methods used to create
     * Strings where certain characters are replaced by escape sequences.
     */
    enum Esc {

        /**
         * Java lang escaper - escapes " and \, non-printable-ASCII and beyond ->
         * \\u codes
         */
        JAVA(jsEscaper, unicodeEscaper),
        /**
         * Dot quoted-string escaper - escapes " and \ only; dot input is
         * UTF-8 so everything else passes through.
         */
        DOT(jsEscaper);

        private final Escaper[] path;

        Esc(final Escaper... path) {
            this.path = path;
        }

        void esc(StringBuilder sb, int c) {
            for (Escaper e : path) {
                if (e.esc(sb, c))
                    return;
            }
            sb.append((char) c);
        }

        String esc(int c) {
            StringBuilder sb = new StringBuilder();
            esc(sb, c);
            return sb.toString();
        }

        void esc(StringBuilder sb, CharSequence cs) {
            for (char c : iterize(cs)) {
                esc(sb, c);
            }
        }

        String esc(CharSequence cs) {
            StringBuilder sb = new StringBuilder();
            esc(sb, cs);
            return sb.toString();
        }
    }

    /*
     * Generic digraph visitor over int-numbered vertices. Every vertex is
     * visited at most once, whatever the number of paths leading to it.
     */
    static abstract class BreadthFirstVisitor {

        private final BitSet grayed = new BitSet();
        private final Queue<Integer> gray = new ArrayDeque<Integer>();

        final BreadthFirstVisitor start(int init) {
            grayed.clear(); gray.clear();
            offer(init);
            run();
            return this;
        }

        private boolean offer(int vertex) {
            if (grayed.get(vertex)) return false;
            grayed.set(vertex);
            return gray.offer(vertex);
        }

        private void run() {
            while (!gray.isEmpty()) {
                int vertex = gray.remove();
                if (!visit(vertex)) {
                    gray.clear();
                    return;
                }
                for (int next : successors(vertex)) {
                    offer(next);
                }
            }
        }

        /*
         * out-edges of a vertex; duplicates are harmless
         */
        protected abstract Iterable<Integer> successors(int vertex);

        /*
         * return false to abandon the traversal
         */
        protected boolean visit(int vertex) {
            return true;
        }
    }
}
