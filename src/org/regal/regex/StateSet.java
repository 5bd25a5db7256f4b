/*
 * @LICENSE@
 */

package org.regal.regex;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

import org.regal.regex.Misc.ImmutableIterator;

/**
 * A set of automaton states, represented as a bit vector over the fixed
 * universe <code>0..capacity-1</code>. The capacity is chosen at construction
 * and never changes; no bit outside of it is ever set.
 * <p>
 * Iteration yields the members in ascending order, and may be restarted any
 * number of times. Instances are mutable; use {@link #canonicalKey()} to
 * obtain a value suitable for use as a map key.
 */
public final class StateSet implements Iterable<Integer> {

    private static final int ADDRESS_BITS = 6;     // 64 bits per word

    private final int capacity;
    private final long[] words;

    public StateSet(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("negative capacity: " + capacity);
        }
        this.capacity = capacity;
        this.words = new long[wordCount(capacity)];
    }

    private StateSet(StateSet origin) {
        this.capacity = origin.capacity;
        this.words = origin.words.clone();
    }

    private static int wordCount(int capacity) {
        return (capacity + 63) >>> ADDRESS_BITS;
    }

    public static StateSet of(int capacity, int... members) {
        StateSet ret = new StateSet(capacity);
        for (int i : members) {
            ret.add(i);
        }
        return ret;
    }

    public static StateSet fromBooleans(boolean... states) {
        StateSet ret = new StateSet(states.length);
        for (int i = 0; i < states.length; ++i) {
            if (states[i]) ret.add(i);
        }
        return ret;
    }

    public int capacity() {
        return capacity;
    }

    public StateSet copy() {
        return new StateSet(this);
    }

    public void add(int state) {
        Misc.checkIndex(state, capacity, "state");
        words[state >>> ADDRESS_BITS] |= 1L << state;
    }

    public void remove(int state) {
        Misc.checkIndex(state, capacity, "state");
        words[state >>> ADDRESS_BITS] &= ~(1L << state);
    }

    public boolean contains(int state) {
        Misc.checkIndex(state, capacity, "state");
        return (words[state >>> ADDRESS_BITS] & (1L << state)) != 0;
    }

    /**
     * Removes every member; the capacity is unchanged.
     */
    public void clear() {
        Arrays.fill(words, 0L);
    }

    /**
     * In place union: this becomes <code>this | rhs</code>.
     *
     * @param rhs a set with the same capacity
     * @return this set
     */
    public StateSet union(StateSet rhs) {
        checkCapacity(rhs);
        for (int i = 0; i < words.length; ++i) {
            words[i] |= rhs.words[i];
        }
        return this;
    }

    /**
     * In place intersection: this becomes <code>this &amp; rhs</code>.
     *
     * @param rhs a set with the same capacity
     * @return this set
     */
    public StateSet intersect(StateSet rhs) {
        checkCapacity(rhs);
        for (int i = 0; i < words.length; ++i) {
            words[i] &= rhs.words[i];
        }
        return this;
    }

    /**
     * Non destructive test for a common member.
     */
    public boolean intersects(StateSet rhs) {
        checkCapacity(rhs);
        for (int i = 0; i < words.length; ++i) {
            if ((words[i] & rhs.words[i]) != 0) return true;
        }
        return false;
    }

    private void checkCapacity(StateSet rhs) {
        if (rhs.capacity != capacity) {
            throw new IllegalArgumentException(
                "capacity mismatch: " + capacity + " vs " + rhs.capacity);
        }
    }

    public boolean isEmpty() {
        for (long word : words) {
            if (word != 0) return false;
        }
        return true;
    }

    public int size() {
        int ret = 0;
        for (long word : words) {
            ret += Long.bitCount(word);
        }
        return ret;
    }

    /**
     * @param from first index to examine, inclusive
     * @return the smallest member not less than <code>from</code>, or -1
     */
    public int nextSetBit(int from) {
        if (from < 0) {
            throw new IndexOutOfBoundsException("from: " + from);
        }
        int u = from >>> ADDRESS_BITS;
        if (u >= words.length) return -1;
        long word = words[u] & (-1L << from);
        while (true) {
            if (word != 0) {
                return (u << ADDRESS_BITS) + Long.numberOfTrailingZeros(word);
            }
            if (++u == words.length) return -1;
            word = words[u];
        }
    }

    public Iterator<Integer> iterator() {
        return new ImmutableIterator<Integer>() {
            private int next = nextSetBit(0);

            public boolean hasNext() {
                return next != -1;
            }

            public Integer next() {
                if (next == -1) throw new NoSuchElementException();
                int ret = next;
                next = nextSetBit(ret + 1);
                return ret;
            }
        };
    }

    /**
     * @return an immutable snapshot of this set, equal to the key of any
     *         other set with the same capacity and members
     */
    public Key canonicalKey() {
        return new Key(capacity, words.clone());
    }

    /**
     * Immutable, ordered identity of a {@link StateSet}, used to number the
     * states discovered by the subset construction.
     */
    public static final class Key implements Comparable<Key> {

        private final int capacity;
        private final long[] words;
        private final int hash;

        private Key(int capacity, long[] words) {
            this.capacity = capacity;
            this.words = words;
            this.hash = 31 * capacity + Arrays.hashCode(words);
        }

        public int compareTo(Key o) {
            if (capacity != o.capacity) {
                return capacity < o.capacity ? -1 : 1;
            }
            for (int i = words.length - 1; i >= 0; --i) {
                if (words[i] != o.words[i]) {
                    return Long.compareUnsigned(words[i], o.words[i]);
                }
            }
            return 0;
        }

        @Override
        public int hashCode() {
            return hash;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Key))
                return false;
            final Key key = (Key) o;
            return capacity == key.capacity && Arrays.equals(words, key.words);
        }
    }

    @Override
    public int hashCode() {
        return 31 * capacity + Arrays.hashCode(words);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof StateSet))
            return false;
        final StateSet ss = (StateSet) o;
        return capacity == ss.capacity && Arrays.equals(words, ss.words);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('{');
        final int mark = sb.length();
        for (int state : this) {
            sb.append(sb.length() == mark ? "" : ",").append(state);
        }
        sb.append('}');
        return sb.toString();
    }
}
