package com.genenet.rbn.api;

import java.util.Arrays;
import java.util.Random;

/**
 * Immutable global state of a network: one bit per node, indexed by node id.
 *
 * Bits are packed 64 per long. Equality is exact bit-vector equality, which
 * is what attractor membership and deduplication rely on.
 */
public final class State {
    private final int size;
    private final long[] words;
    private final int hash;

    private State(int size, long[] words) {
        this.size = size;
        this.words = words;
        this.hash = 31 * size + Arrays.hashCode(words);
    }

    public static State of(boolean... bits) {
        long[] words = new long[wordCount(bits.length)];
        for (int i = 0; i < bits.length; i++) {
            if (bits[i])
                words[i >> 6] |= 1L << i;
        }
        return new State(bits.length, words);
    }

    /** Builds a state from 0/1 values, e.g. {@code State.ofBits(1, 0, 1)}. */
    public static State ofBits(int... bits) {
        long[] words = new long[wordCount(bits.length)];
        for (int i = 0; i < bits.length; i++) {
            if (bits[i] != 0 && bits[i] != 1)
                throw new IllegalArgumentException("Bit " + i + " is not 0 or 1: " + bits[i]);
            if (bits[i] == 1)
                words[i >> 6] |= 1L << i;
        }
        return new State(bits.length, words);
    }

    /**
     * Decodes a state-space index: bit {@code i} of {@code index} becomes the
     * value of node {@code i}. Only defined for networks of at most 63 nodes.
     */
    public static State fromIndex(long index, int size) {
        if (size > 63)
            throw new IllegalArgumentException("State index only defined for up to 63 nodes, got " + size);
        if (size < 63 && (index < 0 || index >= (1L << size)))
            throw new IllegalArgumentException("Index " + index + " out of range for " + size + " nodes");
        long[] words = new long[wordCount(size)];
        if (size > 0)
            words[0] = index;
        return new State(size, words);
    }

    /** Uniform random state: every bit an independent fair coin flip. */
    public static State random(int size, Random random) {
        boolean[] bits = new boolean[size];
        for (int i = 0; i < size; i++)
            bits[i] = random.nextBoolean();
        return of(bits);
    }

    private static int wordCount(int size) {
        return Math.max(1, (size + 63) >> 6);
    }

    public int size() {
        return size;
    }

    public boolean get(int node) {
        if (node < 0 || node >= size)
            throw new IndexOutOfBoundsException("Node " + node + " outside state of size " + size);
        return (words[node >> 6] & (1L << node)) != 0;
    }

    /** Value of the node as 0 or 1. */
    public int bit(int node) {
        return get(node) ? 1 : 0;
    }

    /** Returns a copy of this state with one node set to {@code value}. */
    public State with(int node, boolean value) {
        if (get(node) == value)
            return this;
        long[] copy = words.clone();
        copy[node >> 6] ^= 1L << node;
        return new State(size, copy);
    }

    /** Inverse of {@link #fromIndex(long, int)}. */
    public long index() {
        if (size > 63)
            throw new IllegalStateException("State index only defined for up to 63 nodes, got " + size);
        return words[0];
    }

    public boolean[] toArray() {
        boolean[] bits = new boolean[size];
        for (int i = 0; i < size; i++)
            bits[i] = get(i);
        return bits;
    }

    /** Number of nodes whose values differ between this state and {@code other}. */
    public int hammingDistance(State other) {
        if (other.size != size)
            throw new IllegalArgumentException("State sizes differ: " + size + " vs " + other.size);
        int d = 0;
        for (int w = 0; w < words.length; w++)
            d += Long.bitCount(words[w] ^ other.words[w]);
        return d;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof State other))
            return false;
        return size == other.size && Arrays.equals(words, other.words);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(size * 3 + 2).append('(');
        for (int i = 0; i < size; i++) {
            if (i > 0)
                sb.append(", ");
            sb.append(bit(i));
        }
        return sb.append(')').toString();
    }
}
