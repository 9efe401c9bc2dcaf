package TableFill.Table;

import it.unimi.dsi.fastutil.ints.IntIntImmutablePair;
import it.unimi.dsi.fastutil.ints.IntIntPair;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * Marked flags for every unordered pair of distinct states 0..size-1.
 * <p>
 * Pairs are stored in a lower-triangular layout: pair (p, q) with p &lt; q lives at bit q*(q-1)/2 + p.
 * The whole table is allocated once. Marks are never cleared.
 */
public final class DistinguishabilityTable {
    private final int size;
    private final BitSet marks;
    private int markedCount;
    private int passes;

    public DistinguishabilityTable(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size < 0: " + size);
        }
        if ((long) size * (size - 1) / 2 > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Too many states for a pair table: " + size);
        }
        this.size = size;
        this.marks = new BitSet(pairCount(size));
    }

    private static int pairCount(int size) {
        return (int) ((long) size * (size - 1) / 2);
    }

    /**
     * Position of the canonical pair of two distinct states.
     */
    public static int pairIndex(int p, int q) {
        if (p == q) {
            throw new IllegalArgumentException("Not a pair of distinct states: " + p);
        }
        int lo = Math.min(p, q);
        int hi = Math.max(p, q);
        return (int) ((long) hi * (hi - 1) / 2) + lo;
    }

    /**
     * Canonical form of a pair: lower state id first.
     */
    public static IntIntPair canonical(int p, int q) {
        return p < q ? new IntIntImmutablePair(p, q) : new IntIntImmutablePair(q, p);
    }

    public int size() {
        return size;
    }

    public int pairCount() {
        return pairCount(size);
    }

    public int markedCount() {
        return markedCount;
    }

    public int unmarkedCount() {
        return pairCount() - markedCount;
    }

    /**
     * Number of closure passes (or worklist rounds) it took to reach the fixpoint.
     */
    public int getPasses() {
        return passes;
    }

    void setPasses(int passes) {
        this.passes = passes;
    }

    /**
     * A state is never distinguishable from itself.
     */
    public boolean isMarked(int p, int q) {
        return p != q && marks.get(pairIndex(p, q));
    }

    /**
     * @return true if the pair was not marked before
     */
    boolean mark(int p, int q) {
        int idx = pairIndex(p, q);
        if (marks.get(idx)) {
            return false;
        }
        marks.set(idx);
        markedCount++;
        return true;
    }

    /**
     * Unmarked pairs in canonical order (by lower state, then higher state).
     */
    public List<IntIntPair> unmarkedPairs() {
        final List<IntIntPair> pairs = new ArrayList<>(unmarkedCount());
        for (int p = 0; p < size; p++) {
            for (int q = p + 1; q < size; q++) {
                if (!isMarked(p, q)) {
                    pairs.add(canonical(p, q));
                }
            }
        }
        return pairs;
    }

    @Override
    public String toString() {
        return "DistinguishabilityTable{size=" + size + ", marked=" + markedCount + "/" + pairCount() + "}";
    }
}
