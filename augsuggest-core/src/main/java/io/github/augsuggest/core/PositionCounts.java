package io.github.augsuggest.core;

import java.util.Arrays;

/// Per-position occurrence counters with the same growth policy as [PositionVector].
final class PositionCounts {

    private int[] counts;

    PositionCounts(int capacity) {
        this.counts = new int[capacity];
    }

    /// Copies the counters of another vector, keeping this vector's capacity at least as large.
    static PositionCounts copyOf(PositionCounts other, int capacity) {
        final var copy = new PositionCounts(Math.max(capacity, other.counts.length));
        System.arraycopy(other.counts, 0, copy.counts, 0, other.counts.length);
        return copy;
    }

    void ensure(int position) {
        if (position < counts.length) {
            return;
        }
        counts = Arrays.copyOf(counts, PositionVector.capacityFor(position));
    }

    int get(int position) {
        return position < counts.length ? counts[position] : 0;
    }

    int increment(int position) {
        ensure(position);
        return ++counts[position];
    }

    void set(int position, int value) {
        ensure(position);
        counts[position] = value;
    }

    int capacity() {
        return counts.length;
    }
}
