package io.github.augsuggest.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/// Growable vector of per-position slots, indexed `1..max`.
///
/// Capacity grows in steps of [#GROWTH_STEP]: a request for position `p` grows the vector to
/// `(p + 1) / GROWTH_STEP * GROWTH_STEP + GROWTH_STEP` slots. Every slot exposed by growth is
/// filled from the supplied factory, never left `null`. Slot `0` exists but is unused.
final class PositionVector<T> {

    static final int GROWTH_STEP = 8;

    private final Supplier<T> unset;
    private final List<T> slots;

    PositionVector(Supplier<T> unset) {
        this.unset = Objects.requireNonNull(unset, "unset must not be null");
        this.slots = new ArrayList<>();
    }

    static int capacityFor(int position) {
        return (position + 1) / GROWTH_STEP * GROWTH_STEP + GROWTH_STEP;
    }

    /// Grows the vector so that `position` is addressable.
    void ensure(int position) {
        if (position < slots.size()) {
            return;
        }
        final int capacity = capacityFor(position);
        while (slots.size() < capacity) {
            slots.add(unset.get());
        }
    }

    T get(int position) {
        return slots.get(position);
    }

    int capacity() {
        return slots.size();
    }
}
