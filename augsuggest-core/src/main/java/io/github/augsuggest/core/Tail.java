package io.github.augsuggest.core;

import java.util.Objects;

/// A distinct (simplified tail, value) pair observed within one [Group].
///
/// `found` counts, per position, how often the simplified tail occurs with any value; every
/// tail record sharing a simplified tail carries the same `found` counts. `foundWithValue`
/// counts occurrences of this exact pair.
final class Tail {

    private final int index;
    private final String simplifiedTail;
    private final String value;
    private final String quotedValue;
    private final PositionCounts found;
    private final PositionCounts foundWithValue;
    private int foundWithValueTotal;

    Tail(int index, String simplifiedTail, String value, PositionCounts found, int capacity) {
        this.index = index;
        this.simplifiedTail = Objects.requireNonNull(simplifiedTail, "simplifiedTail must not be null");
        this.value = value;
        this.quotedValue = ValueFormatter.quote(value);
        this.found = Objects.requireNonNull(found, "found must not be null");
        this.foundWithValue = new PositionCounts(capacity);
    }

    int index() {
        return index;
    }

    String simplifiedTail() {
        return simplifiedTail;
    }

    /// The value, or `null` when the observed node has none.
    String value() {
        return value;
    }

    /// The value as a quoted literal, or `null` when there is no value.
    String quotedValue() {
        return quotedValue;
    }

    boolean hasValue() {
        return value != null;
    }

    /// True when the pair occurs exactly once in the whole group.
    boolean uniqueInGroup() {
        return foundWithValueTotal == 1;
    }

    /// True when the simplified tail occurs at the position, whatever its value.
    boolean presentAt(int position) {
        return found.get(position) != 0;
    }

    /// True when this exact pair occurs at the position.
    boolean presentWithValueAt(int position) {
        return foundWithValue.get(position) != 0;
    }

    int incrementFound(int position) {
        return found.increment(position);
    }

    void setFound(int position, int count) {
        found.set(position, count);
    }

    void incrementFoundWithValue(int position) {
        foundWithValue.increment(position);
        foundWithValueTotal++;
    }

    PositionCounts found() {
        return found;
    }

    void ensure(int position) {
        found.ensure(position);
        foundWithValue.ensure(position);
    }

    @Override
    public String toString() {
        return simplifiedTail + "=" + quotedValue;
    }
}
