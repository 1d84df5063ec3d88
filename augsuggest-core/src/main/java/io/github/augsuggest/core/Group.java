package io.github.augsuggest.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// All siblings addressed by position under one parent, identified by the parent's head.
///
/// Owns the [Tail] records observed below its positions and one [PositionSlot] per position.
/// Tails and subgroups are addressed by their index in this group.
final class Group {

    private final int index;
    private final String head;
    private final List<Tail> tails = new ArrayList<>();
    private final List<Subgroup> subgroups = new ArrayList<>();
    private final PositionVector<PositionSlot> slots = new PositionVector<>(PositionSlot::new);
    private int maxPosition;

    Group(int index, String head) {
        this.index = index;
        this.head = Objects.requireNonNull(head, "head must not be null");
    }

    int index() {
        return index;
    }

    String head() {
        return head;
    }

    int maxPosition() {
        return maxPosition;
    }

    /// Records that `position` is in use, growing the position vectors of the group and of
    /// every tail it owns when needed.
    void observePosition(int position) {
        if (position <= maxPosition) {
            return;
        }
        maxPosition = position;
        if (position >= slots.capacity()) {
            slots.ensure(position);
            for (final var tail : tails) {
                tail.ensure(position);
            }
        }
    }

    int capacity() {
        return slots.capacity();
    }

    List<Tail> tails() {
        return Collections.unmodifiableList(tails);
    }

    Tail tail(int tailIndex) {
        return tails.get(tailIndex);
    }

    void addTail(Tail tail) {
        if (tail.index() != tails.size()) {
            throw new IllegalStateException("tail index " + tail.index() + " out of sequence in group " + head);
        }
        tails.add(tail);
    }

    PositionSlot slot(int position) {
        if (position < 1 || position > maxPosition) {
            throw new IndexOutOfBoundsException("position " + position + " outside 1.." + maxPosition + " of " + head);
        }
        return slots.get(position);
    }

    List<TailStub> stubsAt(int position) {
        return slot(position).stubs();
    }

    Selection selection(int position) {
        return slot(position).selection();
    }

    List<Subgroup> subgroups() {
        return Collections.unmodifiableList(subgroups);
    }

    void addSubgroup(Subgroup subgroup) {
        subgroups.add(subgroup);
    }

    @Override
    public String toString() {
        return "Group[" + index + "] " + head + " (" + maxPosition + " positions, " + tails.size() + " tails)";
    }

    /// Per-position state of a group: observed tails, the chosen predicate and its rendering widths.
    static final class PositionSlot {

        private final List<TailStub> stubs = new ArrayList<>();
        private Selection selection = Selection.UNSET;
        private int prettyWidth;
        private String chosenPattern;
        private String firstPattern;

        List<TailStub> stubs() {
            return stubs;
        }

        Selection selection() {
            return selection;
        }

        void selection(Selection selection) {
            this.selection = Objects.requireNonNull(selection, "selection must not be null");
        }

        /// Column width values are padded to when aligned output is requested, else 0.
        int prettyWidth() {
            return prettyWidth;
        }

        void prettyWidth(int prettyWidth) {
            this.prettyWidth = prettyWidth;
        }

        /// Quoted regexp for the chosen tail's value, computed in regexp mode only.
        String chosenPattern() {
            return chosenPattern;
        }

        void chosenPattern(String chosenPattern) {
            this.chosenPattern = chosenPattern;
        }

        /// Quoted regexp for the first tail's value when it is paired with the chosen tail.
        String firstPattern() {
            return firstPattern;
        }

        void firstPattern(String firstPattern) {
            this.firstPattern = firstPattern;
        }
    }
}
