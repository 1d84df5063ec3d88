package io.github.augsuggest.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Registry of every [Group] of a run, in creation order, together with the tails observed
/// at their positions.
///
/// Groups are looked up by exact head equality and are addressed by their creation index.
final class GroupIndex {

    private static final Logger LOG = Logger.getLogger(GroupIndex.class.getName());

    private final boolean regexpMode;
    private final List<Group> groups = new ArrayList<>();
    private final Map<String, Group> byHead = new HashMap<>();

    GroupIndex(SuggestOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        this.regexpMode = options.regexpMode();
    }

    /// Returns the group for `head`, creating it on first use.
    Group resolveGroup(String head) {
        Objects.requireNonNull(head, "head must not be null");
        final var existing = byHead.get(head);
        if (existing != null) {
            return existing;
        }
        final var group = new Group(groups.size(), head);
        groups.add(group);
        byHead.put(head, group);
        LOG.finer(() -> "New group " + group.index() + ": " + head);
        return group;
    }

    /// Records one observation of `(simplifiedTail, value)` at `position` of `group`.
    ///
    /// Every tail already known under the same simplified tail has its `found` count for the
    /// position raised; a tail whose value compares equal also has its `foundWithValue` count
    /// raised. A pair seen for the first time gets a new tail that inherits the `found` counts of
    /// its simplified tail. Either way the position gains a [TailStub].
    ///
    /// @return the tail holding the observed pair
    Tail register(Group group, String simplifiedTail, int position, String value) {
        Objects.requireNonNull(group, "group must not be null");
        Objects.requireNonNull(simplifiedTail, "simplifiedTail must not be null");
        if (position < 1) {
            throw new IllegalArgumentException("position must be at least 1: " + position);
        }
        group.observePosition(position);

        Tail sameValue = null;
        Tail sameTail = null;
        int foundHere = 1;
        for (final var tail : group.tails()) {
            if (tail.simplifiedTail().equals(simplifiedTail)) {
                foundHere = tail.incrementFound(position);
                if (ValueComparison.equal(tail.value(), value, regexpMode)) {
                    tail.incrementFoundWithValue(position);
                    sameValue = tail;
                }
                sameTail = tail;
            }
        }

        Tail result = sameValue;
        if (result == null) {
            final int capacity = group.capacity();
            final var found = sameTail == null
                    ? new PositionCounts(capacity)
                    : PositionCounts.copyOf(sameTail.found(), capacity);
            result = new Tail(group.tails().size(), simplifiedTail, value, found, capacity);
            result.setFound(position, foundHere);
            result.incrementFoundWithValue(position);
            group.addTail(result);
        }
        group.stubsAt(position).add(new TailStub(result.index()));

        final var registered = result;
        LOG.finer(() -> "Registered " + group.head() + "[" + position + "] " + registered);
        return result;
    }

    List<Group> groups() {
        return Collections.unmodifiableList(groups);
    }

    Group group(int index) {
        return groups.get(index);
    }

    int size() {
        return groups.size();
    }
}
