package io.github.augsuggest.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Chooses, for every position of every group, the predicate that identifies the position
/// by the values below it instead of by its ordinal.
///
/// Preferences, first match wins:
/// 1. the first significant tail, if its (tail, value) pair is unique in the group;
/// 2. any tail at the position whose pair is unique in the group and whose tail occurs at
///    every position;
/// 3. a tail whose pair is unique among the positions sharing the first tail, and whose tail
///    occurs at all of them, combined with the first tail;
/// 4. the first tail plus the rank of the position among the positions sharing it.
///
/// In (2) and (3) a candidate is skipped when an earlier tail at the same position has the
/// same simplified tail: a predicate on it would address the earlier node.
///
/// Runs after every leaf has been registered, since it relies on the final counts.
final class TailSelector {

    private static final Logger LOG = Logger.getLogger(TailSelector.class.getName());

    private final GroupIndex index;

    TailSelector(GroupIndex index) {
        this.index = Objects.requireNonNull(index, "index must not be null");
    }

    /// Selects a predicate for every position of every group.
    /// @return diagnostics for positions that could not be given a predicate
    List<Diagnostic> selectAll() {
        final var diagnostics = new ArrayList<Diagnostic>();
        for (final var group : index.groups()) {
            for (int position = 1; position <= group.maxPosition(); position++) {
                final var selection = select(group, position, diagnostics);
                group.slot(position).selection(selection);
            }
            LOG.fine(() -> "Selected predicates for " + group);
        }
        return diagnostics;
    }

    Selection select(Group group, int position, List<Diagnostic> diagnostics) {
        final var stubs = group.stubsAt(position);
        if (stubs.isEmpty()) {
            final var diagnostic = new Diagnostic(group.head(), position, "no tail recorded for position (internal error)");
            LOG.warning(diagnostic::toString);
            diagnostics.add(diagnostic);
            return Selection.noPredicate();
        }

        final int firstIndex = firstSignificant(group, stubs);
        final var first = group.tail(stubs.get(firstIndex).tailIndex());
        LOG.finer(() -> "choose " + group.head() + "[" + position + "] first tail " + first);

        if (stubs.size() == 1 && first.simplifiedTail().isEmpty() && !first.hasValue()) {
            // the bare node without a value or children
            return Selection.noPredicate();
        }

        if (first.uniqueInGroup()) {
            LOG.finer(() -> "  1st preference " + first);
            return Selection.firstTail(first.index());
        }

        for (int i = firstIndex; i < stubs.size(); i++) {
            final var candidate = group.tail(stubs.get(i).tailIndex());
            if (candidate.uniqueInGroup()
                    && presentAtEveryPosition(group, candidate)
                    && !shadowed(group, stubs, firstIndex, i)) {
                LOG.finer(() -> "  2nd preference " + candidate);
                return Selection.uniqueTail(candidate.index(), first.index());
            }
        }

        final var subgroup = subgroupFor(group, first);
        for (int i = firstIndex + 1; i < stubs.size(); i++) {
            final var candidate = group.tail(stubs.get(i).tailIndex());
            if (uniqueWithinSubgroup(candidate, subgroup, position)
                    && !shadowed(group, stubs, firstIndex, i)) {
                LOG.finer(() -> "  3rd preference " + first + " and " + candidate);
                return Selection.subgroupPair(candidate.index(), first.index());
            }
        }

        final int rank = subgroup.rankOf(position);
        LOG.finer(() -> "  4th preference " + first + " rank " + rank);
        return Selection.subgroupRank(first.index(), rank);
    }

    /// Index of the first stub that carries a value, skipping valueless nodes that only exist
    /// to hold the next stub's node.
    static int firstSignificant(Group group, List<TailStub> stubs) {
        int i = 0;
        for (; i + 1 < stubs.size(); i++) {
            final var tail = group.tail(stubs.get(i).tailIndex());
            if (tail.value() != null && !tail.value().isEmpty()) {
                break;
            }
            final var next = group.tail(stubs.get(i + 1).tailIndex());
            if (!PathSegmenter.isChildPath(tail.simplifiedTail(), next.simplifiedTail())) {
                break;
            }
        }
        return i;
    }

    /// Returns the subgroup of positions holding `first`, computing it on first request.
    Subgroup subgroupFor(Group group, Tail first) {
        for (final var subgroup : group.subgroups()) {
            if (subgroup.firstTail() == first.index()) {
                return subgroup;
            }
        }
        final var members = new ArrayList<Integer>();
        for (int position = 1; position <= group.maxPosition(); position++) {
            for (final var stub : group.stubsAt(position)) {
                if (stub.tailIndex() == first.index()) {
                    members.add(position);
                    break;
                }
            }
        }
        final var subgroup = new Subgroup(first.index(), members);
        group.addSubgroup(subgroup);
        LOG.finer(() -> "  subgroup of " + first + ": " + subgroup.members());
        return subgroup;
    }

    private static boolean presentAtEveryPosition(Group group, Tail tail) {
        for (int position = 1; position <= group.maxPosition(); position++) {
            if (!tail.presentAt(position)) {
                return false;
            }
        }
        return true;
    }

    private static boolean uniqueWithinSubgroup(Tail candidate, Subgroup subgroup, int position) {
        for (final int member : subgroup.members()) {
            if (member == position) {
                continue;
            }
            if (candidate.presentWithValueAt(member) || !candidate.presentAt(member)) {
                return false;
            }
        }
        return true;
    }

    /// True when a stub in `[from, candidate)` has the same simplified tail as the candidate.
    private static boolean shadowed(Group group, List<TailStub> stubs, int from, int candidate) {
        final var tail = group.tail(stubs.get(candidate).tailIndex()).simplifiedTail();
        for (int i = from; i < candidate; i++) {
            if (group.tail(stubs.get(i).tailIndex()).simplifiedTail().equals(tail)) {
                return true;
            }
        }
        return false;
    }
}
