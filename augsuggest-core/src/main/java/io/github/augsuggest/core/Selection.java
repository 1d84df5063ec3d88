package io.github.augsuggest.core;

import java.util.Objects;

/// The predicate chosen for one group position.
///
/// @param tier         preference that produced the predicate
/// @param chosenTail   index of the discriminating tail, or [#NONE]
/// @param firstTail    index of the first significant tail, or [#NONE]
/// @param subgroupRank rank within the first-tail subgroup for [SelectionTier#SUBGROUP_RANK], else 0
record Selection(SelectionTier tier, int chosenTail, int firstTail, int subgroupRank) {

    static final int NONE = -1;

    static final Selection UNSET = new Selection(SelectionTier.UNSET, NONE, NONE, 0);

    Selection {
        Objects.requireNonNull(tier, "tier must not be null");
    }

    static Selection firstTail(int first) {
        return new Selection(SelectionTier.FIRST_TAIL, first, first, 0);
    }

    static Selection uniqueTail(int chosen, int first) {
        return new Selection(SelectionTier.UNIQUE_TAIL, chosen, first, 0);
    }

    static Selection subgroupPair(int chosen, int first) {
        return new Selection(SelectionTier.SUBGROUP_PAIR, chosen, first, 0);
    }

    static Selection subgroupRank(int first, int rank) {
        return new Selection(SelectionTier.SUBGROUP_RANK, first, first, rank);
    }

    static Selection noPredicate() {
        return new Selection(SelectionTier.NO_PREDICATE, NONE, NONE, 0);
    }

    boolean hasPredicate() {
        return chosenTail != NONE;
    }
}
