package io.github.augsuggest.core;

/// Which preference produced the predicate of a group position.
public enum SelectionTier {

    /// Selection has not run for the position yet.
    UNSET,

    /// The first significant tail and its value are unique in the group.
    FIRST_TAIL,

    /// Another tail at the position is unique in the group and present at every position.
    UNIQUE_TAIL,

    /// A tail that is unique among the positions sharing the first tail, paired with the first tail.
    SUBGROUP_PAIR,

    /// The first tail plus the rank of the position among the positions sharing it.
    SUBGROUP_RANK,

    /// No tail is available; rendered as an unconstrained wildcard.
    NO_PREDICATE
}
