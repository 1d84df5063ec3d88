package io.github.augsuggest.core;

import java.util.List;
import java.util.Objects;

/// The positions of a [Group] at which a given first tail occurs, in ascending order.
///
/// @param firstTail index of the tail shared by the members
/// @param members   member positions, ascending
record Subgroup(int firstTail, List<Integer> members) {

    Subgroup {
        Objects.requireNonNull(members, "members must not be null");
        members = List.copyOf(members);
    }

    /// 1-based rank of a position among the members, or 0 if it is not a member.
    int rankOf(int position) {
        return members.indexOf(position) + 1;
    }
}
