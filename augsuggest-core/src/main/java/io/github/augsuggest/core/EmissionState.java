package io.github.augsuggest.core;

/// Rendering state of one group position, advanced only while the script is emitted.
///
/// Predicates on a tail other than the first (preferences 2 and 3) refer to a node that
/// may only be created by a later line of the script. Lines emitted before that node exists
/// must tolerate its absence with `or count(tail)=0`.
enum EmissionState {

    /// Predicate rendered the same way on every line.
    FIXED,

    /// Nothing rendered yet; the first line creates the position and needs no escape.
    FIRST_RENDER,

    /// The discriminating node may not exist yet; render with the `count(...)=0` escape.
    ESCAPING,

    /// The discriminating node has been created; render without the escape.
    SETTLED,

    /// No predicate available; render an unconstrained wildcard.
    WILDCARD;

    static EmissionState initial(SelectionTier tier) {
        return switch (tier) {
            case FIRST_TAIL, SUBGROUP_RANK -> FIXED;
            case UNIQUE_TAIL, SUBGROUP_PAIR -> FIRST_RENDER;
            case NO_PREDICATE, UNSET -> WILDCARD;
        };
    }

    /// State after rendering one line.
    /// @param createsDiscriminator the line just rendered sets the discriminating tail to its chosen value
    EmissionState next(boolean createsDiscriminator) {
        return switch (this) {
            case FIRST_RENDER -> ESCAPING;
            case ESCAPING -> createsDiscriminator ? SETTLED : ESCAPING;
            case FIXED, SETTLED, WILDCARD -> this;
        };
    }
}
