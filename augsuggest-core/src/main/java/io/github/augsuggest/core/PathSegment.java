package io.github.augsuggest.core;

import java.util.Objects;

/// One level of a segmented path.
///
/// ```
/// /files/some/path/label[1]/tail_a
/// `--------------------' \ `-----'
///         `--- head       \    `--- simplified tail
///                          `-- position
/// ```
///
/// @param head           path up to the position marker, or the whole path for the last level
/// @param segment        the part of `head` that belongs to this level, used for rendering
/// @param position       1-based sibling position, or [#NO_POSITION]
/// @param simplifiedTail remainder of the path with nested markers replaced by wildcards
/// @param groupIndex     index of the owning [Group], or [#NO_GROUP]
public record PathSegment(String head, String segment, int position, String simplifiedTail, int groupIndex) {

    /// Position value for levels without a position marker.
    public static final int NO_POSITION = 0;

    /// Group index for levels that are not registered in any group.
    public static final int NO_GROUP = -1;

    public PathSegment {
        Objects.requireNonNull(head, "head must not be null");
        Objects.requireNonNull(segment, "segment must not be null");
        Objects.requireNonNull(simplifiedTail, "simplifiedTail must not be null");
        if (position < 0) {
            throw new IllegalArgumentException("position must not be negative: " + position);
        }
    }

    public boolean hasPosition() {
        return position != NO_POSITION;
    }

    /// True for purely numeric markers (`/N`), whose segment text ends with the separator.
    public boolean numericMarker() {
        return !segment.isEmpty() && segment.charAt(segment.length() - 1) == '/';
    }
}
