package io.github.augsuggest.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Splits leaf paths into [PathSegment] chains, one segment per position marker, and
/// registers every positioned segment in the [GroupIndex].
///
/// ```
/// /head/label_a[123]/middle/label_b[456]/tail
///
/// head = /head/label_a                            position 123  tail /middle/label_b/tail
/// head = /head/label_a[123]/middle/label_b        position 456  tail /tail
/// head = /head/label_a[123]/middle/label_b[456]/tail  no position  tail ""
/// ```
///
/// A marker is `[N]` directly after a label, or `/N` followed by `/` or the end of the path,
/// with `N` a positive decimal number. Anything else, such as `[12a]` or `[0]`, is plain path
/// text. In simplified tails `[N]` is dropped and `/N` becomes `/` plus the wildcard token.
final class PathSegmenter {

    private static final Logger LOG = Logger.getLogger(PathSegmenter.class.getName());

    private final GroupIndex index;
    private final String wildcard;

    PathSegmenter(GroupIndex index, SuggestOptions options) {
        this.index = Objects.requireNonNull(index, "index must not be null");
        this.wildcard = Objects.requireNonNull(options, "options must not be null").wildcard().token();
    }

    /// Location of a position marker within a path.
    ///
    /// @param headEnd   end of the head: the `[` of a label marker, or just past the `/` of a
    ///                  numeric marker; the path length when there is no marker
    /// @param tailStart first character after the marker
    /// @param position  the marker's number, or [PathSegment#NO_POSITION]
    record Marker(int headEnd, int tailStart, int position) {}

    /// Segments the path of `leaf`, registering each positioned segment with the leaf's value.
    List<PathSegment> split(Leaf leaf) {
        Objects.requireNonNull(leaf, "leaf must not be null");
        final var path = leaf.path();
        final var segments = new ArrayList<PathSegment>();
        int start = 0;
        while (start < path.length()) {
            final var marker = nextMarker(path, start);
            final var head = path.substring(0, marker.headEnd());
            final var segment = head.substring(start);
            final var tail = simplifiedTail(path.substring(marker.tailStart()));
            int groupIndex = PathSegment.NO_GROUP;
            if (marker.position() != PathSegment.NO_POSITION) {
                final var group = index.resolveGroup(head);
                index.register(group, tail, marker.position(), leaf.value());
                groupIndex = group.index();
            }
            final var built = new PathSegment(head, segment, marker.position(), tail, groupIndex);
            LOG.finer(() -> "Segment " + built);
            segments.add(built);
            start = marker.tailStart();
        }
        return segments;
    }

    /// Finds the next position marker at or after `from`.
    static Marker nextMarker(String path, int from) {
        for (int i = from; i < path.length(); i++) {
            final char c = path.charAt(i);
            if (c == '[') {
                final int end = digitsEnd(path, i + 1);
                if (end < path.length() && path.charAt(end) == ']') {
                    final int position = parsePosition(path, i + 1, end);
                    if (position != PathSegment.NO_POSITION) {
                        return new Marker(i, end + 1, position);
                    }
                }
            } else if (c == '/') {
                final int end = digitsEnd(path, i + 1);
                if (end == path.length() || path.charAt(end) == '/') {
                    final int position = parsePosition(path, i + 1, end);
                    if (position != PathSegment.NO_POSITION) {
                        return new Marker(i + 1, end, position);
                    }
                }
            }
        }
        return new Marker(path.length(), path.length(), PathSegment.NO_POSITION);
    }

    /// Replaces the position markers of a tail: `[N]` is dropped, `/N` becomes `/<wildcard>`.
    String simplifiedTail(String tail) {
        final var sb = new StringBuilder(tail.length());
        int i = 0;
        while (i < tail.length()) {
            final char c = tail.charAt(i);
            if (c == '[') {
                final int end = digitsEnd(tail, i + 1);
                if (end < tail.length() && tail.charAt(end) == ']'
                        && parsePosition(tail, i + 1, end) != PathSegment.NO_POSITION) {
                    i = end + 1;
                    continue;
                }
            } else if (c == '/') {
                final int end = digitsEnd(tail, i + 1);
                if ((end == tail.length() || tail.charAt(end) == '/')
                        && parsePosition(tail, i + 1, end) != PathSegment.NO_POSITION) {
                    sb.append('/').append(wildcard);
                    i = end;
                    continue;
                }
            }
            sb.append(c);
            i++;
        }
        return sb.toString();
    }

    /// True when `child` continues `parent` with a `/`, that is, names a descendant of it.
    static boolean isChildPath(String parent, String child) {
        return child.length() > parent.length()
                && child.startsWith(parent)
                && child.charAt(parent.length()) == '/';
    }

    private static int digitsEnd(String s, int from) {
        int end = from;
        while (end < s.length() && s.charAt(end) >= '0' && s.charAt(end) <= '9') {
            end++;
        }
        return end;
    }

    /// Parses `s[from, to)` as a positive position, or returns [PathSegment#NO_POSITION] when
    /// the range is empty, zero or too large.
    private static int parsePosition(String s, int from, int to) {
        if (to == from) {
            return PathSegment.NO_POSITION;
        }
        try {
            final int position = Integer.parseInt(s, from, to, 10);
            return Math.max(position, PathSegment.NO_POSITION);
        } catch (NumberFormatException e) {
            LOG.fine(() -> "Position out of range, treated as path text: " + s.substring(from, to));
            return PathSegment.NO_POSITION;
        }
    }
}
