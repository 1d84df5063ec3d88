package io.github.augsuggest.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Renders leaves as `set` commands, replacing every position marker with the predicate
/// chosen for its group position.
///
/// Keeps one [EmissionState] per group position, so the output depends on the order in which
/// leaves are rendered: call [#emit(List, List)] once, with the leaves in input order.
final class ScriptEmitter {

    private static final Logger LOG = Logger.getLogger(ScriptEmitter.class.getName());

    private final GroupIndex index;
    private final SuggestOptions options;
    private final EmissionState[][] states;

    ScriptEmitter(GroupIndex index, SuggestOptions options) {
        this.index = Objects.requireNonNull(index, "index must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.states = new EmissionState[index.size()][];
        for (final var group : index.groups()) {
            final var groupStates = new EmissionState[group.maxPosition() + 1];
            groupStates[0] = EmissionState.WILDCARD;
            for (int position = 1; position <= group.maxPosition(); position++) {
                groupStates[position] = EmissionState.initial(group.selection(position).tier());
            }
            states[group.index()] = groupStates;
        }
    }

    /// Renders every leaf, skipping valueless nodes whose next leaf is one of their descendants
    /// (replaying the descendant creates them).
    ///
    /// @param leaves   leaves in input order
    /// @param segments the segment chain of each leaf, same order
    List<String> emit(List<Leaf> leaves, List<List<PathSegment>> segments) {
        Objects.requireNonNull(leaves, "leaves must not be null");
        Objects.requireNonNull(segments, "segments must not be null");
        if (leaves.size() != segments.size()) {
            throw new IllegalArgumentException("got " + segments.size() + " segment chains for " + leaves.size() + " leaves");
        }
        final var lines = new ArrayList<String>(leaves.size());
        final int last = leaves.size() - 1;
        for (int i = 0; i <= last; i++) {
            final var leaf = leaves.get(i);
            if (options.verbose()) {
                lines.add(leaf.valueless()
                        ? "#   " + leaf.path()
                        : "#   " + leaf.path() + "  " + ValueFormatter.quote(leaf.value()));
            }
            if (leaf.valueless() && i < last && PathSegmenter.isChildPath(leaf.path(), leaves.get(i + 1).path())) {
                LOG.finer(() -> "Skipped intermediate node " + leaf.path());
                continue;
            }
            lines.add(render(leaf, segments.get(i)));
            if (options.pretty() && i < last && startsNewBlock(segments.get(i), segments.get(i + 1))) {
                lines.add("");
            }
        }
        return lines;
    }

    /// Renders one `set` command, advancing the emission state of each group position it uses.
    String render(Leaf leaf, List<PathSegment> segments) {
        final var sb = new StringBuilder("set ");
        for (final var segment : segments) {
            sb.append(segment.segment());
            if (!segment.hasPosition()) {
                continue;
            }
            if (segment.numericMarker()) {
                sb.append(options.wildcard().token());
            }
            appendPredicate(sb, segment, leaf);
        }
        if (leaf.value() != null) {
            sb.append(' ').append(ValueFormatter.quote(leaf.value()));
        }
        return sb.toString();
    }

    EmissionState state(int groupIndex, int position) {
        return states[groupIndex][position];
    }

    private void appendPredicate(StringBuilder sb, PathSegment segment, Leaf leaf) {
        final var group = index.group(segment.groupIndex());
        final int position = segment.position();
        final var slot = group.slot(position);
        final var selection = slot.selection();
        final var state = states[group.index()][position];

        if (state == EmissionState.WILDCARD) {
            if (!segment.numericMarker()) {
                sb.append("[*]");
            }
            return;
        }

        final var chosen = group.tail(selection.chosenTail());
        final var first = group.tail(selection.firstTail());
        final boolean escape = state == EmissionState.ESCAPING;
        switch (selection.tier()) {
            case FIRST_TAIL, UNIQUE_TAIL -> {
                sb.append('[').append(term(chosen, slot.chosenPattern(), slot.prettyWidth()));
                if (escape) {
                    sb.append(" or count(").append(tailExpr(chosen)).append(")=0");
                }
                sb.append(']');
            }
            case SUBGROUP_RANK -> sb.append('[')
                    .append(term(chosen, slot.chosenPattern(), slot.prettyWidth()))
                    .append("][").append(selection.subgroupRank()).append(']');
            case SUBGROUP_PAIR -> {
                final var firstTerm = term(first, slot.firstPattern(), slot.prettyWidth());
                final var chosenTerm = term(chosen, slot.chosenPattern(), 0);
                if (!escape) {
                    sb.append('[').append(firstTerm).append(" and ").append(chosenTerm).append(']');
                } else {
                    sb.append('[').append(firstTerm).append(" and ( ").append(chosenTerm)
                            .append(" or count(").append(tailExpr(chosen)).append(")=0 )")
                            .append(first.hasValue() ? " ]" : "]");
                }
            }
            default -> throw new IllegalStateException("no predicate selected for " + group.head() + "[" + position + "]");
        }

        final boolean createsDiscriminator = escape
                && chosen.simplifiedTail().equals(segment.simplifiedTail())
                && Objects.equals(chosen.value(), leaf.value());
        final var next = state.next(createsDiscriminator);
        if (next != state) {
            LOG.finer(() -> group.head() + "[" + position + "] " + state + " -> " + next);
            states[group.index()][position] = next;
        }
    }

    /// `tail=value`, `tail=~regexp(pattern)`, or the bare tail when the node has no value.
    private String term(Tail tail, String pattern, int width) {
        final var expr = tailExpr(tail);
        if (!tail.hasValue()) {
            return expr;
        }
        if (options.regexpMode()) {
            return expr + "=~regexp(" + pad(pattern, width) + ")";
        }
        return expr + "=" + pad(tail.quotedValue(), width);
    }

    /// The simplified tail as a relative path: without its leading `/`, or `.` when empty.
    static String tailExpr(Tail tail) {
        final var simplified = tail.simplifiedTail();
        if (simplified.isEmpty()) {
            return ".";
        }
        return simplified.charAt(0) == '/' ? simplified.substring(1) : simplified;
    }

    private static String pad(String text, int width) {
        if (text.length() >= width) {
            return text;
        }
        final var sb = new StringBuilder(width).append(text);
        while (sb.length() < width) {
            sb.append(' ');
        }
        return sb.toString();
    }

    private static boolean startsNewBlock(List<PathSegment> current, List<PathSegment> next) {
        final var here = current.get(0);
        final var there = next.get(0);
        return here.groupIndex() != there.groupIndex()
                || (here.groupIndex() != PathSegment.NO_GROUP && here.position() != there.position());
    }
}
