package io.github.augsuggest.core;

import java.util.Objects;
import java.util.logging.Logger;

/// Computes, after selection, the regexp patterns and the alignment widths used when rendering
/// the predicates of a group.
final class PredicateWidths {

    private static final Logger LOG = Logger.getLogger(PredicateWidths.class.getName());

    /// Values wider than this are not padded, and do not widen the column for others.
    static final int MAX_PRETTY_WIDTH = 30;

    private final SuggestOptions options;

    PredicateWidths(SuggestOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /// Runs the computations the options ask for on every group.
    void computeAll(GroupIndex index) {
        for (final var group : index.groups()) {
            if (options.regexpMode()) {
                computePatterns(group);
            }
            if (options.pretty()) {
                computePrettyWidths(group);
            }
        }
    }

    /// Builds, for every position, the shortest pattern for the chosen value that cannot also
    /// match another value of the same simplified tail, and the same for the paired first tail.
    void computePatterns(Group group) {
        final boolean regexpMode = options.regexpMode();
        for (int position = 1; position <= group.maxPosition(); position++) {
            final var slot = group.slot(position);
            final var selection = slot.selection();
            if (!selection.hasPredicate()) {
                continue;
            }
            final var chosen = group.tail(selection.chosenTail());
            final var first = group.tail(selection.firstTail());
            final boolean paired = selection.tier() == SelectionTier.SUBGROUP_PAIR;

            int chosenWidth = 0;
            int firstWidth = 0;
            for (final var tail : group.tails()) {
                if (tail != chosen && tail.simplifiedTail().equals(chosen.simplifiedTail())) {
                    chosenWidth = Math.max(chosenWidth, ValueComparison.commonLength(tail.value(), chosen.value(), regexpMode));
                }
                if (paired && tail != first && tail.simplifiedTail().equals(first.simplifiedTail())) {
                    firstWidth = Math.max(firstWidth, ValueComparison.commonLength(tail.value(), first.value(), regexpMode));
                }
            }
            chosenWidth = Math.max(chosenWidth, options.regexpMinLength());
            firstWidth = Math.max(firstWidth, options.regexpMinLength());

            slot.chosenPattern(ValueFormatter.regexp(chosen.value(), chosenWidth));
            if (paired) {
                slot.firstPattern(ValueFormatter.regexp(first.value(), firstWidth));
            }
            final int width = chosenWidth;
            final int at = position;
            LOG.finer(() -> group.head() + "[" + at + "] regexp width " + width + " " + slot.chosenPattern());
        }
    }

    /// Pads the values of positions that chose the same simplified tail to a common width.
    ///
    /// Each position starts from the rendered length of its first value. Scanning forward from
    /// a position, the running maximum over positions with the same chosen simplified tail is
    /// carried into those positions; lengths over [#MAX_PRETTY_WIDTH] do not raise it.
    void computePrettyWidths(Group group) {
        final int max = group.maxPosition();
        final int[] widths = new int[max + 1];
        for (int position = 1; position <= max; position++) {
            widths[position] = renderedLength(group, position);
        }
        for (int position = 1; position <= max; position++) {
            final var selection = group.selection(position);
            if (!selection.hasPredicate()) {
                continue;
            }
            final var tail = group.tail(selection.chosenTail()).simplifiedTail();
            int maxWidth = 0;
            for (int search = position; search <= max; search++) {
                final var other = group.selection(search);
                if (other.hasPredicate() && group.tail(other.chosenTail()).simplifiedTail().equals(tail)) {
                    if (widths[search] <= MAX_PRETTY_WIDTH) {
                        maxWidth = Math.max(maxWidth, widths[search]);
                    }
                    widths[search] = maxWidth;
                }
            }
            widths[position] = Math.min(maxWidth, MAX_PRETTY_WIDTH);
        }
        for (int position = 1; position <= max; position++) {
            group.slot(position).prettyWidth(widths[position]);
        }
    }

    /// Length of the value rendered first in the predicate of a position.
    private int renderedLength(Group group, int position) {
        final var slot = group.slot(position);
        final var selection = slot.selection();
        if (!selection.hasPredicate()) {
            return 0;
        }
        final boolean paired = selection.tier() == SelectionTier.SUBGROUP_PAIR;
        final String rendered;
        if (options.regexpMode()) {
            rendered = paired ? slot.firstPattern() : slot.chosenPattern();
        } else {
            rendered = group.tail(paired ? selection.firstTail() : selection.chosenTail()).quotedValue();
        }
        return rendered == null ? 0 : rendered.length();
    }
}
