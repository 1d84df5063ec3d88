package io.github.augsuggest.core;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Rewrites the positional paths of a tree into paths that select every positioned node by
/// predicates on the values beneath it, and renders them as a script of `set` commands.
///
/// ```java
/// final var suggester = new PathSuggester(SuggestOptions.defaults().withPretty(true));
/// final var result = suggester.suggest(List.of(
///         Leaf.of("/files/etc/hosts/1"),
///         Leaf.of("/files/etc/hosts/1/ipaddr", "127.0.0.1"),
///         Leaf.of("/files/etc/hosts/1/canonical", "localhost")));
/// System.out.print(result.script());
/// ```
///
/// Each run is independent. Instances hold no state between runs and may be shared.
public final class PathSuggester {

    private static final Logger LOG = Logger.getLogger(PathSuggester.class.getName());

    private final SuggestOptions options;

    public PathSuggester(SuggestOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /// Reads the provider's leaves and suggests paths for them.
    /// @throws IOException if the provider cannot read the tree
    public SuggestResult suggest(TreeProvider provider) throws IOException {
        Objects.requireNonNull(provider, "provider must not be null");
        return suggest(provider.leaves());
    }

    /// Suggests paths for leaves given in pre-order.
    public SuggestResult suggest(List<Leaf> leaves) {
        Objects.requireNonNull(leaves, "leaves must not be null");
        LOG.fine(() -> "Suggesting paths for " + leaves.size() + " leaves with " + options);

        final var index = new GroupIndex(options);
        final var segmenter = new PathSegmenter(index, options);
        final var segments = new ArrayList<List<PathSegment>>(leaves.size());
        for (final var leaf : leaves) {
            segments.add(segmenter.split(Objects.requireNonNull(leaf, "leaf must not be null")));
        }
        LOG.fine(() -> "Registered " + index.size() + " groups");

        final var diagnostics = new TailSelector(index).selectAll();
        new PredicateWidths(options).computeAll(index);
        final var lines = new ScriptEmitter(index, options).emit(leaves, segments);
        LOG.fine(() -> "Emitted " + lines.size() + " lines, " + diagnostics.size() + " diagnostics");
        return new SuggestResult(lines, diagnostics);
    }
}
