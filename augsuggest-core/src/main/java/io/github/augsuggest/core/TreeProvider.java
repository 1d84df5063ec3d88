package io.github.augsuggest.core;

import java.io.IOException;
import java.util.List;

/// Source of the leaves a run works on.
///
/// Implementations must deliver a pre-order traversal: every parent before its descendants,
/// siblings in positional order.
@FunctionalInterface
public interface TreeProvider {

    /// Returns the leaves in pre-order.
    /// @throws IOException if the underlying tree cannot be read
    List<Leaf> leaves() throws IOException;
}
