package io.github.augsuggest.core;

import java.util.Objects;

/// One node of the tree delivered by a [TreeProvider]: its absolute path and its value.
///
/// Paths are `/`-separated and may embed `label[N]` or purely numeric `/N` components that
/// address the N-th sibling under a shared parent. A `null` value means the node is
/// non-terminal or empty.
///
/// @param path  absolute path of the node, starting with `/`
/// @param value the node value, or `null` when the node has none
public record Leaf(String path, String value) {

    public Leaf {
        Objects.requireNonNull(path, "path must not be null");
        if (path.isEmpty() || path.charAt(0) != '/') {
            throw new IllegalArgumentException("path must start with '/': " + path);
        }
    }

    /// Creates a leaf without a value.
    public static Leaf of(String path) {
        return new Leaf(path, null);
    }

    /// Creates a leaf with a value.
    public static Leaf of(String path, String value) {
        return new Leaf(path, value);
    }

    /// True when the value is absent or empty.
    public boolean valueless() {
        return value == null || value.isEmpty();
    }
}
