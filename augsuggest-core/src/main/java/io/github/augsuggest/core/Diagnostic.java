package io.github.augsuggest.core;

import java.util.Objects;

/// A non-fatal problem found during a run, reported alongside the generated script.
///
/// @param head     head of the group concerned
/// @param position position within that group
/// @param message  human readable description
public record Diagnostic(String head, int position, String message) {

    public Diagnostic {
        Objects.requireNonNull(head, "head must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    @Override
    public String toString() {
        return head + "[" + position + "] " + message;
    }
}
