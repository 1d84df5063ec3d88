package io.github.augsuggest.core;

import java.util.List;
import java.util.Objects;

/// Outcome of a run: the script lines in emission order and any diagnostics.
///
/// @param lines       `set` lines, plus blank separators and comments when requested
/// @param diagnostics problems that were degraded to a best-effort rendering
public record SuggestResult(List<String> lines, List<Diagnostic> diagnostics) {

    public SuggestResult {
        Objects.requireNonNull(lines, "lines must not be null");
        Objects.requireNonNull(diagnostics, "diagnostics must not be null");
        lines = List.copyOf(lines);
        diagnostics = List.copyOf(diagnostics);
    }

    /// The script as one string, each line terminated by a newline.
    public String script() {
        final var sb = new StringBuilder();
        for (final var line : lines) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }
}
