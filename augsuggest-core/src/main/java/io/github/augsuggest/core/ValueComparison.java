package io.github.augsuggest.core;

/// Compares observed values, counting the characters they have in common.
///
/// In regexp mode a `]` or `\` on either side matches any character, since
/// [ValueFormatter#regexp(String, int)] renders both as `.`.
final class ValueComparison {

    private ValueComparison() {
        // utility class
    }

    /// True when both values are absent, or both are present and equal.
    static boolean equal(String left, String right, boolean regexpMode) {
        return compare(left, right, regexpMode) >= 0;
    }

    /// Number of leading characters the two values share. Zero when either is absent.
    static int commonLength(String left, String right, boolean regexpMode) {
        final int result = compare(left, right, regexpMode);
        return result >= 0 ? result : -result - 1;
    }

    /// Returns the common length `n` when the values are equal, `-n - 1` when they differ.
    private static int compare(String left, String right, boolean regexpMode) {
        if (left == null && right == null) {
            return 0;
        }
        if (left == null || right == null) {
            return -1;
        }
        final int shorter = Math.min(left.length(), right.length());
        int matched = 0;
        while (matched < shorter) {
            final char l = left.charAt(matched);
            final char r = right.charAt(matched);
            if (l != r && !(regexpMode && (isWildcard(l) || isWildcard(r)))) {
                return -matched - 1;
            }
            matched++;
        }
        return left.length() == right.length() ? matched : -matched - 1;
    }

    private static boolean isWildcard(char c) {
        return c == ']' || c == '\\';
    }
}
