package io.github.augsuggest.core;

import java.util.Objects;

/// Run configuration shared by every stage of a suggestion run.
///
/// @param pretty          align predicate values and separate groups with blank lines
/// @param regexpMinLength minimum literal length of `regexp()` predicates; `0` disables regexp mode
/// @param wildcard        token used for purely numeric position markers
/// @param verbose         echo every input leaf as a comment line ahead of its `set` line
public record SuggestOptions(boolean pretty, int regexpMinLength, WildcardStyle wildcard, boolean verbose) {

    /// Literal length used when regexp mode is requested without an explicit length.
    public static final int DEFAULT_REGEXP_LENGTH = 8;

    public SuggestOptions {
        Objects.requireNonNull(wildcard, "wildcard must not be null");
        if (regexpMinLength < 0) {
            throw new IllegalArgumentException("regexpMinLength must not be negative: " + regexpMinLength);
        }
    }

    /// No alignment, exact-value predicates, `seq::*` wildcards, no echo.
    public static SuggestOptions defaults() {
        return new SuggestOptions(false, 0, WildcardStyle.SEQUENCE, false);
    }

    public boolean regexpMode() {
        return regexpMinLength > 0;
    }

    public SuggestOptions withPretty(boolean pretty) {
        return new SuggestOptions(pretty, regexpMinLength, wildcard, verbose);
    }

    public SuggestOptions withRegexp(int minLength) {
        return new SuggestOptions(pretty, minLength, wildcard, verbose);
    }

    public SuggestOptions withWildcard(WildcardStyle wildcard) {
        return new SuggestOptions(pretty, regexpMinLength, wildcard, verbose);
    }

    public SuggestOptions withVerbose(boolean verbose) {
        return new SuggestOptions(pretty, regexpMinLength, wildcard, verbose);
    }
}
