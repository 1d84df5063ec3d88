package io.github.augsuggest.core;

/// Renders values as quoted literals and as minimal `regexp()` patterns.
///
/// Single quotes are preferred; double quotes are used when the value holds a single quote
/// and no double quote. Inside the quotes the chosen quote character, newline, tab and
/// backslash are escaped with a backslash.
public final class ValueFormatter {

    /// Shortest literal tail that is never replaced by `.*`.
    static final int MIN_TRAILING_LITERAL = 3;

    private ValueFormatter() {
        // utility class
    }

    /// Quotes a value for use in a `set` command or a predicate.
    /// @param value the raw value, may be `null`
    /// @return the quoted literal, or `null` when the value is absent
    public static String quote(String value) {
        if (value == null) {
            return null;
        }
        final char quote = quoteFor(value);
        final var sb = new StringBuilder(value.length() + 2);
        sb.append(quote);
        for (int i = 0; i < value.length(); i++) {
            appendEscaped(sb, value.charAt(i), quote);
        }
        sb.append(quote);
        return sb.toString();
    }

    /// Reverses [#quote(String)].
    /// @param quoted a literal produced by `quote`, may be `null`
    /// @return the raw value, or `null` when the literal is absent
    /// @throws IllegalArgumentException if the literal is not quoted or ends inside an escape
    public static String unquote(String quoted) {
        if (quoted == null) {
            return null;
        }
        if (quoted.length() < 2) {
            throw new IllegalArgumentException("Not a quoted value: " + quoted);
        }
        final char quote = quoted.charAt(0);
        if ((quote != '\'' && quote != '"') || quoted.charAt(quoted.length() - 1) != quote) {
            throw new IllegalArgumentException("Not a quoted value: " + quoted);
        }
        final var sb = new StringBuilder(quoted.length());
        final int end = quoted.length() - 1;
        for (int i = 1; i < end; i++) {
            final char c = quoted.charAt(i);
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (++i >= end) {
                throw new IllegalArgumentException("Dangling escape in quoted value: " + quoted);
            }
            final char escaped = quoted.charAt(i);
            switch (escaped) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                default -> sb.append(escaped);
            }
        }
        return sb.toString();
    }

    /// Builds a quoted pattern that matches `value`.
    ///
    /// The literal is cut short with `.*` once more than `minLength` characters have been
    /// written and at least [#MIN_TRAILING_LITERAL] characters would remain. The characters
    /// `*?.()^$|` are escaped with a doubled backslash, `[` with a single one, and `]` and `\`
    /// become `.`.
    ///
    /// @param value     the raw value, may be `null`
    /// @param minLength literal characters to keep before the value may be cut short
    /// @return the quoted pattern, or `null` when the value is absent
    public static String regexp(String value, int minLength) {
        if (value == null) {
            return null;
        }
        final char quote = quoteFor(value);
        final var sb = new StringBuilder(value.length() + 6);
        sb.append(quote);
        for (int i = 0; i < value.length(); i++) {
            final char c = value.charAt(i);
            if (c == quote || c == '\n' || c == '\t') {
                appendEscaped(sb, c, quote);
                continue;
            }
            if (c == '\\' || c == ']') {
                sb.append('.');
                continue;
            }
            switch (c) {
                case '[' -> sb.append('\\');
                case '*', '?', '.', '(', ')', '^', '$', '|' -> sb.append("\\\\");
                default -> {
                    // literal
                }
            }
            sb.append(c);
            if (i >= minLength && i + MIN_TRAILING_LITERAL < value.length()) {
                sb.append(".*");
                break;
            }
        }
        sb.append(quote);
        return sb.toString();
    }

    private static char quoteFor(String value) {
        if (value.indexOf('\'') < 0) {
            return '\'';
        }
        return value.indexOf('"') < 0 ? '"' : '\'';
    }

    private static void appendEscaped(StringBuilder sb, char c, char quote) {
        if (c == quote) {
            sb.append('\\').append(quote);
        } else if (c == '\n') {
            sb.append("\\n");
        } else if (c == '\t') {
            sb.append("\\t");
        } else if (c == '\\') {
            sb.append("\\\\");
        } else {
            sb.append(c);
        }
    }
}
