package io.github.augsuggest.cli;

/// Exception thrown when a line of a print dump cannot be read.
public class TreeFormatException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String source;
    private final int line;
    private final int column;

    /// Creates a new format exception for a 1-based line and column of the named source.
    public TreeFormatException(String message, String source, int line, int column) {
        super(formatMessage(message, source, line, column));
        this.source = source;
        this.line = line;
        this.column = column;
    }

    /// Returns the name of the dump being read.
    public String source() {
        return source;
    }

    /// Returns the 1-based line number of the offending line.
    public int line() {
        return line;
    }

    /// Returns the 1-based column where the problem was detected.
    public int column() {
        return column;
    }

    private static String formatMessage(String message, String source, int line, int column) {
        final var sb = new StringBuilder();
        sb.append(message);
        sb.append(" at line ").append(line).append(", column ").append(column);
        if (source != null) {
            sb.append(" in ").append(source);
        }
        return sb.toString();
    }
}
