package io.github.augsuggest.cli;

import io.github.augsuggest.core.Leaf;
import io.github.augsuggest.core.TreeProvider;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Reads the tree from the output of `augtool print`.
///
/// ```
/// /files/etc/hosts/1
/// /files/etc/hosts/1/ipaddr = "127.0.0.1"
/// /files/etc/hosts/1/canonical = "localhost"
/// ```
///
/// Each line is a path, optionally followed by ` = ` and a double quoted value in which `\"`,
/// `\\`, `\n` and `\t` are escapes. Blank lines and lines starting with `#` are skipped.
/// Leaves are returned in file order, which `augtool print` guarantees to be pre-order.
public final class PrintDumpTreeProvider implements TreeProvider {

    private static final Logger LOG = Logger.getLogger(PrintDumpTreeProvider.class.getName());

    private static final String SEPARATOR = " = ";

    private final ReaderSupplier input;
    private final String source;

    @FunctionalInterface
    private interface ReaderSupplier {
        Reader open() throws IOException;
    }

    private PrintDumpTreeProvider(ReaderSupplier input, String source) {
        this.input = input;
        this.source = source;
    }

    /// Provider reading a UTF-8 dump file; the file is read again on every call.
    public static PrintDumpTreeProvider ofFile(Path file) {
        Objects.requireNonNull(file, "file must not be null");
        return new PrintDumpTreeProvider(() -> Files.newBufferedReader(file, StandardCharsets.UTF_8), file.toString());
    }

    /// Provider reading a dump from an open reader, such as standard input. Closes the reader.
    public static PrintDumpTreeProvider ofReader(Reader reader, String source) {
        Objects.requireNonNull(reader, "reader must not be null");
        Objects.requireNonNull(source, "source must not be null");
        return new PrintDumpTreeProvider(() -> reader, source);
    }

    /// Provider over dump text held in memory.
    public static PrintDumpTreeProvider ofText(String text) {
        Objects.requireNonNull(text, "text must not be null");
        return new PrintDumpTreeProvider(() -> new StringReader(text), "<text>");
    }

    @Override
    public List<Leaf> leaves() throws IOException {
        final var leaves = new ArrayList<Leaf>();
        try (var reader = new BufferedReader(input.open())) {
            String line;
            int number = 0;
            while ((line = reader.readLine()) != null) {
                number++;
                final var leaf = parseLine(line, number);
                if (leaf != null) {
                    leaves.add(leaf);
                }
            }
        }
        LOG.fine(() -> "Read " + leaves.size() + " leaves from " + source);
        return leaves;
    }

    /// Parses one dump line, returning `null` for blank and comment lines.
    Leaf parseLine(String line, int number) {
        final var text = line.stripTrailing();
        if (text.isEmpty() || text.charAt(0) == '#') {
            return null;
        }
        if (text.charAt(0) != '/') {
            throw new TreeFormatException("Path must start with '/'", source, number, 1);
        }
        final int separator = text.indexOf(SEPARATOR);
        if (separator < 0) {
            return Leaf.of(text);
        }
        final var path = text.substring(0, separator);
        final int valueStart = separator + SEPARATOR.length();
        if (valueStart >= text.length() || text.charAt(valueStart) != '"') {
            throw new TreeFormatException("Value must be double quoted", source, number, valueStart + 1);
        }
        return Leaf.of(path, unescape(text, valueStart + 1, number));
    }

    private String unescape(String text, int from, int number) {
        final var sb = new StringBuilder(text.length() - from);
        int i = from;
        while (i < text.length()) {
            final char c = text.charAt(i);
            if (c == '"') {
                if (i != text.length() - 1) {
                    throw new TreeFormatException("Unexpected text after value", source, number, i + 2);
                }
                return sb.toString();
            }
            if (c == '\\') {
                if (i + 1 >= text.length()) {
                    break;
                }
                final char escaped = text.charAt(i + 1);
                switch (escaped) {
                    case '"', '\\' -> sb.append(escaped);
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    default -> throw new TreeFormatException("Invalid escape '\\" + escaped + "'", source, number, i + 1);
                }
                i += 2;
                continue;
            }
            sb.append(c);
            i++;
        }
        throw new TreeFormatException("Unterminated value", source, number, text.length() + 1);
    }
}
