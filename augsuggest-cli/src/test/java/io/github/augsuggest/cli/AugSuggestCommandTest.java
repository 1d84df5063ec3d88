package io.github.augsuggest.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;

import static org.assertj.core.api.Assertions.assertThat;

class AugSuggestCommandTest extends CliTestBase {

    private record Run(int exitCode, String out, String err) {}

    private static Run run(InputStream stdin, String... args) {
        final var out = new StringWriter();
        final var err = new StringWriter();
        final var commandLine = new CommandLine(new AugSuggestCommand(stdin));
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        final int exitCode = commandLine.execute(args);
        return new Run(exitCode, out.toString(), err.toString());
    }

    private static Run run(String... args) {
        return run(stdin(""), args);
    }

    private static InputStream stdin(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    private static Path dump(Path dir) throws IOException {
        final var file = dir.resolve("hosts.dump");
        Files.writeString(file, HOSTS_DUMP, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void printsScriptForDumpFile(@TempDir Path dir) throws IOException {
        final var result = run(dump(dir).toString());

        assertThat(result.exitCode()).isZero();
        assertThat(result.out()).isEqualTo("""
                set /files/etc/hosts/seq::*[canonical='localhost']/ipaddr '127.0.0.1'
                set /files/etc/hosts/seq::*[canonical='localhost' or count(canonical)=0]/canonical 'localhost'
                set /files/etc/hosts/seq::*[canonical='other']/ipaddr '127.0.0.1'
                set /files/etc/hosts/seq::*[canonical='other' or count(canonical)=0]/canonical 'other'
                """);
    }

    @Test
    void readsStandardInputByDefault() {
        final var implicit = run(stdin(HOSTS_DUMP));
        final var explicit = run(stdin(HOSTS_DUMP), "-");

        assertThat(implicit.exitCode()).isZero();
        assertThat(implicit.out()).startsWith("set /files/etc/hosts/seq::*[canonical='localhost']/ipaddr");
        assertThat(explicit.out()).isEqualTo(implicit.out());
    }

    @Test
    void lastWildcardFlagWins() {
        assertThat(run(stdin(HOSTS_DUMP), "--noseq").out()).startsWith("set /files/etc/hosts/*[");
        assertThat(run(stdin(HOSTS_DUMP), "--noseq", "--seq").out()).startsWith("set /files/etc/hosts/seq::*[");
        assertThat(run(stdin(HOSTS_DUMP), "-S", "-s").out()).startsWith("set /files/etc/hosts/*[");
    }

    @Test
    void regexpWithoutLengthUsesDefault(@TempDir Path dir) throws IOException {
        final var result = run(dump(dir).toString(), "--regexp");

        assertThat(result.exitCode()).isZero();
        assertThat(result.out()).startsWith(
                "set /files/etc/hosts/seq::*[canonical=~regexp('localhost')]/ipaddr '127.0.0.1'\n");
    }

    @Test
    void regexpWithExplicitLength() {
        final var result = run(stdin(HOSTS_DUMP), "--regexp=2");

        assertThat(result.exitCode()).isZero();
        assertThat(result.out()).startsWith("set /files/etc/hosts/seq::*[canonical=~regexp('loc.*')]/ipaddr");
    }

    @Test
    void prettyAndVerboseShapeTheOutput() {
        final var result = run(stdin(HOSTS_DUMP), "--pretty", "--verbose");

        assertThat(result.exitCode()).isZero();
        assertThat(result.out().split("\n", -1)).containsExactly(
                "#   /files/etc/hosts/1",
                "#   /files/etc/hosts/1/ipaddr  '127.0.0.1'",
                "set /files/etc/hosts/seq::*[canonical='localhost']/ipaddr '127.0.0.1'",
                "#   /files/etc/hosts/1/canonical  'localhost'",
                "set /files/etc/hosts/seq::*[canonical='localhost' or count(canonical)=0]/canonical 'localhost'",
                "",
                "#   /files/etc/hosts/2",
                "#   /files/etc/hosts/2/ipaddr  '127.0.0.1'",
                "set /files/etc/hosts/seq::*[canonical='other'    ]/ipaddr '127.0.0.1'",
                "#   /files/etc/hosts/2/canonical  'other'",
                "set /files/etc/hosts/seq::*[canonical='other'     or count(canonical)=0]/canonical 'other'",
                "");
    }

    @Test
    void missingFileFailsWithRuntimeError(@TempDir Path dir) {
        final var missing = dir.resolve("missing.dump").toString();

        final var result = run(missing);

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err()).contains("Failed to read " + missing);
        assertThat(result.out()).isEmpty();
    }

    @Test
    void malformedDumpFailsWithPosition() {
        final var result = run(stdin("/a = \"1\"\n/b = \"2\n"));

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err()).contains("Unterminated value at line 2");
    }

    @Test
    void usageErrorsExitWithTwo() {
        assertThat(run("--no-such-option").exitCode()).isEqualTo(2);
        assertThat(run("--regexp=-1").exitCode()).isEqualTo(2);
        assertThat(run("--regexp=lots").exitCode()).isEqualTo(2);
    }

    @Test
    void versionAndHelp() {
        final var version = run("--version");
        assertThat(version.exitCode()).isZero();
        assertThat(version.out()).contains("augsuggest 0.1.0");

        final var help = run("--help");
        assertThat(help.exitCode()).isZero();
        assertThat(help.out()).contains("--pretty", "--regexp", "--noseq", "--seq", "DUMP");
    }

    @Test
    void debugLowersTheLogLevel() {
        assertThat(run(stdin(HOSTS_DUMP), "--debug").exitCode()).isZero();
        assertThat(CliLogging.level()).isEqualTo(Level.FINER);

        assertThat(run(stdin(HOSTS_DUMP)).exitCode()).isZero();
        assertThat(CliLogging.level()).isEqualTo(Level.WARNING);
    }
}
