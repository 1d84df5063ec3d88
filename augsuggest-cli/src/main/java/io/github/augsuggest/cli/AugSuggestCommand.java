package io.github.augsuggest.cli;

import io.github.augsuggest.core.PathSuggester;
import io.github.augsuggest.core.SuggestOptions;
import io.github.augsuggest.core.TreeProvider;
import io.github.augsuggest.core.WildcardStyle;
import picocli.CommandLine;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.logging.Logger;

/// Command line entry point: reads an `augtool print` dump and prints the suggested `set` script.
///
/// Usage:
/// `augtool print /files/etc/hosts | java -jar augsuggest-cli.jar --pretty`
@CommandLine.Command(name = "augsuggest",
        description = "Rewrites the positional paths of an augtool print dump into paths that select nodes by value",
        version = "augsuggest 0.1.0",
        mixinStandardHelpOptions = true)
public class AugSuggestCommand implements Callable<Integer> {

    private static final Logger LOG = Logger.getLogger(AugSuggestCommand.class.getName());

    static final String STDIN = "-";

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"-p", "--pretty"}, description = "Align predicate values and separate groups with blank lines")
    private boolean pretty;

    @CommandLine.Option(names = {"-r", "--regexp"}, arity = "0..1", paramLabel = "N", defaultValue = "0", fallbackValue = "8",
            description = "Use regexp() predicates of at least N literal characters (default when given: ${FALLBACK-VALUE})")
    private int regexp;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Echo every input leaf as a comment before its set line")
    private boolean verbose;

    @CommandLine.Option(names = {"-d", "--debug"}, description = "Trace the selection passes on stderr")
    private boolean debug;

    @CommandLine.Parameters(index = "0", arity = "0..1", paramLabel = "DUMP", defaultValue = STDIN,
            description = "augtool print output to read, or - for standard input (default)")
    private String dump;

    private WildcardStyle wildcard = WildcardStyle.SEQUENCE;

    private final InputStream stdin;

    public AugSuggestCommand() {
        this(System.in);
    }

    AugSuggestCommand(InputStream stdin) {
        this.stdin = Objects.requireNonNull(stdin, "stdin must not be null");
    }

    @CommandLine.Option(names = {"-s", "--noseq"}, description = "Use '*' instead of 'seq::*' for numeric positions")
    void noseq(boolean enabled) {
        if (enabled) {
            wildcard = WildcardStyle.PLAIN;
        }
    }

    @CommandLine.Option(names = {"-S", "--seq"}, description = "Use 'seq::*' for numeric positions (default)")
    void seq(boolean enabled) {
        if (enabled) {
            wildcard = WildcardStyle.SEQUENCE;
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new AugSuggestCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        CliLogging.configure(debug);
        if (regexp < 0) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--regexp must not be negative: " + regexp);
        }
        final var options = new SuggestOptions(pretty, regexp, wildcard, verbose);
        final var out = spec.commandLine().getOut();
        final var err = spec.commandLine().getErr();
        try {
            final var result = new PathSuggester(options).suggest(provider());
            out.print(result.script());
            out.flush();
            if (!result.diagnostics().isEmpty()) {
                LOG.fine(() -> result.diagnostics().size() + " positions rendered without a predicate");
            }
            return 0;
        } catch (IOException e) {
            err.println("Failed to read " + dump + ": " + e.getMessage());
            return 1;
        } catch (TreeFormatException e) {
            err.println(e.getMessage());
            return 1;
        } catch (OutOfMemoryError e) {
            err.println("Out of memory");
            return 1;
        }
    }

    private TreeProvider provider() {
        if (STDIN.equals(dump)) {
            return PrintDumpTreeProvider.ofReader(new InputStreamReader(stdin, StandardCharsets.UTF_8), "<stdin>");
        }
        return PrintDumpTreeProvider.ofFile(Path.of(dump));
    }
}
