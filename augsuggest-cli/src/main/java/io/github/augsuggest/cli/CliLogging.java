package io.github.augsuggest.cli;

import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/// Console logging for the command line: one stderr handler, one line per record.
final class CliLogging {

    static final String BASE_LOGGER = "io.github.augsuggest";

    // held so the configured level survives garbage collection of the logger
    private static final Logger BASE = Logger.getLogger(BASE_LOGGER);

    private CliLogging() {}

    /// Replaces the root handlers with a console handler and sets the level of the
    /// `io.github.augsuggest` loggers: `FINER` when debugging, else `WARNING`.
    static void configure(boolean debug) {
        final Logger rootLogger = Logger.getLogger("");
        for (var handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }

        final ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(Level.ALL);
        consoleHandler.setFormatter(new SimpleFormatter() {
            @Override
            public synchronized String format(LogRecord record) {
                return String.format("[%s] %s - %s%n",
                    record.getLevel().getName(),
                    record.getLoggerName(),
                    formatMessage(record)
                );
            }
        });
        rootLogger.addHandler(consoleHandler);
        BASE.setLevel(debug ? Level.FINER : Level.WARNING);
    }

    static Level level() {
        return BASE.getLevel();
    }
}
