package org.scadfront.diagnostics.logging;

import org.scadfront.diagnostics.Severity;

import java.util.Objects;

/**
 * Severity-filtered logger owned by one {@link org.scadfront.diagnostics.ErrorHandler}.
 *
 * <p>A message is emitted only when the logger is enabled and the message severity is at or above
 * the current level. Suppressed messages are never formatted.</p>
 */
public class ParserLogger {

    private final LogFormatter formatter;
    private final LogSink sink;
    private Severity level;
    private boolean enabled;

    public ParserLogger() {
        this(LoggerOptions.defaults());
    }

    public ParserLogger(LoggerOptions options) {
        this(options, new DefaultLogFormatter(options.includeTimestamp(), options.includeSeverity()));
    }

    /**
     * @param options   Level, enable flag and sink; the prefix flags are ignored in favour of the formatter.
     * @param formatter The line formatter.
     */
    public ParserLogger(LoggerOptions options, LogFormatter formatter) {
        this.level = Objects.requireNonNull(options.level(), "level");
        this.enabled = options.enabled();
        this.sink = Objects.requireNonNull(options.sink(), "sink");
        this.formatter = Objects.requireNonNull(formatter, "formatter");
    }

    public void setLevel(Severity level) {
        this.level = Objects.requireNonNull(level, "level");
    }

    public Severity getLevel() {
        return level;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * @param severity The severity to test.
     * @return True if a message at this severity would be emitted.
     */
    public boolean isLoggable(Severity severity) {
        return enabled && severity.isAtLeast(level);
    }

    public void log(Severity severity, String message) {
        if (!isLoggable(severity)) {
            return;
        }
        sink.write(severity, formatter.format(severity, message));
    }

    public void debug(String message) {
        log(Severity.DEBUG, message);
    }

    public void info(String message) {
        log(Severity.INFO, message);
    }

    public void warn(String message) {
        log(Severity.WARNING, message);
    }

    public void error(String message) {
        log(Severity.ERROR, message);
    }

    public void fatal(String message) {
        log(Severity.FATAL, message);
    }
}
