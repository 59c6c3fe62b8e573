package org.scadfront.diagnostics.logging;

import org.scadfront.diagnostics.Severity;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Formats lines as {@code [timestamp] [SEVERITY] message}, with each bracketed part optional.
 * Timestamps are ISO-8601 in UTC with millisecond precision.
 */
public class DefaultLogFormatter implements LogFormatter {

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private final boolean includeTimestamp;
    private final boolean includeSeverity;
    private final Clock clock;

    public DefaultLogFormatter(boolean includeTimestamp, boolean includeSeverity) {
        this(includeTimestamp, includeSeverity, Clock.systemUTC());
    }

    /**
     * @param includeTimestamp Prefix each line with the current time.
     * @param includeSeverity  Prefix each line with the bracketed severity name.
     * @param clock            Time source for timestamps.
     */
    public DefaultLogFormatter(boolean includeTimestamp, boolean includeSeverity, Clock clock) {
        this.includeTimestamp = includeTimestamp;
        this.includeSeverity = includeSeverity;
        this.clock = clock;
    }

    @Override
    public String format(Severity severity, String message) {
        StringBuilder sb = new StringBuilder();
        if (includeTimestamp) {
            sb.append('[').append(TIMESTAMP.format(clock.instant())).append("] ");
        }
        if (includeSeverity) {
            sb.append('[').append(severity.name()).append("] ");
        }
        return sb.append(message).toString();
    }
}
