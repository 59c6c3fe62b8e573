package org.scadfront.diagnostics.logging;

import org.scadfront.diagnostics.Severity;

/**
 * Destination for formatted log lines.
 */
@FunctionalInterface
public interface LogSink {

    /**
     * @param severity         The severity of the message, for sinks that route by level.
     * @param formattedMessage The fully formatted line.
     */
    void write(Severity severity, String formattedMessage);
}
