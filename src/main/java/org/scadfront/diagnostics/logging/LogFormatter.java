package org.scadfront.diagnostics.logging;

import org.scadfront.diagnostics.Severity;

/**
 * Turns a message into the line handed to a {@link LogSink}.
 */
@FunctionalInterface
public interface LogFormatter {

    String format(Severity severity, String message);
}
