package org.scadfront.diagnostics;

import org.scadfront.diagnostics.logging.LogSink;

import java.util.ArrayList;
import java.util.List;

/**
 * Records every line it receives, for assertions on logger output.
 */
public class CapturingLogSink implements LogSink {

    public final List<String> lines = new ArrayList<>();
    public final List<Severity> severities = new ArrayList<>();

    @Override
    public void write(Severity severity, String formattedMessage) {
        severities.add(severity);
        lines.add(formattedMessage);
    }
}
