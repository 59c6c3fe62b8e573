package org.scadfront.diagnostics.logging;

import org.scadfront.diagnostics.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default sink: forwards lines to SLF4J at the matching level. {@link Severity#FATAL} maps to error.
 */
public class Slf4jLogSink implements LogSink {

    private final Logger log;

    public Slf4jLogSink() {
        this(LoggerFactory.getLogger(ParserLogger.class));
    }

    public Slf4jLogSink(Logger log) {
        this.log = log;
    }

    @Override
    public void write(Severity severity, String formattedMessage) {
        switch (severity) {
            case DEBUG -> log.debug(formattedMessage);
            case INFO -> log.info(formattedMessage);
            case WARNING -> log.warn(formattedMessage);
            case ERROR, FATAL -> log.error(formattedMessage);
        }
    }
}
