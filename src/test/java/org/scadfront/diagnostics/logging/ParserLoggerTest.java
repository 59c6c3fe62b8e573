package org.scadfront.diagnostics.logging;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.scadfront.diagnostics.CapturingLogSink;
import org.scadfront.diagnostics.Severity;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

public class ParserLoggerTest {

    @Test
    @Tag("unit")
    void suppressesMessagesBelowLevel() {
        CapturingLogSink sink = new CapturingLogSink();
        ParserLogger logger = new ParserLogger(LoggerOptions.builder()
                .level(Severity.WARNING)
                .includeTimestamp(false)
                .sink(sink)
                .build());

        logger.debug("d");
        logger.info("i");
        logger.warn("w");
        logger.error("e");
        logger.fatal("f");

        assertThat(sink.lines).containsExactly("[WARNING] w", "[ERROR] e", "[FATAL] f");
        assertThat(sink.severities).containsExactly(Severity.WARNING, Severity.ERROR, Severity.FATAL);
    }

    @Test
    @Tag("unit")
    void disabledLoggerEmitsNothing() {
        CapturingLogSink sink = new CapturingLogSink();
        ParserLogger logger = new ParserLogger(LoggerOptions.builder().enabled(false).sink(sink).build());

        logger.error("e");
        assertThat(sink.lines).isEmpty();

        logger.setEnabled(true);
        logger.setLevel(Severity.DEBUG);
        logger.debug("now visible");
        assertThat(sink.lines).hasSize(1);
        assertThat(logger.isLoggable(Severity.DEBUG)).isTrue();
    }

    @Test
    @Tag("unit")
    void formatsTimestampAndSeverity() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-01T12:30:45.123Z"), ZoneOffset.UTC);

        assertThat(new DefaultLogFormatter(true, true, clock).format(Severity.INFO, "hello"))
                .isEqualTo("[2024-03-01T12:30:45.123Z] [INFO] hello");
        assertThat(new DefaultLogFormatter(false, false, clock).format(Severity.INFO, "hello"))
                .isEqualTo("hello");
    }

    @Test
    @Tag("unit")
    void customFormatterReplacesDefault() {
        CapturingLogSink sink = new CapturingLogSink();
        ParserLogger logger = new ParserLogger(LoggerOptions.builder().sink(sink).build(),
                (severity, message) -> severity.level() + ":" + message);

        logger.info("x");

        assertThat(sink.lines).containsExactly("1:x");
    }

    @Test
    @Tag("unit")
    void readsOptionsFromConfig() {
        Config config = ConfigFactory.parseString("level = debug, enabled = false, include-severity = false");

        LoggerOptions options = LoggerOptions.fromConfig(config);

        assertThat(options.level()).isEqualTo(Severity.DEBUG);
        assertThat(options.enabled()).isFalse();
        assertThat(options.includeTimestamp()).isTrue();
        assertThat(options.includeSeverity()).isFalse();
        assertThat(options.sink()).isInstanceOf(Slf4jLogSink.class);
    }
}
