package org.scadfront.diagnostics.logging;

import com.typesafe.config.Config;
import org.scadfront.diagnostics.Severity;

import java.util.Locale;

/**
 * Settings for a {@link ParserLogger}.
 *
 * @param level            Minimum severity that is emitted.
 * @param enabled          Master switch; when off nothing is emitted.
 * @param includeTimestamp Prefix lines with an ISO-8601 timestamp.
 * @param includeSeverity  Prefix lines with the bracketed severity.
 * @param sink             Output destination.
 */
public record LoggerOptions(
        Severity level,
        boolean enabled,
        boolean includeTimestamp,
        boolean includeSeverity,
        LogSink sink
) {

    /**
     * @return Options with level INFO, enabled, both prefixes on and the SLF4J sink.
     */
    public static LoggerOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads options from a config block with the keys {@code level}, {@code enabled},
     * {@code include-timestamp} and {@code include-severity}. Missing keys keep their defaults.
     *
     * @param config The logger block.
     * @return The options, writing to the SLF4J sink.
     * @throws IllegalArgumentException if {@code level} is not a severity name.
     */
    public static LoggerOptions fromConfig(Config config) {
        Builder builder = builder();
        if (config.hasPath("level")) {
            builder.level(Severity.valueOf(config.getString("level").trim().toUpperCase(Locale.ROOT)));
        }
        if (config.hasPath("enabled")) {
            builder.enabled(config.getBoolean("enabled"));
        }
        if (config.hasPath("include-timestamp")) {
            builder.includeTimestamp(config.getBoolean("include-timestamp"));
        }
        if (config.hasPath("include-severity")) {
            builder.includeSeverity(config.getBoolean("include-severity"));
        }
        return builder.build();
    }

    /**
     * @param sink The new sink.
     * @return A copy writing to the given sink.
     */
    public LoggerOptions withSink(LogSink sink) {
        return new LoggerOptions(level, enabled, includeTimestamp, includeSeverity, sink);
    }

    public static final class Builder {
        private Severity level = Severity.INFO;
        private boolean enabled = true;
        private boolean includeTimestamp = true;
        private boolean includeSeverity = true;
        private LogSink sink;

        private Builder() {
        }

        public Builder level(Severity level) {
            this.level = level;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder includeTimestamp(boolean includeTimestamp) {
            this.includeTimestamp = includeTimestamp;
            return this;
        }

        public Builder includeSeverity(boolean includeSeverity) {
            this.includeSeverity = includeSeverity;
            return this;
        }

        public Builder sink(LogSink sink) {
            this.sink = sink;
            return this;
        }

        public LoggerOptions build() {
            return new LoggerOptions(level, enabled, includeTimestamp, includeSeverity,
                    sink != null ? sink : new Slf4jLogSink());
        }
    }
}
