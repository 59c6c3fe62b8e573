package org.scadfront.diagnostics;

import com.typesafe.config.Config;
import org.scadfront.diagnostics.logging.LoggerOptions;

import java.util.Locale;

/**
 * Settings for an {@link ErrorHandler}.
 *
 * @param throwErrors     Re-throw errors of severity ERROR or FATAL from {@code report}.
 * @param minSeverity     Minimum severity an error needs to be collected.
 * @param includeSource   Append the context source snippet to logged diagnostics.
 * @param attemptRecovery Enable automatic recovery attempts.
 * @param loggerOptions   Settings for the handler's logger.
 */
public record ErrorHandlerOptions(
        boolean throwErrors,
        Severity minSeverity,
        boolean includeSource,
        boolean attemptRecovery,
        LoggerOptions loggerOptions
) {

    /**
     * @return Throwing on, threshold ERROR, source on, recovery off, default logger.
     */
    public static ErrorHandlerOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the {@code scadfront.error-handler} block shape: {@code throw-errors}, {@code min-severity},
     * {@code include-source}, {@code attempt-recovery} and a nested {@code logger} block.
     * Missing keys keep their defaults.
     *
     * @param config The error-handler block.
     * @return The options.
     * @throws IllegalArgumentException if {@code min-severity} is not a severity name.
     */
    public static ErrorHandlerOptions fromConfig(Config config) {
        Builder builder = builder();
        if (config.hasPath("throw-errors")) {
            builder.throwErrors(config.getBoolean("throw-errors"));
        }
        if (config.hasPath("min-severity")) {
            builder.minSeverity(Severity.valueOf(config.getString("min-severity").trim().toUpperCase(Locale.ROOT)));
        }
        if (config.hasPath("include-source")) {
            builder.includeSource(config.getBoolean("include-source"));
        }
        if (config.hasPath("attempt-recovery")) {
            builder.attemptRecovery(config.getBoolean("attempt-recovery"));
        }
        if (config.hasPath("logger")) {
            builder.loggerOptions(LoggerOptions.fromConfig(config.getConfig("logger")));
        }
        return builder.build();
    }

    public static final class Builder {
        private boolean throwErrors = true;
        private Severity minSeverity = Severity.ERROR;
        private boolean includeSource = true;
        private boolean attemptRecovery = false;
        private LoggerOptions loggerOptions;

        private Builder() {
        }

        public Builder throwErrors(boolean throwErrors) {
            this.throwErrors = throwErrors;
            return this;
        }

        public Builder minSeverity(Severity minSeverity) {
            this.minSeverity = minSeverity;
            return this;
        }

        public Builder includeSource(boolean includeSource) {
            this.includeSource = includeSource;
            return this;
        }

        public Builder attemptRecovery(boolean attemptRecovery) {
            this.attemptRecovery = attemptRecovery;
            return this;
        }

        public Builder loggerOptions(LoggerOptions loggerOptions) {
            this.loggerOptions = loggerOptions;
            return this;
        }

        public ErrorHandlerOptions build() {
            return new ErrorHandlerOptions(throwErrors, minSeverity, includeSource, attemptRecovery,
                    loggerOptions != null ? loggerOptions : LoggerOptions.defaults());
        }
    }
}
