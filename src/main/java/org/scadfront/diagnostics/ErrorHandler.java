package org.scadfront.diagnostics;

import org.scadfront.diagnostics.logging.ParserLogger;
import org.scadfront.recovery.RecoveryStrategyRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Collects, logs and optionally re-throws parser errors, and delegates recovery attempts to its
 * {@link RecoveryStrategyRegistry}.
 *
 * <p>Each handler owns its error list, logger and registry; nothing is shared between handlers.
 * Not thread-safe.</p>
 */
public class ErrorHandler {

    private final ErrorHandlerOptions options;
    private final ParserLogger logger;
    private final RecoveryStrategyRegistry recoveryRegistry;
    private final List<ParserError> errors = new ArrayList<>();

    public ErrorHandler() {
        this(ErrorHandlerOptions.defaults());
    }

    public ErrorHandler(ErrorHandlerOptions options) {
        this(options, new ParserLogger(options.loggerOptions()), new RecoveryStrategyRegistry());
    }

    /**
     * @param options          Handler settings.
     * @param logger           The logger diagnostics are written to.
     * @param recoveryRegistry The strategies used by {@link #attemptRecovery}.
     */
    public ErrorHandler(ErrorHandlerOptions options, ParserLogger logger, RecoveryStrategyRegistry recoveryRegistry) {
        this.options = Objects.requireNonNull(options, "options");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.recoveryRegistry = Objects.requireNonNull(recoveryRegistry, "recoveryRegistry");
    }

    public ErrorHandlerOptions getOptions() {
        return options;
    }

    // Factories

    /**
     * Creates a generic error with code {@link ErrorCode#INTERNAL_ERROR} at severity ERROR.
     */
    public ParserError createParserError(String message, ErrorContext context) {
        return new ParserError(message, ErrorCode.INTERNAL_ERROR, Severity.ERROR, context);
    }

    public ParserError createParserError(String message, ErrorCode code, Severity severity, ErrorContext context) {
        return new ParserError(message, code, severity, context);
    }

    public ParserSyntaxError createSyntaxError(String message, ErrorContext context) {
        return new ParserSyntaxError(message, context);
    }

    public ParserTypeError createTypeError(String message, ErrorContext context) {
        return new ParserTypeError(message, context);
    }

    public ParserValidationError createValidationError(String message, ErrorContext context) {
        return new ParserValidationError(message, context);
    }

    public ParserReferenceError createReferenceError(String message, ErrorContext context) {
        return new ParserReferenceError(message, context);
    }

    public ParserInternalError createInternalError(String message, ErrorContext context) {
        return new ParserInternalError(message, context);
    }

    // Reporting

    /**
     * Records an error. It is collected if its severity reaches {@code minSeverity}, always handed to
     * the logger (which applies its own level), and re-thrown afterwards when {@code throwErrors} is
     * set and the severity is ERROR or FATAL.
     *
     * @param error The error.
     * @throws ParserError the reported error itself, when it is re-thrown.
     */
    public void report(ParserError error) {
        if (error.getSeverity().isAtLeast(options.minSeverity())) {
            errors.add(error);
        }
        logger.log(error.getSeverity(), logLine(error));
        if (options.throwErrors() && isCritical(error)) {
            throw error;
        }
    }

    /**
     * Asks the registry for a corrected source. Does nothing unless recovery is enabled.
     *
     * @param error The error to recover from.
     * @param code  The source text.
     * @return The candidate corrected source, or null. The caller must re-parse to confirm the fix.
     */
    public String attemptRecovery(ParserError error, String code) {
        if (!options.attemptRecovery()) {
            return null;
        }
        logger.debug("Attempting recovery for error: " + error.getMessage());
        String recovered = recoveryRegistry.attemptRecovery(error, code);
        if (recovered != null) {
            logger.info("Successfully recovered from error: " + error.getMessage());
        } else {
            logger.debug("Could not recover from error: " + error.getMessage());
        }
        return recovered;
    }

    /**
     * @return Suggestions from every strategy that can handle the error.
     */
    public List<String> getRecoverySuggestions(ParserError error) {
        return recoveryRegistry.getRecoverySuggestions(error);
    }

    /**
     * @return The collected errors in report order, as an unmodifiable snapshot.
     */
    public List<ParserError> getErrors() {
        return Collections.unmodifiableList(new ArrayList<>(errors));
    }

    /**
     * @param minSeverity Inclusive lower bound.
     * @return Collected errors at or above the bound, in report order.
     */
    public List<ParserError> getErrorsBySeverity(Severity minSeverity) {
        List<ParserError> result = new ArrayList<>();
        for (ParserError error : errors) {
            if (error.getSeverity().isAtLeast(minSeverity)) {
                result.add(error);
            }
        }
        return result;
    }

    /**
     * Empties the collected list. Logger and registry are left as they are.
     */
    public void clearErrors() {
        errors.clear();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * @return True if any collected error is ERROR or FATAL.
     */
    public boolean hasCriticalErrors() {
        for (ParserError error : errors) {
            if (isCritical(error)) {
                return true;
            }
        }
        return false;
    }

    public RecoveryStrategyRegistry getRecoveryRegistry() {
        return recoveryRegistry;
    }

    public ParserLogger getLogger() {
        return logger;
    }

    // Plain messages

    public void logDebug(String message) {
        logger.debug(message);
    }

    public void logInfo(String message) {
        logger.info(message);
    }

    public void logWarning(String message) {
        logger.warn(message);
    }

    public void logError(String message) {
        logger.error(message);
    }

    /**
     * Logs an unexpected exception at ERROR without collecting it.
     * @param throwable The exception.
     * @param context   A prefix naming where it happened, or null.
     */
    public void handleError(Throwable throwable, String context) {
        String message = context != null && !context.isEmpty()
                ? context + ": " + throwable.getMessage()
                : throwable.getMessage();
        logger.error(message);
    }

    private String logLine(ParserError error) {
        String line = error.getFormattedMessage();
        String source = error.getContext().getSource();
        if (options.includeSource() && source != null && !source.isEmpty()) {
            return line + "\n" + source;
        }
        return line;
    }

    private static boolean isCritical(ParserError error) {
        return error.getSeverity().isAtLeast(Severity.ERROR);
    }
}
