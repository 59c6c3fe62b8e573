package org.scadfront.diagnostics;

/**
 * A failure inside the parser itself. Always fatal; the context points users at the issue tracker.
 */
public class ParserInternalError extends ParserError {

    /** Where internal failures should be reported. */
    public static final String HELP_URL = "https://github.com/scadfront/scadfront/issues";

    public ParserInternalError(String message) {
        this(message, null);
    }

    public ParserInternalError(String message, ErrorContext context) {
        super(message, ErrorCode.INTERNAL_ERROR, Severity.FATAL, withHelpUrl(context));
    }

    private static ErrorContext withHelpUrl(ErrorContext context) {
        ErrorContext result = context != null ? context : new ErrorContext();
        result.setHelpUrl(HELP_URL);
        return result;
    }
}
