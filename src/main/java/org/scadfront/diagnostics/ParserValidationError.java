package org.scadfront.diagnostics;

/**
 * Invalid arguments, modifiers or parameters.
 */
public class ParserValidationError extends ParserError {

    public ParserValidationError(String message) {
        this(message, null);
    }

    public ParserValidationError(String message, ErrorContext context) {
        super(message, ErrorCode.VALIDATION_ERROR, Severity.ERROR, context);
    }
}
