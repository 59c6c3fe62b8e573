package org.scadfront.diagnostics;

/**
 * A reference to an undefined variable, function or module.
 */
public class ParserReferenceError extends ParserError {

    public ParserReferenceError(String message) {
        this(message, null);
    }

    public ParserReferenceError(String message, ErrorContext context) {
        super(message, ErrorCode.REFERENCE_ERROR, Severity.ERROR, context);
    }
}
