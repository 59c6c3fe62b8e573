package org.scadfront.diagnostics;

/**
 * An operation applied to values of incompatible types.
 */
public class ParserTypeError extends ParserError {

    public ParserTypeError(String message) {
        this(message, null);
    }

    public ParserTypeError(String message, ErrorContext context) {
        super(message, ErrorCode.TYPE_ERROR, Severity.ERROR, context);
    }
}
