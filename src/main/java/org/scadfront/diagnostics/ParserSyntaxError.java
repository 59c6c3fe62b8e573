package org.scadfront.diagnostics;

/**
 * Malformed source, such as a missing semicolon or an unclosed bracket.
 */
public class ParserSyntaxError extends ParserError {

    public ParserSyntaxError(String message) {
        this(message, null);
    }

    public ParserSyntaxError(String message, ErrorContext context) {
        super(message, ErrorCode.SYNTAX_ERROR, Severity.ERROR, context);
    }
}
