package org.scadfront.diagnostics;

/**
 * Error categories, one per numeric band of {@link ErrorCode}.
 */
public enum ErrorCategory {
    /** Codes 100-199. */
    SYNTAX,
    /** Codes 200-299. */
    TYPE,
    /** Codes 300-399. */
    REFERENCE,
    /** Codes 400-499. */
    VALIDATION,
    /** Codes 500-599, raised while building AST nodes. */
    SEMANTIC,
    /** Codes 900-999. */
    INTERNAL;

    static ErrorCategory forNumber(int number) {
        if (number >= 900) {
            return INTERNAL;
        }
        return switch (number / 100) {
            case 1 -> SYNTAX;
            case 2 -> TYPE;
            case 3 -> REFERENCE;
            case 4 -> VALIDATION;
            case 5 -> SEMANTIC;
            default -> INTERNAL;
        };
    }
}
