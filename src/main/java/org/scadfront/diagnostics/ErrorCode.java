package org.scadfront.diagnostics;

/**
 * Closed set of diagnostic codes. The wire form is {@code E} followed by the number; the hundreds
 * digit selects the {@link ErrorCategory}.
 */
public enum ErrorCode {
    // Syntax
    SYNTAX_ERROR(100),
    UNEXPECTED_TOKEN(101),
    MISSING_SEMICOLON(102),
    UNCLOSED_BRACKET(103),
    UNCLOSED_BRACE(104),
    UNCLOSED_PAREN(105),
    INVALID_CHARACTER(106),
    MISSING_FUNCTION_NAME(107),
    UNEXPECTED_EOF(108),
    UNEXPECTED_NODE_TYPE_FOR_FUNCTION_CALL(109),
    INVALID_ESCAPE_SEQUENCE(110),

    // Type
    TYPE_ERROR(200),
    TYPE_MISMATCH(201),
    INVALID_OPERATION(202),
    INVALID_TYPE(203),
    INVALID_FUNCTION_CALL_ARGUMENT_TYPE(209),
    RESERVED_KEYWORD_AS_EXPRESSION(210),

    // Reference
    REFERENCE_ERROR(300),
    UNDEFINED_VARIABLE(301),
    UNDEFINED_MODULE(302),
    UNDEFINED_FUNCTION(303),
    MISSING_MODULE_NAME(304),

    // Validation
    VALIDATION_ERROR(400),
    INVALID_ARGUMENTS(401),
    INVALID_MODIFIER(402),

    // AST construction
    LET_NO_ASSIGNMENTS_FOUND(500),
    LET_ASSIGNMENT_PROCESSING_FAILED(501),
    LET_ASSIGNMENT_VALUE_ERROR_PROPAGATED(502),
    MISSING_LET_BODY(503),
    LET_BODY_EXPRESSION_PARSE_FAILED(504),
    LET_BODY_EXPRESSION_ERROR_PROPAGATED(505),

    // Internal
    INTERNAL_ERROR(900),
    NOT_IMPLEMENTED(901);

    private final int number;

    ErrorCode(int number) {
        this.number = number;
    }

    public int number() {
        return number;
    }

    /**
     * @return The wire form, e.g. {@code E102}.
     */
    public String code() {
        return "E" + number;
    }

    public ErrorCategory category() {
        return ErrorCategory.forNumber(number);
    }

    /**
     * Looks up a code by its wire form.
     * @param code The wire form, e.g. {@code E102}.
     * @return The matching code.
     * @throws IllegalArgumentException if no code has that wire form.
     */
    public static ErrorCode fromCode(String code) {
        for (ErrorCode value : values()) {
            if (value.code().equals(code)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown error code: " + code);
    }
}
