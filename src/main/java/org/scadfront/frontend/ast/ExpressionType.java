package org.scadfront.frontend.ast;

/**
 * Secondary tag carried by every {@link ExpressionNode}.
 */
public enum ExpressionType {
    LITERAL("literal"),
    VARIABLE("variable"),
    BINARY("binary"),
    UNARY("unary"),
    CONDITIONAL("conditional"),
    ARRAY("array"),
    FUNCTION_CALL("function_call"),
    RANGE("range"),
    INDEX("index"),
    MEMBER_ACCESS("member_access"),
    LET("let"),
    LIST_COMPREHENSION("list_comprehension");

    private final String tag;

    ExpressionType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
