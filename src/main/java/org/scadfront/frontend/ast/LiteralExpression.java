package org.scadfront.frontend.ast;

/**
 * A constant: number, boolean, string or {@code undef}.
 *
 * @param value    The constant.
 * @param location The source span.
 */
public record LiteralExpression(LiteralValue value, SourceSpan location) implements ExpressionNode {

    @Override
    public ExpressionType expressionType() {
        return ExpressionType.LITERAL;
    }
}
