package org.scadfront.frontend.ast;

/**
 * A reference to a named variable, including special variables such as {@code $fn}.
 *
 * @param name     The referenced name.
 * @param location The source span.
 */
public record VariableExpression(String name, SourceSpan location) implements ExpressionNode {

    @Override
    public ExpressionType expressionType() {
        return ExpressionType.VARIABLE;
    }
}
