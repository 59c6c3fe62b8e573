package org.scadfront.frontend.ast;

import java.util.List;

/**
 * A prefix operation such as {@code -x} or {@code !flag}.
 *
 * @param operator The operator.
 * @param operand  The operand.
 * @param location The source span.
 */
public record UnaryExpression(UnaryOperator operator, ExpressionNode operand, SourceSpan location)
        implements ExpressionNode {

    @Override
    public ExpressionType expressionType() {
        return ExpressionType.UNARY;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(operand);
    }
}
