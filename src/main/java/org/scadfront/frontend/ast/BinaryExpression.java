package org.scadfront.frontend.ast;

import java.util.List;

/**
 * A binary operation.
 *
 * @param operator The operator.
 * @param left     The left operand.
 * @param right    The right operand.
 * @param location The source span.
 */
public record BinaryExpression(
        BinaryOperator operator,
        ExpressionNode left,
        ExpressionNode right,
        SourceSpan location
) implements ExpressionNode {

    @Override
    public ExpressionType expressionType() {
        return ExpressionType.BINARY;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }
}
