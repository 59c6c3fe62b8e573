package org.scadfront.frontend.ast;

import java.util.List;

/**
 * The ternary {@code condition ? thenBranch : elseBranch}.
 *
 * @param condition  The tested expression.
 * @param thenBranch Value when the condition holds.
 * @param elseBranch Value otherwise.
 * @param location   The source span.
 */
public record ConditionalExpression(
        ExpressionNode condition,
        ExpressionNode thenBranch,
        ExpressionNode elseBranch,
        SourceSpan location
) implements ExpressionNode {

    @Override
    public ExpressionType expressionType() {
        return ExpressionType.CONDITIONAL;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(condition, thenBranch, elseBranch);
    }
}
