package org.scadfront.frontend.ast;

/**
 * An expression. All expressions share the {@link NodeType#EXPRESSION} tag and are told apart by
 * {@link #expressionType()}.
 */
public sealed interface ExpressionNode extends AstNode
        permits LiteralExpression, VariableExpression, BinaryExpression, UnaryExpression,
                ConditionalExpression, ArrayExpression, FunctionCallExpression, RangeExpression,
                IndexExpression, MemberAccessExpression, LetExpression, ListComprehensionExpression {

    @Override
    default NodeType type() {
        return NodeType.EXPRESSION;
    }

    /**
     * @return The expression kind.
     */
    ExpressionType expressionType();
}
