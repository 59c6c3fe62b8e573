package org.scadfront.frontend.ast;

import java.util.List;

/**
 * Element access {@code array[index]}.
 *
 * @param array    The indexed expression.
 * @param index    The index expression.
 * @param location The source span.
 */
public record IndexExpression(ExpressionNode array, ExpressionNode index, SourceSpan location)
        implements ExpressionNode {

    @Override
    public ExpressionType expressionType() {
        return ExpressionType.INDEX;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(array, index);
    }
}
