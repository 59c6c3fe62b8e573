package org.scadfront.frontend.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A vector literal {@code [a, b, c]}.
 *
 * @param items    The elements in source order.
 * @param location The source span.
 */
public record ArrayExpression(List<ExpressionNode> items, SourceSpan location) implements ExpressionNode {

    public ArrayExpression {
        items = List.copyOf(items);
    }

    @Override
    public ExpressionType expressionType() {
        return ExpressionType.ARRAY;
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(items);
    }
}
