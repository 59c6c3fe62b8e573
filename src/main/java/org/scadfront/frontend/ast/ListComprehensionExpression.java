package org.scadfront.frontend.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A list comprehension {@code [element for (variable = range) if (condition)]}.
 *
 * @param variable  The loop variable.
 * @param range     The iterated expression, usually a {@link RangeExpression} or an array.
 * @param element   The expression produced per iteration.
 * @param condition The filter, or null when there is no {@code if} clause.
 * @param location  The source span.
 */
public record ListComprehensionExpression(
        String variable,
        ExpressionNode range,
        ExpressionNode element,
        ExpressionNode condition,
        SourceSpan location
) implements ExpressionNode {

    @Override
    public ExpressionType expressionType() {
        return ExpressionType.LIST_COMPREHENSION;
    }

    public boolean hasCondition() {
        return condition != null;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(3);
        children.add(range);
        children.add(element);
        if (condition != null) {
            children.add(condition);
        }
        return children;
    }
}
