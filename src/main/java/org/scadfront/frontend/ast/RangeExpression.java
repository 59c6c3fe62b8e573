package org.scadfront.frontend.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A range {@code [start : end]} or {@code [start : step : end]}.
 *
 * @param start    The first value.
 * @param step     The increment, or null when omitted.
 * @param end      The last value.
 * @param location The source span.
 */
public record RangeExpression(
        ExpressionNode start,
        ExpressionNode step,
        ExpressionNode end,
        SourceSpan location
) implements ExpressionNode {

    @Override
    public ExpressionType expressionType() {
        return ExpressionType.RANGE;
    }

    public boolean hasStep() {
        return step != null;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(3);
        children.add(start);
        if (step != null) {
            children.add(step);
        }
        children.add(end);
        return children;
    }
}
