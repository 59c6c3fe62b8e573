package org.scadfront.frontend.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * An {@code assert(condition, message)} statement.
 *
 * @param condition The asserted expression.
 * @param message   The failure message expression, or null.
 * @param location  The source span.
 */
public record AssertNode(ExpressionNode condition, ExpressionNode message, SourceSpan location)
        implements StatementNode {

    @Override
    public NodeType type() {
        return NodeType.ASSERT;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> result = new ArrayList<>(2);
        result.add(condition);
        if (message != null) {
            result.add(message);
        }
        return result;
    }
}
