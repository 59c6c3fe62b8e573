package org.scadfront.frontend.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A let expression {@code let (a = 1, b = a + 1) a * b}. Bindings are in source order and each may
 * refer to the ones before it.
 *
 * @param assignments The bindings, never empty.
 * @param body        The expression evaluated with the bindings in scope.
 * @param location    The source span.
 */
public record LetExpression(List<AssignmentNode> assignments, ExpressionNode body, SourceSpan location)
        implements ExpressionNode {

    public LetExpression {
        assignments = List.copyOf(assignments);
    }

    @Override
    public ExpressionType expressionType() {
        return ExpressionType.LET;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(assignments.size() + 1);
        children.addAll(assignments);
        children.add(body);
        return children;
    }
}
