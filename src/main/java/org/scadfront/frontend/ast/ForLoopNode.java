package org.scadfront.frontend.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A for-loop with one or more iterators.
 *
 * @param variables The iterators in source order.
 * @param body      The loop body.
 * @param location  The source span.
 */
public record ForLoopNode(List<ForLoopVariable> variables, List<StatementNode> body, SourceSpan location)
        implements StatementNode {

    public ForLoopNode {
        variables = List.copyOf(variables);
        body = List.copyOf(body);
    }

    @Override
    public NodeType type() {
        return NodeType.FOR_LOOP;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        for (ForLoopVariable variable : variables) {
            if (variable.range() instanceof LoopRange.ExpressionRange expressionRange) {
                children.add(expressionRange.expression());
            }
        }
        children.addAll(body);
        return children;
    }
}
