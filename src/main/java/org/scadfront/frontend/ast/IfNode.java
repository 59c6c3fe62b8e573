package org.scadfront.frontend.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * An if statement. An {@code else if} chain is an {@link IfNode} nested as the only else statement.
 *
 * @param condition  The tested expression.
 * @param thenBranch Statements run when the condition holds.
 * @param elseBranch Statements run otherwise; empty when there is no else.
 * @param location   The source span.
 */
public record IfNode(
        ExpressionNode condition,
        List<StatementNode> thenBranch,
        List<StatementNode> elseBranch,
        SourceSpan location
) implements StatementNode {

    public IfNode {
        thenBranch = List.copyOf(thenBranch);
        elseBranch = List.copyOf(elseBranch);
    }

    @Override
    public NodeType type() {
        return NodeType.IF;
    }

    public boolean hasElse() {
        return !elseBranch.isEmpty();
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(condition);
        children.addAll(thenBranch);
        children.addAll(elseBranch);
        return children;
    }
}
