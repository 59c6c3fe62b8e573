package org.scadfront.frontend.ast;

import java.util.List;

/**
 * A variable assignment {@code name = value;}.
 *
 * @param variable The assigned name.
 * @param value    The assigned expression.
 * @param location The source span.
 */
public record AssignmentNode(String variable, ExpressionNode value, SourceSpan location) implements StatementNode {

    @Override
    public NodeType type() {
        return NodeType.ASSIGNMENT;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }
}
