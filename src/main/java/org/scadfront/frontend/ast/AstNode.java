package org.scadfront.frontend.ast;

import java.util.List;

/**
 * Base of the closed AST produced from a concrete syntax tree. Every node carries the source span
 * it was built from; a node's span always lies within its syntactic parent's span.
 */
public sealed interface AstNode permits StatementNode, ExpressionNode {

    /**
     * @return The primary node tag.
     */
    NodeType type();

    /**
     * @return The source span this node covers.
     */
    SourceSpan location();

    /**
     * Returns the direct child nodes in source order, for generic traversal.
     * @return The children, never null.
     */
    default List<AstNode> getChildren() {
        return List.of();
    }
}
