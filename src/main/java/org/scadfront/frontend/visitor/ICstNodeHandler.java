package org.scadfront.frontend.visitor;

import org.scadfront.cst.CstNode;
import org.scadfront.frontend.ast.AstNode;

/**
 * Handler interface for turning one kind of CST node into an AST node.
 */
public interface ICstNodeHandler {

    /**
     * Builds the AST node for the given CST node.
     *
     * @param node    The CST node, never null.
     * @param context The visit context used to build child nodes.
     * @return The AST node, or {@code null} if a required part of the node is missing.
     */
    AstNode handle(CstNode node, VisitContext context);
}
