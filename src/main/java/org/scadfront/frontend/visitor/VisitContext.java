package org.scadfront.frontend.visitor;

import org.scadfront.cst.CstNode;
import org.scadfront.frontend.ast.AstNode;
import org.scadfront.frontend.ast.ExpressionNode;
import org.scadfront.frontend.ast.SourceSpan;
import org.scadfront.frontend.ast.StatementNode;

import java.util.List;

/**
 * Gives node handlers access to recursive construction.
 * This interface decouples handlers from the concrete {@link AstBuilder}.
 */
public interface VisitContext {

    /**
     * Builds the AST node for any CST node.
     * @param node The CST node, may be null.
     * @return The AST node, or null if the node is null, unknown or incomplete.
     */
    AstNode visit(CstNode node);

    /**
     * Builds an expression.
     * @param node The CST node, may be null.
     * @return The expression, or null if the node does not produce one.
     */
    ExpressionNode visitExpression(CstNode node);

    /**
     * Builds the statements of a body. A {@code block} yields each contained statement; any other
     * node yields the single statement it produces.
     * @param node The body node, may be null.
     * @return The statements in source order; empty when there is no body.
     */
    List<StatementNode> visitBody(CstNode node);

    /**
     * @param node The CST node.
     * @return The source span covered by the node.
     */
    SourceSpan spanOf(CstNode node);
}
