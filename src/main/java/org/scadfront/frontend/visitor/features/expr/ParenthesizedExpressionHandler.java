package org.scadfront.frontend.visitor.features.expr;

import org.scadfront.cst.CstNode;
import org.scadfront.frontend.ast.AstNode;
import org.scadfront.frontend.visitor.CstNodes;
import org.scadfront.frontend.visitor.ICstNodeHandler;
import org.scadfront.frontend.visitor.VisitContext;

import java.util.List;

/**
 * Handler for {@code parenthesized_expression}. Parentheses leave no trace in the AST: the inner
 * expression's node is returned as is.
 */
public class ParenthesizedExpressionHandler implements ICstNodeHandler {

    @Override
    public AstNode handle(CstNode node, VisitContext context) {
        List<CstNode> named = CstNodes.namedChildren(node);
        return named.isEmpty() ? null : context.visitExpression(named.get(0));
    }
}
