package org.scadfront.frontend.visitor.features.expr;

import org.scadfront.cst.CstNode;
import org.scadfront.frontend.ast.ArrayExpression;
import org.scadfront.frontend.ast.AstNode;
import org.scadfront.frontend.ast.ExpressionNode;
import org.scadfront.frontend.visitor.CstNodes;
import org.scadfront.frontend.visitor.ICstNodeHandler;
import org.scadfront.frontend.visitor.VisitContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Handler for {@code vector_expression} and {@code array_literal}. An array literal that wraps a
 * range yields the range.
 */
public class ArrayExpressionHandler implements ICstNodeHandler {

    @Override
    public AstNode handle(CstNode node, VisitContext context) {
        List<CstNode> named = CstNodes.namedChildren(node);
        if (named.size() == 1 && "range_expression".equals(named.get(0).type())) {
            return context.visitExpression(named.get(0));
        }
        List<ExpressionNode> items = new ArrayList<>(named.size());
        for (CstNode child : named) {
            ExpressionNode item = context.visitExpression(child);
            if (item == null) {
                return null;
            }
            items.add(item);
        }
        return new ArrayExpression(items, context.spanOf(node));
    }
}
