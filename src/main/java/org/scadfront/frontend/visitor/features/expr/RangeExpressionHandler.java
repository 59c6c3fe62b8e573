package org.scadfront.frontend.visitor.features.expr;

import org.scadfront.cst.CstNode;
import org.scadfront.frontend.ast.AstNode;
import org.scadfront.frontend.ast.ExpressionNode;
import org.scadfront.frontend.ast.RangeExpression;
import org.scadfront.frontend.visitor.CstNodes;
import org.scadfront.frontend.visitor.ICstNodeHandler;
import org.scadfront.frontend.visitor.VisitContext;

import java.util.List;

/**
 * Handler for {@code range_expression}: {@code [start : end]} or {@code [start : step : end]}.
 */
public class RangeExpressionHandler implements ICstNodeHandler {

    @Override
    public AstNode handle(CstNode node, VisitContext context) {
        CstNode startNode = node.childForFieldName("start");
        CstNode stepNode = node.childForFieldName("step");
        CstNode endNode = node.childForFieldName("end");

        if (startNode == null || endNode == null) {
            List<CstNode> named = CstNodes.namedChildren(node);
            if (named.size() == 2) {
                startNode = named.get(0);
                stepNode = null;
                endNode = named.get(1);
            } else if (named.size() == 3) {
                startNode = named.get(0);
                stepNode = named.get(1);
                endNode = named.get(2);
            } else {
                return null;
            }
        }

        ExpressionNode start = context.visitExpression(startNode);
        ExpressionNode end = context.visitExpression(endNode);
        ExpressionNode step = stepNode != null ? context.visitExpression(stepNode) : null;
        if (start == null || end == null || (stepNode != null && step == null)) {
            return null;
        }
        return new RangeExpression(start, step, end, context.spanOf(node));
    }
}
