package org.scadfront.frontend.visitor.features.expr;

import org.scadfront.cst.CstNode;
import org.scadfront.frontend.ast.AstNode;
import org.scadfront.frontend.ast.ExpressionNode;
import org.scadfront.frontend.ast.UnaryExpression;
import org.scadfront.frontend.ast.UnaryOperator;
import org.scadfront.frontend.visitor.CstNodes;
import org.scadfront.frontend.visitor.ICstNodeHandler;
import org.scadfront.frontend.visitor.VisitContext;

import java.util.List;
import java.util.Optional;

/**
 * Handler for {@code unary_expression}.
 */
public class UnaryExpressionHandler implements ICstNodeHandler {

    @Override
    public AstNode handle(CstNode node, VisitContext context) {
        if (CstNodes.isPassThrough(node)) {
            return context.visitExpression(CstNodes.namedChildren(node).get(0));
        }

        CstNode operatorNode = node.childForFieldName("operator");
        CstNode operandNode = node.childForFieldName("operand");
        if (operatorNode == null || operandNode == null) {
            // Without fields: operator token first, operand last.
            List<CstNode> children = CstNodes.children(node);
            if (children.size() < 2) {
                return null;
            }
            operatorNode = children.get(0);
            operandNode = children.get(children.size() - 1);
        }

        Optional<UnaryOperator> operator = UnaryOperator.fromSymbol(operatorNode.text());
        ExpressionNode operand = context.visitExpression(operandNode);
        if (operator.isEmpty() || operand == null) {
            return null;
        }
        return new UnaryExpression(operator.get(), operand, context.spanOf(node));
    }
}
