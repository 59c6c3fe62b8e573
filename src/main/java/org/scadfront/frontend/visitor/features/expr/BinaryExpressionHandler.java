package org.scadfront.frontend.visitor.features.expr;

import org.scadfront.cst.CstNode;
import org.scadfront.frontend.ast.AstNode;
import org.scadfront.frontend.ast.BinaryExpression;
import org.scadfront.frontend.ast.BinaryOperator;
import org.scadfront.frontend.ast.ExpressionNode;
import org.scadfront.frontend.visitor.CstNodes;
import org.scadfront.frontend.visitor.ICstNodeHandler;
import org.scadfront.frontend.visitor.VisitContext;

import java.util.List;
import java.util.Optional;

/**
 * Handler for binary operator nodes: the generic {@code binary_expression} and the
 * precedence-layered kinds of the OpenSCAD grammar ({@code additive_expression} and friends).
 *
 * <p>Layered kinds that only forward to the next layer are unwrapped. When the grammar assigns no
 * {@code left}/{@code right} fields, the child sequence is assembled by precedence climbing.</p>
 */
public class BinaryExpressionHandler implements ICstNodeHandler {

    /** Node kinds handled here. */
    public static final List<String> NODE_TYPES = List.of(
            "binary_expression",
            "logical_or_expression",
            "logical_and_expression",
            "equality_expression",
            "relational_expression",
            "additive_expression",
            "multiplicative_expression",
            "exponentiation_expression");

    @Override
    public AstNode handle(CstNode node, VisitContext context) {
        if (CstNodes.isPassThrough(node)) {
            return context.visitExpression(CstNodes.namedChildren(node).get(0));
        }

        CstNode leftNode = node.childForFieldName("left");
        CstNode rightNode = node.childForFieldName("right");
        if (leftNode == null || rightNode == null) {
            return PrecedenceClimber.climb(CstNodes.children(node), context);
        }

        Optional<BinaryOperator> operator = operatorOf(node, leftNode, rightNode);
        if (operator.isEmpty()) {
            return null;
        }
        ExpressionNode left = context.visitExpression(leftNode);
        ExpressionNode right = context.visitExpression(rightNode);
        if (left == null || right == null) {
            return null;
        }
        return new BinaryExpression(operator.get(), left, right, context.spanOf(node));
    }

    private Optional<BinaryOperator> operatorOf(CstNode node, CstNode left, CstNode right) {
        CstNode operatorNode = node.childForFieldName("operator");
        if (operatorNode != null) {
            return BinaryOperator.fromSymbol(operatorNode.text());
        }
        // Some rules (&&, ||) leave the operator token unnamed between the operands.
        for (CstNode child : node.children()) {
            if (child.startByte() >= left.endByte() && child.endByte() <= right.startByte()) {
                Optional<BinaryOperator> operator = BinaryOperator.fromSymbol(child.text());
                if (operator.isPresent()) {
                    return operator;
                }
            }
        }
        return Optional.empty();
    }
}
