package org.scadfront.frontend.visitor.features.expr;

import org.scadfront.cst.CstNode;
import org.scadfront.frontend.ast.BinaryExpression;
import org.scadfront.frontend.ast.BinaryOperator;
import org.scadfront.frontend.ast.ExpressionNode;
import org.scadfront.frontend.ast.SourceSpan;
import org.scadfront.frontend.visitor.VisitContext;

import java.util.List;
import java.util.Optional;

/**
 * Builds a binary expression tree from a flat {@code operand (operator operand)*} child sequence,
 * as produced by grammars that do not nest operators by precedence. Operators of equal precedence
 * group left to right, except {@code ^}, which groups right to left.
 */
final class PrecedenceClimber {

    private final List<CstNode> items;
    private final VisitContext context;
    private int position;

    private PrecedenceClimber(List<CstNode> items, VisitContext context) {
        this.items = items;
        this.context = context;
    }

    /**
     * @param items   Operand and operator nodes in source order.
     * @param context The visit context for operands.
     * @return The expression tree, or null if an operand cannot be built or the sequence is malformed.
     */
    static ExpressionNode climb(List<CstNode> items, VisitContext context) {
        if (items.isEmpty()) {
            return null;
        }
        PrecedenceClimber climber = new PrecedenceClimber(items, context);
        ExpressionNode result = climber.parse(1);
        return climber.position == items.size() ? result : null;
    }

    private ExpressionNode parse(int minPrecedence) {
        ExpressionNode left = operand();
        if (left == null) {
            return null;
        }
        while (position < items.size()) {
            Optional<BinaryOperator> peeked = operatorAt(position);
            if (peeked.isEmpty() || peeked.get().precedence() < minPrecedence) {
                break;
            }
            BinaryOperator operator = peeked.get();
            position++;
            int nextMin = operator.isRightAssociative() ? operator.precedence() : operator.precedence() + 1;
            ExpressionNode right = parse(nextMin);
            if (right == null) {
                return null;
            }
            left = new BinaryExpression(operator, left, right,
                    new SourceSpan(left.location().start(), right.location().end()));
        }
        return left;
    }

    private ExpressionNode operand() {
        if (position >= items.size()) {
            return null;
        }
        CstNode node = items.get(position);
        if (!node.isNamed()) {
            return null;
        }
        position++;
        return context.visitExpression(node);
    }

    private Optional<BinaryOperator> operatorAt(int index) {
        CstNode node = items.get(index);
        return node.isNamed() && !node.type().endsWith("_operator")
                ? Optional.empty()
                : BinaryOperator.fromSymbol(node.text());
    }
}
