package org.scadfront.frontend.visitor.features.expr;

import org.scadfront.cst.CstNode;
import org.scadfront.frontend.ast.AstNode;
import org.scadfront.frontend.ast.ConditionalExpression;
import org.scadfront.frontend.ast.ExpressionNode;
import org.scadfront.frontend.visitor.CstNodes;
import org.scadfront.frontend.visitor.ICstNodeHandler;
import org.scadfront.frontend.visitor.LegacyGrammarSupport;
import org.scadfront.frontend.visitor.VisitContext;

/**
 * Handler for {@code conditional_expression} ({@code c ? a : b}).
 */
public class ConditionalExpressionHandler implements ICstNodeHandler {

    @Override
    public AstNode handle(CstNode node, VisitContext context) {
        if (CstNodes.isPassThrough(node)) {
            return context.visitExpression(CstNodes.namedChildren(node).get(0));
        }

        ExpressionNode condition = context.visitExpression(LegacyGrammarSupport.fieldOrPosition(node, "condition", 0));
        ExpressionNode consequence = context.visitExpression(LegacyGrammarSupport.fieldOrPosition(node, "consequence", 1));
        ExpressionNode alternative = context.visitExpression(LegacyGrammarSupport.fieldOrPosition(node, "alternative", 2));
        if (condition == null || consequence == null || alternative == null) {
            return null;
        }
        return new ConditionalExpression(condition, consequence, alternative, context.spanOf(node));
    }
}
