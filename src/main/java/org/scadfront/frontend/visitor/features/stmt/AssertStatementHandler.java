package org.scadfront.frontend.visitor.features.stmt;

import org.scadfront.cst.CstNode;
import org.scadfront.frontend.ast.AssertNode;
import org.scadfront.frontend.ast.AstNode;
import org.scadfront.frontend.ast.ExpressionNode;
import org.scadfront.frontend.visitor.ICstNodeHandler;
import org.scadfront.frontend.visitor.LegacyGrammarSupport;
import org.scadfront.frontend.visitor.VisitContext;

/**
 * Handler for {@code assert_statement} ({@code assert(condition, message);}).
 */
public class AssertStatementHandler implements ICstNodeHandler {

    @Override
    public AstNode handle(CstNode node, VisitContext context) {
        ExpressionNode condition = context.visitExpression(LegacyGrammarSupport.fieldOrPosition(node, "condition", 0));
        if (condition == null) {
            return null;
        }
        CstNode messageNode = LegacyGrammarSupport.fieldOrPosition(node, "message", 1);
        ExpressionNode message = null;
        if (messageNode != null) {
            message = context.visitExpression(messageNode);
            if (message == null) {
                return null;
            }
        }
        return new AssertNode(condition, message, context.spanOf(node));
    }
}
