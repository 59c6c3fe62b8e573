package org.scadfront.frontend.visitor.features.expr;

import org.scadfront.cst.CstNode;
import org.scadfront.frontend.ast.AstNode;
import org.scadfront.frontend.ast.ExpressionNode;
import org.scadfront.frontend.ast.IndexExpression;
import org.scadfront.frontend.visitor.ICstNodeHandler;
import org.scadfront.frontend.visitor.LegacyGrammarSupport;
import org.scadfront.frontend.visitor.VisitContext;

/**
 * Handler for element access {@code array[index]}.
 */
public class IndexExpressionHandler implements ICstNodeHandler {

    @Override
    public AstNode handle(CstNode node, VisitContext context) {
        ExpressionNode array = context.visitExpression(LegacyGrammarSupport.fieldOrPosition(node, "array", 0));
        ExpressionNode index = context.visitExpression(LegacyGrammarSupport.fieldOrPosition(node, "index", 1));
        if (array == null || index == null) {
            return null;
        }
        return new IndexExpression(array, index, context.spanOf(node));
    }
}
