package org.scadfront.frontend.visitor.features.expr;

import org.scadfront.cst.CstNode;
import org.scadfront.frontend.ast.AstNode;
import org.scadfront.frontend.ast.ExpressionNode;
import org.scadfront.frontend.ast.MemberAccessExpression;
import org.scadfront.frontend.visitor.ICstNodeHandler;
import org.scadfront.frontend.visitor.LegacyGrammarSupport;
import org.scadfront.frontend.visitor.VisitContext;

/**
 * Handler for member access {@code object.property}.
 */
public class MemberAccessHandler implements ICstNodeHandler {

    @Override
    public AstNode handle(CstNode node, VisitContext context) {
        CstNode propertyNode = LegacyGrammarSupport.fieldOrPosition(node, "property", 1);
        if (propertyNode == null || propertyNode.isMissing() || propertyNode.text().isBlank()) {
            return null;
        }
        ExpressionNode object = context.visitExpression(LegacyGrammarSupport.fieldOrPosition(node, "object", 0));
        if (object == null) {
            return null;
        }
        return new MemberAccessExpression(object, propertyNode.text().trim(), context.spanOf(node));
    }
}
