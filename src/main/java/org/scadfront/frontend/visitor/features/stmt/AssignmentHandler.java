package org.scadfront.frontend.visitor.features.stmt;

import org.scadfront.cst.CstNode;
import org.scadfront.frontend.ast.AssignmentNode;
import org.scadfront.frontend.ast.AstNode;
import org.scadfront.frontend.ast.ExpressionNode;
import org.scadfront.frontend.visitor.ICstNodeHandler;
import org.scadfront.frontend.visitor.LegacyGrammarSupport;
import org.scadfront.frontend.visitor.VisitContext;

/**
 * Handler for {@code assignment_statement} ({@code name = value;}).
 */
public class AssignmentHandler implements ICstNodeHandler {

    @Override
    public AstNode handle(CstNode node, VisitContext context) {
        CstNode nameNode = LegacyGrammarSupport.fieldOrPosition(node, "name", 0);
        CstNode valueNode = LegacyGrammarSupport.fieldOrPosition(node, "value", 1);
        if (nameNode == null || valueNode == null) {
            return null;
        }
        ExpressionNode value = context.visitExpression(valueNode);
        if (value == null) {
            return null;
        }
        return new AssignmentNode(nameNode.text().trim(), value, context.spanOf(node));
    }
}
