package org.scadfront.frontend.visitor.features.stmt;

import org.scadfront.cst.CstNode;
import org.scadfront.frontend.ast.AstNode;
import org.scadfront.frontend.ast.ExpressionNode;
import org.scadfront.frontend.ast.IfNode;
import org.scadfront.frontend.ast.StatementNode;
import org.scadfront.frontend.visitor.CstNodes;
import org.scadfront.frontend.visitor.ICstNodeHandler;
import org.scadfront.frontend.visitor.LegacyGrammarSupport;
import org.scadfront.frontend.visitor.VisitContext;

import java.util.List;

/**
 * Handler for {@code if_statement}. An {@code else if} becomes a nested {@link IfNode} as the only
 * statement of the else branch.
 */
public class IfStatementHandler implements ICstNodeHandler {

    @Override
    public AstNode handle(CstNode node, VisitContext context) {
        List<CstNode> named = CstNodes.namedChildren(node);
        ExpressionNode condition = context.visitExpression(LegacyGrammarSupport.fieldOrPosition(node, "condition", 0));
        CstNode consequenceNode = LegacyGrammarSupport.fieldOrPosition(node, "consequence", 1);
        if (condition == null || consequenceNode == null) {
            return null;
        }

        // The alternative field spans "else <statement>", so it may resolve to the keyword token.
        CstNode alternativeNode = node.childForFieldName("alternative");
        if (alternativeNode != null && !alternativeNode.isNamed()) {
            alternativeNode = null;
        }
        if (alternativeNode == null && named.size() > 2) {
            alternativeNode = named.get(2);
        }

        List<StatementNode> thenBranch = context.visitBody(consequenceNode);
        List<StatementNode> elseBranch = context.visitBody(alternativeNode);
        return new IfNode(condition, thenBranch, elseBranch, context.spanOf(node));
    }
}
