package org.scadfront.frontend.visitor.features.expr;

import org.scadfront.cst.CstNode;
import org.scadfront.frontend.ast.AstNode;
import org.scadfront.frontend.visitor.CstNodes;
import org.scadfront.frontend.visitor.ICstNodeHandler;
import org.scadfront.frontend.visitor.VisitContext;

import java.util.List;

/**
 * Handler for {@code expression} and {@code primary_expression}, which only wrap the real node.
 */
public class ExpressionWrapperHandler implements ICstNodeHandler {

    @Override
    public AstNode handle(CstNode node, VisitContext context) {
        List<CstNode> named = CstNodes.namedChildren(node);
        if (named.isEmpty()) {
            // Leaf wrappers carry the text themselves.
            return node.text() == null || node.text().isBlank()
                    ? null
                    : LiteralClassifier.classify(node.text(), context.spanOf(node));
        }
        return context.visitExpression(named.get(0));
    }
}
