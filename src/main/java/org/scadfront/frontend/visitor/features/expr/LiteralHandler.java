package org.scadfront.frontend.visitor.features.expr;

import org.scadfront.cst.CstNode;
import org.scadfront.frontend.ast.AstNode;
import org.scadfront.frontend.ast.LiteralExpression;
import org.scadfront.frontend.ast.LiteralValue;
import org.scadfront.frontend.visitor.ICstNodeHandler;
import org.scadfront.frontend.visitor.VisitContext;

/**
 * Handler for {@code number}, {@code string}, {@code boolean} and {@code undef} leaves.
 */
public class LiteralHandler implements ICstNodeHandler {

    @Override
    public AstNode handle(CstNode node, VisitContext context) {
        if ("string".equals(node.type())) {
            return new LiteralExpression(LiteralValue.ofString(LiteralClassifier.unquote(node.text())),
                    context.spanOf(node));
        }
        return LiteralClassifier.classify(node.text(), context.spanOf(node));
    }
}
