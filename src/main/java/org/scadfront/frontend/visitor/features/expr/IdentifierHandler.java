package org.scadfront.frontend.visitor.features.expr;

import org.scadfront.cst.CstNode;
import org.scadfront.frontend.ast.AstNode;
import org.scadfront.frontend.visitor.ICstNodeHandler;
import org.scadfront.frontend.visitor.VisitContext;

/**
 * Handler for {@code identifier} and {@code special_variable} leaves. Older grammars emit keywords
 * such as {@code true} as identifiers, so the text is classified rather than trusted.
 */
public class IdentifierHandler implements ICstNodeHandler {

    @Override
    public AstNode handle(CstNode node, VisitContext context) {
        if (node.text() == null || node.text().isBlank()) {
            return null;
        }
        return LiteralClassifier.classify(node.text(), context.spanOf(node));
    }
}
