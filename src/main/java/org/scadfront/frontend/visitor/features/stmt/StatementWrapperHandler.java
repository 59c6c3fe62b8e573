package org.scadfront.frontend.visitor.features.stmt;

import org.scadfront.cst.CstNode;
import org.scadfront.frontend.ast.AstNode;
import org.scadfront.frontend.ast.StatementNode;
import org.scadfront.frontend.visitor.CstNodes;
import org.scadfront.frontend.visitor.ICstNodeHandler;
import org.scadfront.frontend.visitor.VisitContext;

import java.util.List;

/**
 * Handler for the {@code statement} wrapper.
 */
public class StatementWrapperHandler implements ICstNodeHandler {

    @Override
    public AstNode handle(CstNode node, VisitContext context) {
        List<CstNode> named = CstNodes.namedChildren(node);
        if (named.isEmpty()) {
            return null;
        }
        AstNode inner = context.visit(named.get(0));
        return inner instanceof StatementNode ? inner : null;
    }
}
