package org.scadfront.frontend.visitor.features.expr;

import org.scadfront.cst.CstNode;
import org.scadfront.frontend.ast.AstNode;
import org.scadfront.frontend.visitor.CstNodes;
import org.scadfront.frontend.visitor.ICstNodeHandler;
import org.scadfront.frontend.visitor.VisitContext;

/**
 * Handler for {@code accessor_expression}, which the grammar uses for calls, index access and member
 * access alike.
 */
public class AccessorExpressionHandler implements ICstNodeHandler {

    private final CallExpressionHandler callHandler;
    private final IndexExpressionHandler indexHandler;
    private final MemberAccessHandler memberHandler;

    public AccessorExpressionHandler(CallExpressionHandler callHandler, IndexExpressionHandler indexHandler,
                                     MemberAccessHandler memberHandler) {
        this.callHandler = callHandler;
        this.indexHandler = indexHandler;
        this.memberHandler = memberHandler;
    }

    @Override
    public AstNode handle(CstNode node, VisitContext context) {
        if (CstNodes.isPassThrough(node)) {
            return context.visitExpression(CstNodes.namedChildren(node).get(0));
        }
        if (node.childForFieldName("function") != null || CstNodes.firstChildOfType(node, "argument_list") != null) {
            return callHandler.handle(node, context);
        }
        if (node.childForFieldName("array") != null || isBracketAccess(node)) {
            return indexHandler.handle(node, context);
        }
        if (node.childForFieldName("object") != null || CstNodes.firstChildOfType(node, ".") != null) {
            return memberHandler.handle(node, context);
        }
        return null;
    }

    private static boolean isBracketAccess(CstNode node) {
        CstNode open = CstNodes.firstChildOfType(node, "[");
        return open != null && !open.isNamed();
    }
}
