package org.scadfront.frontend.visitor.features.expr;

import org.scadfront.cst.CstNode;
import org.scadfront.frontend.ast.Argument;
import org.scadfront.frontend.ast.AstNode;
import org.scadfront.frontend.ast.FunctionCallExpression;
import org.scadfront.frontend.visitor.CstNodes;
import org.scadfront.frontend.visitor.ICstNodeHandler;
import org.scadfront.frontend.visitor.LegacyGrammarSupport;
import org.scadfront.frontend.visitor.VisitContext;

import java.util.List;

/**
 * Handler for function calls used as values. Only calls through a plain name are modelled.
 */
public class CallExpressionHandler implements ICstNodeHandler {

    @Override
    public AstNode handle(CstNode node, VisitContext context) {
        CstNode functionNode = LegacyGrammarSupport.fieldOrPosition(node, "function", 0);
        if (functionNode == null) {
            return null;
        }
        String name = calleeName(functionNode);
        if (name == null) {
            return null;
        }
        CstNode argumentsNode = node.childForFieldName("arguments");
        if (argumentsNode == null) {
            argumentsNode = CstNodes.firstChildOfType(node, "argument_list");
        }
        List<Argument> arguments = ArgumentListExtractor.extract(argumentsNode, context);
        if (arguments == null) {
            return null;
        }
        return new FunctionCallExpression(name, arguments, context.spanOf(node));
    }

    private static String calleeName(CstNode node) {
        CstNode current = node;
        // Descend through single-child wrappers to the identifier.
        while (!"identifier".equals(current.type()) && !"special_variable".equals(current.type())) {
            List<CstNode> named = CstNodes.namedChildren(current);
            if (named.size() != 1) {
                return null;
            }
            current = named.get(0);
        }
        return current.text().trim();
    }
}
