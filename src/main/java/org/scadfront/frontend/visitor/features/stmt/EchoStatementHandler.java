package org.scadfront.frontend.visitor.features.stmt;

import org.scadfront.cst.CstNode;
import org.scadfront.frontend.ast.Argument;
import org.scadfront.frontend.ast.AstNode;
import org.scadfront.frontend.ast.EchoNode;
import org.scadfront.frontend.visitor.CstNodes;
import org.scadfront.frontend.visitor.ICstNodeHandler;
import org.scadfront.frontend.visitor.VisitContext;
import org.scadfront.frontend.visitor.features.expr.ArgumentListExtractor;

import java.util.List;

/**
 * Handler for {@code echo_statement}.
 */
public class EchoStatementHandler implements ICstNodeHandler {

    @Override
    public AstNode handle(CstNode node, VisitContext context) {
        CstNode argumentsNode = node.childForFieldName("arguments");
        if (argumentsNode == null) {
            argumentsNode = CstNodes.firstChildOfType(node, "arguments");
        }
        if (argumentsNode == null) {
            argumentsNode = CstNodes.firstChildOfType(node, "argument_list");
        }
        List<Argument> arguments = ArgumentListExtractor.extract(argumentsNode, context);
        return arguments == null ? null : new EchoNode(arguments, context.spanOf(node));
    }
}
