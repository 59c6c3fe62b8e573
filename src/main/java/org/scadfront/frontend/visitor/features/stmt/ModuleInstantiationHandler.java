package org.scadfront.frontend.visitor.features.stmt;

import org.scadfront.cst.CstNode;
import org.scadfront.frontend.ast.Argument;
import org.scadfront.frontend.ast.AstNode;
import org.scadfront.frontend.ast.ModuleInstantiationNode;
import org.scadfront.frontend.ast.StatementNode;
import org.scadfront.frontend.visitor.CstNodes;
import org.scadfront.frontend.visitor.ICstNodeHandler;
import org.scadfront.frontend.visitor.VisitContext;
import org.scadfront.frontend.visitor.features.expr.ArgumentListExtractor;

import java.util.ArrayList;
import java.util.List;

/**
 * Handler for {@code module_instantiation}: an optional modifier, the module name, its arguments and
 * the child statement or block it applies to.
 */
public class ModuleInstantiationHandler implements ICstNodeHandler {

    @Override
    public AstNode handle(CstNode node, VisitContext context) {
        CstNode nameNode = node.childForFieldName("name");
        if (nameNode == null) {
            nameNode = CstNodes.firstChildOfType(node, "identifier");
        }
        if (nameNode == null) {
            return null;
        }

        CstNode modifierNode = CstNodes.firstChildOfType(node, "modifier");
        String modifier = modifierNode != null ? modifierNode.text().trim() : null;

        CstNode argumentsNode = node.childForFieldName("arguments");
        if (argumentsNode == null) {
            argumentsNode = CstNodes.firstChildOfType(node, "argument_list");
        }
        List<Argument> arguments = ArgumentListExtractor.extract(argumentsNode, context);
        if (arguments == null) {
            return null;
        }

        List<StatementNode> children = new ArrayList<>();
        for (CstNode child : CstNodes.namedChildren(node)) {
            if (child.startByte() < (argumentsNode != null ? argumentsNode.endByte() : nameNode.endByte())) {
                continue;
            }
            children.addAll(context.visitBody(child));
        }
        return new ModuleInstantiationNode(nameNode.text().trim(), modifier, arguments, children, context.spanOf(node));
    }
}
