package org.scadfront.frontend.visitor.features.def;

import org.scadfront.cst.CstNode;
import org.scadfront.frontend.ast.AstNode;
import org.scadfront.frontend.ast.ExpressionNode;
import org.scadfront.frontend.ast.FunctionDefinitionNode;
import org.scadfront.frontend.visitor.CstNodes;
import org.scadfront.frontend.visitor.ICstNodeHandler;
import org.scadfront.frontend.visitor.LegacyGrammarSupport;
import org.scadfront.frontend.visitor.VisitContext;

import java.util.List;

/**
 * Handler for {@code function_definition} ({@code function name(params) = expression;}).
 */
public class FunctionDefinitionHandler implements ICstNodeHandler {

    @Override
    public AstNode handle(CstNode node, VisitContext context) {
        CstNode nameNode = LegacyGrammarSupport.fieldOrPosition(node, "name", 0);
        if (nameNode == null) {
            return null;
        }
        CstNode parametersNode = node.childForFieldName("parameters");
        if (parametersNode == null) {
            parametersNode = CstNodes.firstChildOfType(node, "parameter_list");
        }
        CstNode valueNode = node.childForFieldName("value");
        if (valueNode == null) {
            List<CstNode> named = CstNodes.namedChildren(node);
            valueNode = named.size() > 1 ? named.get(named.size() - 1) : null;
        }
        if (valueNode == null || CstNodes.sameNode(valueNode, parametersNode) || CstNodes.sameNode(valueNode, nameNode)) {
            return null;
        }
        ExpressionNode expression = context.visitExpression(valueNode);
        if (expression == null) {
            return null;
        }
        return new FunctionDefinitionNode(nameNode.text().trim(), ParameterListExtractor.extract(parametersNode),
                expression, context.spanOf(node));
    }
}
