package org.scadfront.frontend.visitor.features.def;

import org.scadfront.cst.CstNode;
import org.scadfront.frontend.ast.AstNode;
import org.scadfront.frontend.ast.ModuleDefinitionNode;
import org.scadfront.frontend.visitor.CstNodes;
import org.scadfront.frontend.visitor.ICstNodeHandler;
import org.scadfront.frontend.visitor.LegacyGrammarSupport;
import org.scadfront.frontend.visitor.VisitContext;

/**
 * Handler for {@code module_definition} ({@code module name(params) { ... }}).
 */
public class ModuleDefinitionHandler implements ICstNodeHandler {

    @Override
    public AstNode handle(CstNode node, VisitContext context) {
        CstNode nameNode = LegacyGrammarSupport.fieldOrPosition(node, "name", 0);
        CstNode bodyNode = node.childForFieldName("body");
        if (bodyNode == null) {
            bodyNode = CstNodes.firstChildOfType(node, "block");
        }
        if (nameNode == null || bodyNode == null) {
            return null;
        }
        CstNode parametersNode = node.childForFieldName("parameters");
        if (parametersNode == null) {
            parametersNode = CstNodes.firstChildOfType(node, "parameter_list");
        }
        return new ModuleDefinitionNode(nameNode.text().trim(), ParameterListExtractor.extract(parametersNode),
                context.visitBody(bodyNode), context.spanOf(node));
    }
}
