package org.scadfront.frontend.visitor.features.def;

import org.scadfront.cst.CstNode;
import org.scadfront.frontend.ast.LiteralValue;
import org.scadfront.frontend.ast.ModuleParameter;
import org.scadfront.frontend.visitor.CstNodes;
import org.scadfront.frontend.visitor.features.expr.LiteralClassifier;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts parameters from a {@code parameter_list}. Default values are coerced by lexical shape.
 */
final class ParameterListExtractor {

    private ParameterListExtractor() {
    }

    static List<ModuleParameter> extract(CstNode parameterList) {
        List<ModuleParameter> parameters = new ArrayList<>();
        if (parameterList == null) {
            return parameters;
        }
        CstNode container = CstNodes.firstChildOfType(parameterList, "parameter_declarations");
        if (container == null) {
            container = parameterList;
        }
        for (CstNode child : CstNodes.namedChildren(container)) {
            ModuleParameter parameter = parameter(child);
            if (parameter != null) {
                parameters.add(parameter);
            }
        }
        return parameters;
    }

    private static ModuleParameter parameter(CstNode node) {
        String type = node.type();
        if ("identifier".equals(type) || "special_variable".equals(type)) {
            return new ModuleParameter(node.text().trim(), null);
        }
        if (!"parameter_declaration".equals(type) && !"parameter".equals(type)) {
            return null;
        }
        CstNode nameNode = node.childForFieldName("name");
        CstNode defaultNode = node.childForFieldName("default_value");
        if (nameNode == null) {
            List<CstNode> named = CstNodes.namedChildren(node);
            if (named.isEmpty()) {
                // A bare declaration token carries the name itself.
                String text = node.text().trim();
                return text.isEmpty() ? null : new ModuleParameter(text, null);
            }
            nameNode = named.get(0);
            defaultNode = named.size() > 1 ? named.get(1) : null;
        }
        LiteralValue defaultValue = defaultNode != null ? LiteralClassifier.coerce(defaultNode.text()) : null;
        return new ModuleParameter(nameNode.text().trim(), defaultValue);
    }
}
