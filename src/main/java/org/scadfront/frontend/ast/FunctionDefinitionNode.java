package org.scadfront.frontend.ast;

import java.util.List;

/**
 * A {@code function name(params) = expression;} definition.
 *
 * @param name       The function name.
 * @param parameters The parameters in declaration order.
 * @param expression The function body.
 * @param location   The source span.
 */
public record FunctionDefinitionNode(
        String name,
        List<ModuleParameter> parameters,
        ExpressionNode expression,
        SourceSpan location
) implements StatementNode {

    public FunctionDefinitionNode {
        parameters = List.copyOf(parameters);
    }

    @Override
    public NodeType type() {
        return NodeType.FUNCTION_DEFINITION;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }
}
