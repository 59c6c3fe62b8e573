package org.scadfront.frontend.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code module name(params) { ... }} definition.
 *
 * @param name       The module name.
 * @param parameters The parameters in declaration order.
 * @param body       The body statements.
 * @param location   The source span.
 */
public record ModuleDefinitionNode(
        String name,
        List<ModuleParameter> parameters,
        List<StatementNode> body,
        SourceSpan location
) implements StatementNode {

    public ModuleDefinitionNode {
        parameters = List.copyOf(parameters);
        body = List.copyOf(body);
    }

    @Override
    public NodeType type() {
        return NodeType.MODULE_DEFINITION;
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(body);
    }
}
