package org.scadfront.frontend.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A module call such as {@code translate([1, 0, 0]) cube(5);}.
 *
 * @param name      The instantiated module.
 * @param modifier  The debug modifier ({@code # ! % *}), or null.
 * @param arguments The call arguments.
 * @param children  The child statements the module applies to.
 * @param location  The source span.
 */
public record ModuleInstantiationNode(
        String name,
        String modifier,
        List<Argument> arguments,
        List<StatementNode> children,
        SourceSpan location
) implements StatementNode {

    public ModuleInstantiationNode {
        arguments = List.copyOf(arguments);
        children = List.copyOf(children);
    }

    @Override
    public NodeType type() {
        return NodeType.MODULE_INSTANTIATION;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> result = new ArrayList<>();
        for (Argument argument : arguments) {
            result.add(argument.value());
        }
        result.addAll(children);
        return result;
    }
}
