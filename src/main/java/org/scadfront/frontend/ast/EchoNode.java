package org.scadfront.frontend.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * An {@code echo(...)} statement.
 *
 * @param arguments The echoed arguments.
 * @param location  The source span.
 */
public record EchoNode(List<Argument> arguments, SourceSpan location) implements StatementNode {

    public EchoNode {
        arguments = List.copyOf(arguments);
    }

    @Override
    public NodeType type() {
        return NodeType.ECHO;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> result = new ArrayList<>();
        for (Argument argument : arguments) {
            result.add(argument.value());
        }
        return result;
    }
}
