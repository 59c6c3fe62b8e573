package org.scadfront.frontend.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A function call used as a value, e.g. {@code sqrt(x)}.
 *
 * @param functionName The called function.
 * @param arguments    The arguments in source order.
 * @param location     The source span.
 */
public record FunctionCallExpression(String functionName, List<Argument> arguments, SourceSpan location)
        implements ExpressionNode {

    public FunctionCallExpression {
        arguments = List.copyOf(arguments);
    }

    @Override
    public ExpressionType expressionType() {
        return ExpressionType.FUNCTION_CALL;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        for (Argument argument : arguments) {
            children.add(argument.value());
        }
        return children;
    }
}
