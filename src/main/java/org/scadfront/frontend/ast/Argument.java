package org.scadfront.frontend.ast;

/**
 * A call argument, either positional or named ({@code r = 5}).
 *
 * @param name  The parameter name for named arguments, or null for positional ones.
 * @param value The argument value.
 */
public record Argument(String name, ExpressionNode value) {

    public static Argument positional(ExpressionNode value) {
        return new Argument(null, value);
    }

    public boolean isNamed() {
        return name != null;
    }
}
