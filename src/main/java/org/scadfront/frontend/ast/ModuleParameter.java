package org.scadfront.frontend.ast;

/**
 * A module or function parameter.
 *
 * @param name         The parameter name.
 * @param defaultValue The default value coerced by its lexical shape, or null when there is none.
 *                     Defaults that are not constants are kept as a string of their source text.
 */
public record ModuleParameter(String name, LiteralValue defaultValue) {

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
