package org.scadfront.frontend.ast;

/**
 * Primary tag of an AST node.
 */
public enum NodeType {
    ASSIGNMENT("assignment"),
    MODULE_DEFINITION("module_definition"),
    FUNCTION_DEFINITION("function_definition"),
    MODULE_INSTANTIATION("module_instantiation"),
    IF("if"),
    FOR_LOOP("for_loop"),
    ECHO("echo"),
    ASSERT("assert"),
    EXPRESSION("expression");

    private final String tag;

    NodeType(String tag) {
        this.tag = tag;
    }

    /**
     * @return The wire name used when the AST is serialized for downstream tools.
     */
    public String tag() {
        return tag;
    }
}
