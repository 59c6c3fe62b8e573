package org.scadfront.frontend.ast;

/**
 * A top-level or block-level statement.
 */
public sealed interface StatementNode extends AstNode
        permits AssignmentNode, ForLoopNode, IfNode, ModuleDefinitionNode, FunctionDefinitionNode,
                ModuleInstantiationNode, EchoNode, AssertNode {
}
