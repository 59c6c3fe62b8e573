package org.scadfront.frontend.semantics;

import org.scadfront.frontend.ast.AssignmentNode;
import org.scadfront.frontend.ast.AstNode;
import org.scadfront.frontend.ast.ExpressionNode;
import org.scadfront.frontend.ast.ForLoopNode;
import org.scadfront.frontend.ast.ForLoopVariable;
import org.scadfront.frontend.ast.FunctionDefinitionNode;
import org.scadfront.frontend.ast.IfNode;
import org.scadfront.frontend.ast.LetExpression;
import org.scadfront.frontend.ast.ListComprehensionExpression;
import org.scadfront.frontend.ast.ModuleDefinitionNode;
import org.scadfront.frontend.ast.ModuleInstantiationNode;
import org.scadfront.frontend.ast.ModuleParameter;
import org.scadfront.frontend.ast.StatementNode;
import org.scadfront.recovery.strategies.IdentifierKind;
import org.scadfront.recovery.strategies.UnknownIdentifierStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Registers the names a program declares with an {@link UnknownIdentifierStrategy}, so that
 * misspellings can be corrected against them.
 *
 * <p>Module and function names are registered in the scope they are declared in. Their parameters,
 * and a module's body, are registered under a scope named after the definition. Loop variables
 * belong to the enclosing scope, as do names bound by {@code let} and list comprehensions inside
 * expressions.</p>
 */
public class IdentifierCollector {

    private static final Logger log = LoggerFactory.getLogger(IdentifierCollector.class);

    private final UnknownIdentifierStrategy strategy;
    private int collected;

    public IdentifierCollector(UnknownIdentifierStrategy strategy) {
        this.strategy = strategy;
    }

    /**
     * Walks the statements and registers every declared name. The strategy's current scope is
     * restored afterwards.
     *
     * @param statements The program's top-level statements.
     * @return The number of names registered.
     */
    public int collect(List<StatementNode> statements) {
        List<String> saved = strategy.getCurrentScope();
        collected = 0;
        try {
            collectAll(statements, saved);
        } finally {
            strategy.setCurrentScope(saved);
        }
        log.debug("Collected {} identifiers", collected);
        return collected;
    }

    private void collectAll(List<StatementNode> statements, List<String> scope) {
        for (StatementNode statement : statements) {
            collectStatement(statement, scope);
        }
    }

    private void collectStatement(StatementNode statement, List<String> scope) {
        List<String> expressionScope = statement instanceof FunctionDefinitionNode function
                ? nested(scope, function.name()) : scope;
        for (AstNode child : statement.getChildren()) {
            if (child instanceof ExpressionNode expression) {
                collectBound(expression, expressionScope);
            }
        }
        if (statement instanceof AssignmentNode assignment) {
            add(assignment.variable(), IdentifierKind.VARIABLE, scope);
        } else if (statement instanceof ModuleDefinitionNode module) {
            add(module.name(), IdentifierKind.MODULE, scope);
            List<String> inner = nested(scope, module.name());
            addParameters(module.parameters(), inner);
            collectAll(module.body(), inner);
        } else if (statement instanceof FunctionDefinitionNode function) {
            add(function.name(), IdentifierKind.FUNCTION, scope);
            addParameters(function.parameters(), nested(scope, function.name()));
        } else if (statement instanceof ForLoopNode loop) {
            for (ForLoopVariable variable : loop.variables()) {
                add(variable.variable(), IdentifierKind.VARIABLE, scope);
            }
            collectAll(loop.body(), scope);
        } else if (statement instanceof IfNode ifNode) {
            collectAll(ifNode.thenBranch(), scope);
            collectAll(ifNode.elseBranch(), scope);
        } else if (statement instanceof ModuleInstantiationNode instantiation) {
            collectAll(instantiation.children(), scope);
        }
    }

    private void collectBound(AstNode node, List<String> scope) {
        if (node instanceof LetExpression let) {
            for (AssignmentNode binding : let.assignments()) {
                add(binding.variable(), IdentifierKind.VARIABLE, scope);
            }
        } else if (node instanceof ListComprehensionExpression comprehension) {
            add(comprehension.variable(), IdentifierKind.VARIABLE, scope);
        }
        for (AstNode child : node.getChildren()) {
            collectBound(child, scope);
        }
    }

    private void addParameters(List<ModuleParameter> parameters, List<String> scope) {
        for (ModuleParameter parameter : parameters) {
            add(parameter.name(), IdentifierKind.VARIABLE, scope);
        }
    }

    private void add(String name, IdentifierKind kind, List<String> scope) {
        if (name == null || name.isEmpty()) {
            return;
        }
        strategy.setCurrentScope(scope);
        strategy.addIdentifier(name, kind);
        collected++;
    }

    private static List<String> nested(List<String> scope, String name) {
        List<String> path = new ArrayList<>(scope);
        path.add(name);
        return path;
    }
}
