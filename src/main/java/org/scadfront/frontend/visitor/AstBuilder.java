package org.scadfront.frontend.visitor;

import org.scadfront.cst.CstNode;
import org.scadfront.frontend.ast.AstNode;
import org.scadfront.frontend.ast.ExpressionNode;
import org.scadfront.frontend.ast.Position;
import org.scadfront.frontend.ast.SourceSpan;
import org.scadfront.frontend.ast.StatementNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns a concrete syntax tree into the AST by dispatching each CST node to the handler
 * registered for its kind.
 *
 * <p>Construction is silent: unknown kinds, {@code ERROR} nodes and nodes missing a required part
 * produce {@code null} and are dropped from their parent. Diagnostics for such input are raised
 * separately (see {@link org.scadfront.diagnostics.CstErrorScanner}).</p>
 */
public class AstBuilder implements VisitContext {

    private static final Logger log = LoggerFactory.getLogger(AstBuilder.class);

    private final CstHandlerRegistry registry;

    /**
     * Creates a builder with all built-in handlers.
     */
    public AstBuilder() {
        this(CstHandlerRegistry.initialize());
    }

    /**
     * Creates a builder backed by the given registry.
     * @param registry The handler registry.
     */
    public AstBuilder(CstHandlerRegistry registry) {
        this.registry = registry;
    }

    /**
     * Builds the statements of a whole program.
     * @param root The {@code source_file} node, or any node producing statements.
     * @return The statements in source order; never null.
     */
    public List<StatementNode> buildProgram(CstNode root) {
        if (root == null) {
            return List.of();
        }
        if ("source_file".equals(root.type())) {
            return collectStatements(root);
        }
        return visitBody(root);
    }

    @Override
    public AstNode visit(CstNode node) {
        if (node == null) {
            return null;
        }
        if (node.isError() || node.isMissing()) {
            log.debug("Skipping {} node '{}' at {}:{}", node.isError() ? "error" : "missing",
                    node.type(), node.startPoint().row() + 1, node.startPoint().column() + 1);
            return null;
        }
        if (CstNodes.isComment(node)) {
            return null;
        }
        Optional<ICstNodeHandler> handler = registry.get(node.type());
        if (handler.isEmpty()) {
            log.debug("No handler for CST node kind '{}'", node.type());
            return null;
        }
        try {
            AstNode result = handler.get().handle(node, this);
            if (result == null) {
                log.debug("Dropped incomplete '{}' node at {}:{}", node.type(),
                        node.startPoint().row() + 1, node.startPoint().column() + 1);
            }
            return result;
        } catch (RuntimeException e) {
            log.warn("Handler for '{}' failed at {}:{}, node dropped", node.type(),
                    node.startPoint().row() + 1, node.startPoint().column() + 1, e);
            return null;
        }
    }

    @Override
    public ExpressionNode visitExpression(CstNode node) {
        AstNode result = visit(node);
        return result instanceof ExpressionNode expression ? expression : null;
    }

    @Override
    public List<StatementNode> visitBody(CstNode node) {
        if (node == null) {
            return List.of();
        }
        if ("block".equals(node.type())) {
            return collectStatements(node);
        }
        AstNode result = visit(node);
        return result instanceof StatementNode statement ? List.of(statement) : List.of();
    }

    @Override
    public SourceSpan spanOf(CstNode node) {
        return new SourceSpan(
                new Position(node.startPoint().row(), node.startPoint().column(), node.startByte()),
                new Position(node.endPoint().row(), node.endPoint().column(), node.endByte()));
    }

    private List<StatementNode> collectStatements(CstNode container) {
        List<StatementNode> statements = new ArrayList<>();
        for (CstNode child : container.namedChildren()) {
            AstNode result = visit(child);
            if (result instanceof StatementNode statement) {
                statements.add(statement);
            }
        }
        return statements;
    }
}
