package org.scadfront.frontend.visitor.features.expr;

import org.scadfront.cst.CstNode;
import org.scadfront.diagnostics.ErrorCode;
import org.scadfront.frontend.ast.AssignmentNode;
import org.scadfront.frontend.ast.AstNode;
import org.scadfront.frontend.ast.ExpressionNode;
import org.scadfront.frontend.ast.LetExpression;
import org.scadfront.frontend.visitor.CstNodes;
import org.scadfront.frontend.visitor.ICstNodeHandler;
import org.scadfront.frontend.visitor.LegacyGrammarSupport;
import org.scadfront.frontend.visitor.VisitContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Handler for {@code let_expression}: {@code let (a = 1, b = 2) body}. Bindings may sit directly
 * under the node or inside a {@code let_assignments} list.
 */
public class LetExpressionHandler implements ICstNodeHandler {

    private static final Logger log = LoggerFactory.getLogger(LetExpressionHandler.class);

    @Override
    public AstNode handle(CstNode node, VisitContext context) {
        List<AssignmentNode> assignments = bindings(node, context);
        if (assignments == null) {
            return null;
        }
        CstNode bodyNode = node.childForFieldName("body");
        if (bodyNode == null) {
            bodyNode = lastNonBinding(node);
        }
        if (bodyNode == null) {
            log.debug("[{}] let at {}:{} has no body", ErrorCode.MISSING_LET_BODY.code(),
                    node.startPoint().row() + 1, node.startPoint().column() + 1);
            return null;
        }
        ExpressionNode body = context.visitExpression(bodyNode);
        if (body == null) {
            log.debug("[{}] let body '{}' did not build", ErrorCode.LET_BODY_EXPRESSION_PARSE_FAILED.code(),
                    bodyNode.text());
            return null;
        }
        return new LetExpression(assignments, body, context.spanOf(node));
    }

    /**
     * Builds the {@code let_assignment} children of a node, also those grouped under
     * {@code let_assignments}.
     *
     * @param node    A let expression, or a list comprehension with a let prefix.
     * @param context The visit context.
     * @return The bindings in source order; empty if the node has none; null if one did not build.
     */
    static List<AssignmentNode> bindings(CstNode node, VisitContext context) {
        List<CstNode> assignmentNodes = new ArrayList<>();
        for (CstNode child : CstNodes.namedChildren(node)) {
            if ("let_assignment".equals(child.type())) {
                assignmentNodes.add(child);
            } else if ("let_assignments".equals(child.type())) {
                assignmentNodes.addAll(CstNodes.namedChildren(child));
            }
        }
        if (assignmentNodes.isEmpty() && "let_expression".equals(node.type())) {
            log.debug("[{}] let at {}:{} binds nothing", ErrorCode.LET_NO_ASSIGNMENTS_FOUND.code(),
                    node.startPoint().row() + 1, node.startPoint().column() + 1);
            return null;
        }
        List<AssignmentNode> assignments = new ArrayList<>(assignmentNodes.size());
        for (CstNode assignmentNode : assignmentNodes) {
            CstNode nameNode = LegacyGrammarSupport.fieldOrPosition(assignmentNode, "name", 0);
            CstNode valueNode = LegacyGrammarSupport.fieldOrPosition(assignmentNode, "value", 1);
            ExpressionNode value = valueNode != null ? context.visitExpression(valueNode) : null;
            if (nameNode == null || value == null) {
                log.debug("[{}] let binding '{}' did not build", ErrorCode.LET_ASSIGNMENT_PROCESSING_FAILED.code(),
                        assignmentNode.text());
                return null;
            }
            assignments.add(new AssignmentNode(nameNode.text().trim(), value, context.spanOf(assignmentNode)));
        }
        return assignments;
    }

    private static CstNode lastNonBinding(CstNode node) {
        List<CstNode> named = CstNodes.namedChildren(node);
        for (int i = named.size() - 1; i >= 0; i--) {
            String type = named.get(i).type();
            if (!"let_assignment".equals(type) && !"let_assignments".equals(type)) {
                return named.get(i);
            }
        }
        return null;
    }
}
