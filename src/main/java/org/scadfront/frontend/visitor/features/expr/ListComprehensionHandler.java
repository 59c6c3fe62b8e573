package org.scadfront.frontend.visitor.features.expr;

import org.scadfront.cst.CstNode;
import org.scadfront.frontend.ast.AssignmentNode;
import org.scadfront.frontend.ast.AstNode;
import org.scadfront.frontend.ast.ExpressionNode;
import org.scadfront.frontend.ast.LetExpression;
import org.scadfront.frontend.ast.ListComprehensionExpression;
import org.scadfront.frontend.visitor.CstNodes;
import org.scadfront.frontend.visitor.ICstNodeHandler;
import org.scadfront.frontend.visitor.LegacyGrammarSupport;
import org.scadfront.frontend.visitor.VisitContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Handler for {@code list_comprehension}: {@code [for (i = range) if (cond) expr]}.
 * <p>
 * The for clause is read from a {@code list_comprehension_for} child or a {@code for_clause} field;
 * the element from the {@code expr} or {@code element} field; the filter from {@code condition}, or
 * from {@code condition} inside an {@code if_clause}. A leading {@code let (...)} wraps the result in
 * a {@link LetExpression}. Only single-iterator comprehensions have an AST form.
 */
public class ListComprehensionHandler implements ICstNodeHandler {

    private static final Logger log = LoggerFactory.getLogger(ListComprehensionHandler.class);

    private static final Set<String> CLAUSE_KINDS = Set.of(
            "list_comprehension_for", "list_comprehension_for_block", "list_comprehension_if_block",
            "let_assignment", "let_assignments");

    @Override
    public AstNode handle(CstNode node, VisitContext context) {
        CstNode forClause = node.childForFieldName("for_clause");
        if (forClause == null) {
            forClause = CstNodes.firstChildOfType(node, "list_comprehension_for");
        }
        if (forClause == null) {
            return null;
        }
        CstNode iterator = iteratorOf(forClause);
        if (iterator == null) {
            return null;
        }
        CstNode variableNode = LegacyGrammarSupport.fieldOrPosition(iterator, "iterator", 0);
        ExpressionNode range = context.visitExpression(LegacyGrammarSupport.fieldOrPosition(iterator, "range", 1));
        if (variableNode == null || range == null) {
            return null;
        }

        CstNode elementNode = elementOf(node);
        ExpressionNode element = elementNode != null ? context.visitExpression(elementNode) : null;
        if (element == null) {
            return null;
        }

        ExpressionNode condition = null;
        CstNode conditionNode = conditionOf(node);
        if (conditionNode != null) {
            condition = context.visitExpression(conditionNode);
            if (condition == null) {
                return null;
            }
        }

        ListComprehensionExpression comprehension = new ListComprehensionExpression(
                variableNode.text().trim(), range, element, condition, context.spanOf(node));

        List<AssignmentNode> prefix = LetExpressionHandler.bindings(node, context);
        if (prefix == null) {
            return null;
        }
        return prefix.isEmpty() ? comprehension : new LetExpression(prefix, comprehension, context.spanOf(node));
    }

    private static CstNode iteratorOf(CstNode forClause) {
        if (forClause.childForFieldName("iterator") != null) {
            return forClause;
        }
        List<CstNode> assignments = CstNodes.namedChildren(forClause).stream()
                .filter(child -> "list_comprehension_assignment".equals(child.type()))
                .collect(Collectors.toList());
        if (assignments.size() > 1) {
            log.debug("Comprehension at {}:{} binds {} iterators, no AST form",
                    forClause.startPoint().row() + 1, forClause.startPoint().column() + 1, assignments.size());
            return null;
        }
        return assignments.isEmpty() ? forClause : assignments.get(0);
    }

    private static CstNode elementOf(CstNode node) {
        CstNode element = node.childForFieldName("expr");
        if (element == null) {
            element = node.childForFieldName("element");
        }
        if (element != null) {
            return element;
        }
        CstNode condition = conditionOf(node);
        List<CstNode> named = CstNodes.namedChildren(node);
        for (int i = named.size() - 1; i >= 0; i--) {
            CstNode child = named.get(i);
            if (!CLAUSE_KINDS.contains(child.type()) && (condition == null || !CstNodes.sameNode(child, condition))) {
                return child;
            }
        }
        return null;
    }

    private static CstNode conditionOf(CstNode node) {
        CstNode condition = node.childForFieldName("condition");
        if (condition != null) {
            return condition;
        }
        CstNode ifClause = node.childForFieldName("if_clause");
        if (ifClause == null) {
            ifClause = CstNodes.firstChildOfType(node, "list_comprehension_if_block");
        }
        return ifClause != null ? LegacyGrammarSupport.fieldOrPosition(ifClause, "condition", 0) : null;
    }
}
