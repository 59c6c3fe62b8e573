package org.scadfront.frontend.visitor.features.loop;

import org.scadfront.cst.CstNode;
import org.scadfront.frontend.ast.AstNode;
import org.scadfront.frontend.ast.ForLoopNode;
import org.scadfront.frontend.ast.ForLoopVariable;
import org.scadfront.frontend.ast.StatementNode;
import org.scadfront.frontend.visitor.CstNodes;
import org.scadfront.frontend.visitor.ICstNodeHandler;
import org.scadfront.frontend.visitor.LegacyGrammarSupport;
import org.scadfront.frontend.visitor.VisitContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Handler for {@code for_statement}. Iterators are read from the statement's own
 * {@code iterator}/{@code range} fields, from {@code for_header} or {@code for_assignment} children,
 * or, failing all of those, from the header text.
 */
public class ForStatementHandler implements ICstNodeHandler {

    private static final Set<String> HEADER_TYPES = Set.of("for_header", "for_assignment");

    @Override
    public AstNode handle(CstNode node, VisitContext context) {
        List<ForLoopVariable> variables = new ArrayList<>();
        CstNode iteratorEnd = null;

        CstNode iterator = node.childForFieldName("iterator");
        if (iterator != null) {
            CstNode range = rangeAfter(node, iterator);
            addIfPresent(variables, ForRangeExtractor.extract(iterator, range, context));
            iteratorEnd = range != null ? range : iterator;
        }
        for (CstNode child : CstNodes.namedChildren(node)) {
            if (HEADER_TYPES.contains(child.type())) {
                CstNode headerIterator = child.childForFieldName("iterator");
                if (headerIterator == null) {
                    headerIterator = CstNodes.namedChildren(child).isEmpty() ? null : CstNodes.namedChildren(child).get(0);
                }
                addIfPresent(variables, ForRangeExtractor.extract(headerIterator, rangeAfter(child, headerIterator), context));
                iteratorEnd = child;
            }
        }
        if (variables.isEmpty()) {
            variables.addAll(LegacyGrammarSupport.splitIteratorText(node.text()));
        }
        if (variables.isEmpty()) {
            return null;
        }

        List<StatementNode> body = context.visitBody(bodyNode(node, iteratorEnd));
        return new ForLoopNode(variables, body, context.spanOf(node));
    }

    private static CstNode rangeAfter(CstNode parent, CstNode iterator) {
        if (iterator == null) {
            return null;
        }
        CstNode range = parent.childForFieldName("range");
        return range != null ? range : CstNodes.nextNamedSibling(parent, iterator);
    }

    private static CstNode bodyNode(CstNode node, CstNode iteratorEnd) {
        CstNode body = node.childForFieldName("body");
        if (body != null) {
            return body;
        }
        List<CstNode> named = CstNodes.namedChildren(node);
        if (named.isEmpty()) {
            return null;
        }
        CstNode last = named.get(named.size() - 1);
        if (iteratorEnd != null && last.startByte() < iteratorEnd.endByte()) {
            return null;
        }
        return HEADER_TYPES.contains(last.type()) ? null : last;
    }

    private static void addIfPresent(List<ForLoopVariable> variables, ForLoopVariable variable) {
        if (variable != null) {
            variables.add(variable);
        }
    }
}
