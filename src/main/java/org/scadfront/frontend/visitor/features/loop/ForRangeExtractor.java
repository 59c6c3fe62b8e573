package org.scadfront.frontend.visitor.features.loop;

import org.scadfront.cst.CstNode;
import org.scadfront.frontend.ast.ExpressionNode;
import org.scadfront.frontend.ast.ForLoopVariable;
import org.scadfront.frontend.ast.LoopRange;
import org.scadfront.frontend.visitor.CstNodes;
import org.scadfront.frontend.visitor.VisitContext;
import org.scadfront.frontend.visitor.features.expr.LiteralClassifier;

import java.util.List;
import java.util.Set;

/**
 * Builds a {@link ForLoopVariable} from an iterator name node and its range node. Ranges with
 * literal numeric bounds become {@link LoopRange.NumericBounds}, with the step of a three-part range
 * moved to {@link ForLoopVariable#step()}; anything else is kept as an expression.
 */
final class ForRangeExtractor {

    private static final Set<String> WRAPPERS = Set.of("expression", "primary_expression", "array_literal",
            "conditional_expression", "logical_or_expression", "logical_and_expression", "equality_expression",
            "relational_expression", "additive_expression", "multiplicative_expression",
            "exponentiation_expression", "unary_expression", "accessor_expression");

    private ForRangeExtractor() {
    }

    static ForLoopVariable extract(CstNode iterator, CstNode range, VisitContext context) {
        if (iterator == null || range == null) {
            return null;
        }
        String name = iterator.text().trim();
        if (name.isEmpty()) {
            return null;
        }

        CstNode rangeNode = unwrap(range);
        if ("range_expression".equals(rangeNode.type())) {
            ForLoopVariable numeric = numericRange(name, rangeNode);
            if (numeric != null) {
                return numeric;
            }
        }
        ExpressionNode expression = context.visitExpression(range);
        return expression == null ? null : new ForLoopVariable(name, new LoopRange.ExpressionRange(expression), null);
    }

    private static ForLoopVariable numericRange(String name, CstNode rangeNode) {
        CstNode start = rangeNode.childForFieldName("start");
        CstNode step = rangeNode.childForFieldName("step");
        CstNode end = rangeNode.childForFieldName("end");
        if (start == null || end == null) {
            List<CstNode> named = CstNodes.namedChildren(rangeNode);
            if (named.size() == 2) {
                start = named.get(0);
                end = named.get(1);
            } else if (named.size() == 3) {
                start = named.get(0);
                step = named.get(1);
                end = named.get(2);
            } else {
                return null;
            }
        }
        if (!isNumeric(start) || !isNumeric(end) || (step != null && !isNumeric(step))) {
            return null;
        }
        return new ForLoopVariable(name,
                new LoopRange.NumericBounds(parse(start), parse(end)),
                step != null ? parse(step) : null);
    }

    private static CstNode unwrap(CstNode node) {
        CstNode current = node;
        while (WRAPPERS.contains(current.type()) && CstNodes.namedChildren(current).size() == 1) {
            current = CstNodes.namedChildren(current).get(0);
        }
        return current;
    }

    private static boolean isNumeric(CstNode node) {
        return LiteralClassifier.isNumber(compact(node));
    }

    private static double parse(CstNode node) {
        return Double.parseDouble(compact(node));
    }

    // Unary minus is a separate token in the tree but belongs to the bound.
    private static String compact(CstNode node) {
        return node.text().replaceAll("\\s+", "");
    }
}
