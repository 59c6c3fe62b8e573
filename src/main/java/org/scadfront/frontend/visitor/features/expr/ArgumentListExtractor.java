package org.scadfront.frontend.visitor.features.expr;

import org.scadfront.cst.CstNode;
import org.scadfront.frontend.ast.Argument;
import org.scadfront.frontend.ast.ExpressionNode;
import org.scadfront.frontend.visitor.CstNodes;
import org.scadfront.frontend.visitor.VisitContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts positional and named arguments from an {@code argument_list} or {@code arguments} node.
 */
public final class ArgumentListExtractor {

    private ArgumentListExtractor() {
    }

    /**
     * @param node    The {@code argument_list} or {@code arguments} node; null means no arguments.
     * @param context The visit context for argument values.
     * @return The arguments in source order, or null if any argument value cannot be built.
     */
    public static List<Argument> extract(CstNode node, VisitContext context) {
        List<Argument> arguments = new ArrayList<>();
        if (node == null) {
            return arguments;
        }
        if ("argument_list".equals(node.type())) {
            CstNode inner = CstNodes.firstChildOfType(node, "arguments");
            if (inner != null) {
                node = inner;
            }
        }
        for (CstNode child : CstNodes.namedChildren(node)) {
            Argument argument = "argument".equals(child.type())
                    ? argument(child, context)
                    : positional(child, context);
            if (argument == null) {
                return null;
            }
            arguments.add(argument);
        }
        return arguments;
    }

    private static Argument argument(CstNode node, VisitContext context) {
        CstNode nameNode = node.childForFieldName("name");
        CstNode valueNode = node.childForFieldName("value");
        if (valueNode == null) {
            List<CstNode> named = CstNodes.namedChildren(node);
            if (named.size() == 2 && hasEqualsToken(node)) {
                nameNode = named.get(0);
                valueNode = named.get(1);
            } else if (named.size() == 1) {
                valueNode = named.get(0);
            } else {
                return null;
            }
        }
        ExpressionNode value = context.visitExpression(valueNode);
        if (value == null) {
            return null;
        }
        return new Argument(nameNode != null ? nameNode.text().trim() : null, value);
    }

    private static Argument positional(CstNode node, VisitContext context) {
        ExpressionNode value = context.visitExpression(node);
        return value == null ? null : Argument.positional(value);
    }

    private static boolean hasEqualsToken(CstNode node) {
        for (CstNode child : node.children()) {
            if (!child.isNamed() && "=".equals(child.text())) {
                return true;
            }
        }
        return false;
    }
}
