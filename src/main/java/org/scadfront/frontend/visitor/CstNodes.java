package org.scadfront.frontend.visitor;

import org.scadfront.cst.CstNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Small queries over CST children shared by the node handlers.
 */
public final class CstNodes {

    private CstNodes() {
    }

    public static boolean isComment(CstNode node) {
        return node != null && "comment".equals(node.type());
    }

    /**
     * @param node The parent node.
     * @return Named children in source order, comments excluded.
     */
    public static List<CstNode> namedChildren(CstNode node) {
        List<CstNode> result = new ArrayList<>();
        for (CstNode child : node.namedChildren()) {
            if (!isComment(child)) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * @param node The parent node.
     * @return All children in source order, comments excluded.
     */
    public static List<CstNode> children(CstNode node) {
        List<CstNode> result = new ArrayList<>();
        for (CstNode child : node.children()) {
            if (!isComment(child)) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * @param node The parent node.
     * @param type The node kind to look for.
     * @return The first direct child of that kind, or null.
     */
    public static CstNode firstChildOfType(CstNode node, String type) {
        for (CstNode child : node.children()) {
            if (type.equals(child.type())) {
                return child;
            }
        }
        return null;
    }

    /**
     * Returns the named child after a given child.
     * @param node  The parent node.
     * @param after The child to start after.
     * @return The next named, non-comment child, or null.
     */
    public static CstNode nextNamedSibling(CstNode node, CstNode after) {
        List<CstNode> named = namedChildren(node);
        for (int i = 0; i < named.size() - 1; i++) {
            if (sameNode(named.get(i), after)) {
                return named.get(i + 1);
            }
        }
        return null;
    }

    /**
     * Compares nodes by kind and range, since grammar runtimes may hand out a fresh wrapper per lookup.
     * @param a The first node.
     * @param b The second node.
     * @return True if both denote the same tree position.
     */
    public static boolean sameNode(CstNode a, CstNode b) {
        if (a == b) {
            return true;
        }
        if (a == null || b == null) {
            return false;
        }
        return a.startByte() == b.startByte() && a.endByte() == b.endByte() && a.type().equals(b.type());
    }

    /**
     * @param node The node.
     * @return True if the node has exactly one child and it is named, as for grammar rules that only
     *         forward to a higher-precedence rule.
     */
    public static boolean isPassThrough(CstNode node) {
        List<CstNode> all = children(node);
        return all.size() == 1 && all.get(0).isNamed();
    }
}
