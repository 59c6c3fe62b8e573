package org.scadfront.cst;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only view of a node in a concrete syntax tree produced by an external grammar-driven parser.
 * This interface decouples the AST construction layer from the concrete grammar runtime; host
 * adapters expose their parser's nodes through it.
 *
 * <p>Nodes are immutable for the lifetime of a parse. Named children are the grammar's visible
 * nodes; anonymous children are punctuation and keyword tokens.</p>
 */
public interface CstNode {

    /** Node kind used by the grammar to mark unparseable input. */
    String ERROR_TYPE = "ERROR";

    /**
     * @return The grammar node kind, e.g. {@code binary_expression}.
     */
    String type();

    /**
     * @return The exact source text covered by this node.
     */
    String text();

    /**
     * @return The number of children, named and anonymous.
     */
    int childCount();

    /**
     * Returns a child by position.
     * @param index The 0-based child index.
     * @return The child, or null if the index is out of range.
     */
    CstNode child(int index);

    /**
     * @return The number of named children.
     */
    int namedChildCount();

    /**
     * Returns a named child by position among the named children.
     * @param index The 0-based index among named children.
     * @return The named child, or null if the index is out of range.
     */
    CstNode namedChild(int index);

    /**
     * Looks up a child by grammar field name.
     * @param fieldName The field name, e.g. {@code left}.
     * @return The child bound to the field, or null if the grammar did not assign it.
     */
    CstNode childForFieldName(String fieldName);

    /**
     * @return Start position (0-based row and column).
     */
    CstPoint startPoint();

    /**
     * @return End position (0-based row and column, exclusive).
     */
    CstPoint endPoint();

    /**
     * @return Offset of the first character of this node in the source.
     */
    int startByte();

    /**
     * @return Offset one past the last character of this node in the source.
     */
    int endByte();

    /**
     * @return True if this node is a named grammar node rather than an anonymous token.
     */
    boolean isNamed();

    /**
     * @return True if the grammar inserted this zero-width node while recovering from an error.
     */
    boolean isMissing();

    /**
     * @return True if this node marks unparseable input.
     */
    default boolean isError() {
        return ERROR_TYPE.equals(type());
    }

    /**
     * @return All children in source order.
     */
    default List<CstNode> children() {
        List<CstNode> result = new ArrayList<>(childCount());
        for (int i = 0; i < childCount(); i++) {
            CstNode child = child(i);
            if (child != null) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * @return Named children in source order.
     */
    default List<CstNode> namedChildren() {
        List<CstNode> result = new ArrayList<>(namedChildCount());
        for (int i = 0; i < namedChildCount(); i++) {
            CstNode child = namedChild(i);
            if (child != null) {
                result.add(child);
            }
        }
        return result;
    }
}
