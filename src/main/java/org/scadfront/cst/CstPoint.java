package org.scadfront.cst;

/**
 * A 0-based row/column position inside a concrete syntax tree, as reported by the grammar runtime.
 *
 * @param row    The 0-based line index.
 * @param column The 0-based column index within the row.
 */
public record CstPoint(int row, int column) {
}
