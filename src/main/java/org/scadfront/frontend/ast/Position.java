package org.scadfront.frontend.ast;

/**
 * A location in source text. AST spans use 0-based line and column values, as reported by the
 * grammar runtime.
 *
 * @param line   The 0-based line index.
 * @param column The 0-based column index.
 * @param offset The 0-based character offset from the start of the source.
 */
public record Position(int line, int column, int offset) {
}
