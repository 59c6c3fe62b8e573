package org.scadfront.diagnostics;

/**
 * A 1-based line and column pair attached to an error.
 *
 * @param line   The 1-based line.
 * @param column The 1-based column.
 */
public record ErrorLocation(int line, int column) {
}
