package org.scadfront.frontend.ast;

/**
 * The source range covered by an AST node.
 *
 * @param start Inclusive start position.
 * @param end   Exclusive end position.
 */
public record SourceSpan(Position start, Position end) {

    /**
     * Checks whether another span lies completely inside this one.
     * @param other The span to test.
     * @return True if {@code other} starts at or after this span's start and ends at or before its end.
     */
    public boolean contains(SourceSpan other) {
        return other.start().offset() >= start.offset() && other.end().offset() <= end.offset();
    }

    /**
     * @return The number of characters covered.
     */
    public int length() {
        return end.offset() - start.offset();
    }
}
