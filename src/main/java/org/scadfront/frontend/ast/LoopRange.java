package org.scadfront.frontend.ast;

/**
 * The iterated range of a for-loop variable: either literal numeric bounds or an arbitrary expression.
 */
public sealed interface LoopRange permits LoopRange.NumericBounds, LoopRange.ExpressionRange {

    /**
     * Literal bounds {@code [start : end]}.
     *
     * @param start The first value.
     * @param end   The last value.
     */
    record NumericBounds(double start, double end) implements LoopRange {
    }

    /**
     * Any range whose bounds are not literal numbers, e.g. a vector or {@code [0 : n]}.
     *
     * @param expression The range expression.
     */
    record ExpressionRange(ExpressionNode expression) implements LoopRange {
    }
}
