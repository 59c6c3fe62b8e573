package org.scadfront.frontend.ast;

/**
 * One iterator of a for-loop.
 *
 * @param variable The loop variable name.
 * @param range    The iterated range.
 * @param step     The step of a literal {@code [start : step : end]} range, or null.
 */
public record ForLoopVariable(String variable, LoopRange range, Double step) {

    public boolean hasStep() {
        return step != null;
    }
}
