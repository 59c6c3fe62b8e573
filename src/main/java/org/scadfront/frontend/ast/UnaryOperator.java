package org.scadfront.frontend.ast;

import java.util.Optional;

/**
 * Prefix operators.
 */
public enum UnaryOperator {
    NEGATE("-"),
    PLUS("+"),
    NOT("!");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static Optional<UnaryOperator> fromSymbol(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        String trimmed = symbol.trim();
        for (UnaryOperator operator : values()) {
            if (operator.symbol.equals(trimmed)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }
}
