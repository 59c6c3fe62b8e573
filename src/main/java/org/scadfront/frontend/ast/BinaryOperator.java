package org.scadfront.frontend.ast;

import java.util.Optional;

/**
 * Binary operators with their binding strength. Higher precedence binds tighter.
 */
public enum BinaryOperator {
    OR("||", 1),
    AND("&&", 2),
    EQUAL("==", 3),
    NOT_EQUAL("!=", 3),
    LESS("<", 4),
    LESS_EQUAL("<=", 4),
    GREATER(">", 4),
    GREATER_EQUAL(">=", 4),
    ADD("+", 5),
    SUBTRACT("-", 5),
    MULTIPLY("*", 6),
    DIVIDE("/", 6),
    MODULO("%", 6),
    POWER("^", 7);

    private final String symbol;
    private final int precedence;

    BinaryOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    /**
     * @return True for operators that group right-to-left ({@code a ^ b ^ c == a ^ (b ^ c)}).
     */
    public boolean isRightAssociative() {
        return this == POWER;
    }

    /**
     * Maps operator text to the enumeration.
     * @param symbol The operator text as it appears in source, surrounding whitespace allowed.
     * @return The operator, or empty if the text is not a binary operator.
     */
    public static Optional<BinaryOperator> fromSymbol(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        String trimmed = symbol.trim();
        for (BinaryOperator operator : values()) {
            if (operator.symbol.equals(trimmed)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }
}
