package org.scadfront.recovery.strategies;

import java.util.List;

/**
 * Type-compatibility knowledge supplied by the caller to {@link TypeMismatchStrategy}.
 * Types are named by strings such as {@code number}, {@code string} and {@code boolean}.
 */
public interface TypeOracle {

    /**
     * @param value A runtime value.
     * @return The type name of the value.
     */
    String getType(Object value);

    /**
     * @return True if a value of {@code fromType} may be used where {@code toType} is expected.
     */
    boolean isAssignable(String fromType, String toType);

    /**
     * @param types Operand types.
     * @return A type all operands convert to, or null if there is none.
     */
    String findCommonType(List<String> types);
}
