package org.scadfront.frontend.ast;

import java.util.Objects;

/**
 * A constant value: a number, a boolean, a string or {@code undef}. Used for literal expressions
 * and for parameter default values.
 */
public final class LiteralValue {

    /**
     * The kind of constant held.
     */
    public enum Kind {
        NUMBER,
        BOOLEAN,
        STRING,
        UNDEF
    }

    private static final LiteralValue UNDEF = new LiteralValue(Kind.UNDEF, null);

    private final Kind kind;
    private final Object value;

    private LiteralValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static LiteralValue ofNumber(double number) {
        return new LiteralValue(Kind.NUMBER, number);
    }

    public static LiteralValue ofBoolean(boolean bool) {
        return new LiteralValue(Kind.BOOLEAN, bool);
    }

    public static LiteralValue ofString(String string) {
        return new LiteralValue(Kind.STRING, Objects.requireNonNull(string, "string"));
    }

    public static LiteralValue undef() {
        return UNDEF;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * @return The numeric value.
     * @throws IllegalStateException if this is not a number.
     */
    public double asNumber() {
        requireKind(Kind.NUMBER);
        return (Double) value;
    }

    /**
     * @return The boolean value.
     * @throws IllegalStateException if this is not a boolean.
     */
    public boolean asBoolean() {
        requireKind(Kind.BOOLEAN);
        return (Boolean) value;
    }

    /**
     * @return The string value, without quotes.
     * @throws IllegalStateException if this is not a string.
     */
    public String asString() {
        requireKind(Kind.STRING);
        return (String) value;
    }

    /**
     * @return The boxed value, or null for {@code undef}.
     */
    public Object rawValue() {
        return value;
    }

    private void requireKind(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Literal is " + kind + ", not " + expected);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LiteralValue other)) return false;
        return kind == other.kind && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case NUMBER, BOOLEAN -> String.valueOf(value);
            case STRING -> "\"" + value + "\"";
            case UNDEF -> "undef";
        };
    }
}
