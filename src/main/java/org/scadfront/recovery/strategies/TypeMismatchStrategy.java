package org.scadfront.recovery.strategies;

import org.scadfront.diagnostics.ErrorCode;
import org.scadfront.diagnostics.ErrorContext;
import org.scadfront.diagnostics.ErrorLocation;
import org.scadfront.diagnostics.ParserError;
import org.scadfront.recovery.AbstractRecoveryStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Rewrites a mis-typed value at its exact source position into an expression of the expected type.
 *
 * <p>Only {@link ErrorCode#TYPE_MISMATCH} is recovered. Invalid operations and invalid arguments are
 * recognized so that suggestions can be offered, but no rewrite is attempted for them.</p>
 *
 * <p>Not registered by default; it needs a {@link TypeOracle}.</p>
 */
public class TypeMismatchStrategy extends AbstractRecoveryStrategy {

    private static final Logger log = LoggerFactory.getLogger(TypeMismatchStrategy.class);

    private static final Pattern QUOTED_NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");

    private static final Map<String, Map<String, UnaryOperator<String>>> CONVERTERS = Map.of(
            "string", Map.<String, UnaryOperator<String>>of(
                    "number", TypeMismatchStrategy::stringToNumber,
                    "boolean", v -> "(" + v + " != \"\" && " + v + ".toLowerCase() !== \"false\")"),
            "number", Map.<String, UnaryOperator<String>>of(
                    "string", v -> "str(" + v + ")",
                    "boolean", v -> "(" + v + " != 0)"),
            "boolean", Map.<String, UnaryOperator<String>>of(
                    "string", v -> "(" + v + " ? \"true\" : \"false\")",
                    "number", v -> "(" + v + " ? 1 : 0)"));

    private final TypeOracle typeOracle;

    public TypeMismatchStrategy(TypeOracle typeOracle) {
        this.typeOracle = Objects.requireNonNull(typeOracle, "typeOracle");
    }

    @Override
    public int priority() {
        return 20;
    }

    @Override
    public boolean canHandle(ParserError error) {
        ErrorCode code = error.getCode();
        return code == ErrorCode.TYPE_MISMATCH || code == ErrorCode.INVALID_OPERATION
                || code == ErrorCode.INVALID_ARGUMENTS;
    }

    @Override
    public String recover(ParserError error, String code) {
        return switch (error.getCode()) {
            case TYPE_MISMATCH -> recoverTypeMismatch(error, code);
            case INVALID_OPERATION, INVALID_ARGUMENTS -> {
                log.debug("No automatic rewrite for [{}]", error.getCode().code());
                yield null;
            }
            default -> null;
        };
    }

    private String recoverTypeMismatch(ParserError error, String code) {
        ErrorContext context = error.getContext();
        String expected = firstExpected(context);
        String found = context.getFound();
        ErrorLocation location = context.getLocation() != null ? context.getLocation() : getErrorPosition(error);
        if (expected == null || found == null || location == null) {
            return null;
        }
        if (!canConvert(found, expected)) {
            return null;
        }
        String value = context.getValue() != null ? String.valueOf(context.getValue()) : "";
        String converted = convertValue(value, found, expected);
        if (converted == null) {
            return null;
        }
        return replaceAtPosition(code, location, value, converted);
    }

    /**
     * @return True if the types are equal, the oracle accepts the assignment, or a converter exists.
     */
    public boolean canConvert(String from, String to) {
        return from.equals(to) || typeOracle.isAssignable(from, to) || converter(from, to) != null;
    }

    /**
     * Converts value source text between types.
     * @return The converted text, or null if no conversion applies.
     */
    public String convertValue(String value, String from, String to) {
        if (from.equals(to) || typeOracle.isAssignable(from, to)) {
            return value;
        }
        UnaryOperator<String> converter = converter(from, to);
        return converter != null ? converter.apply(value) : null;
    }

    @Override
    public String getRecoverySuggestion(ParserError error) {
        ErrorContext context = error.getContext();
        return switch (error.getCode()) {
            case TYPE_MISMATCH -> "Convert " + context.getFound() + " to " + firstExpected(context);
            case INVALID_OPERATION -> "Convert operands to compatible types for " + context.getOperation()
                    + " operation (" + context.getLeftType() + " " + context.getOperation() + " "
                    + context.getRightType() + ")";
            case INVALID_ARGUMENTS -> "Convert argument "
                    + ((context.getParamIndex() != null ? context.getParamIndex() : 0) + 1)
                    + " of " + context.getFunctionName() + "() from " + context.getFound()
                    + " to " + firstExpected(context);
            default -> "Fix type mismatch";
        };
    }

    private static String replaceAtPosition(String code, ErrorLocation location, String oldText, String newText) {
        String[] lines = splitLines(code);
        if (location.line() < 1 || location.line() > lines.length) {
            return null;
        }
        String target = lines[location.line() - 1];
        int start = location.column() - 1;
        if (start < 0 || start > target.length() || !target.startsWith(oldText, start)) {
            return null;
        }
        if (oldText.equals(newText)) {
            return null;
        }
        lines[location.line() - 1] = target.substring(0, start) + newText + target.substring(start + oldText.length());
        return String.join("\n", lines);
    }

    private static UnaryOperator<String> converter(String from, String to) {
        return CONVERTERS.getOrDefault(from, Map.of()).get(to);
    }

    private static String firstExpected(ErrorContext context) {
        List<String> expected = context.getExpected();
        return expected == null || expected.isEmpty() ? null : expected.get(0);
    }

    private static String stringToNumber(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            String inner = value.substring(1, value.length() - 1);
            if (QUOTED_NUMBER.matcher(inner).matches()) {
                return inner;
            }
        }
        return "parseFloat(" + value + ")";
    }
}
