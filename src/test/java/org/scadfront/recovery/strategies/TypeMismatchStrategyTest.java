package org.scadfront.recovery.strategies;

import org.scadfront.diagnostics.ErrorCode;
import org.scadfront.diagnostics.ErrorContext;
import org.scadfront.diagnostics.ErrorLocation;
import org.scadfront.diagnostics.ParserError;
import org.scadfront.diagnostics.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class TypeMismatchStrategyTest {

    @Mock
    private TypeOracle typeOracle;

    private TypeMismatchStrategy strategy;

    @BeforeEach
    void setUp() {
        strategy = new TypeMismatchStrategy(typeOracle);
    }

    private static ParserError mismatch(String found, String expected, Object value, int line, int column) {
        return new ParserError("Type mismatch", ErrorCode.TYPE_MISMATCH, Severity.ERROR, ErrorContext.builder()
                .found(found)
                .expected(List.of(expected))
                .value(value)
                .location(new ErrorLocation(line, column))
                .build());
    }

    @Test
    @Tag("unit")
    void quotedNumberBecomesNumberLiteral() {
        String fixed = strategy.recover(mismatch("string", "number", "\"42\"", 1, 5), "x = \"42\";");

        assertThat(fixed).isEqualTo("x = 42;");
    }

    @Test
    @Tag("unit")
    void numberIsWrappedForStringContext() {
        String fixed = strategy.recover(mismatch("number", "string", "7", 2, 12), "a = 1;\necho(\"n\" + 7);");

        assertThat(fixed).isEqualTo("a = 1;\necho(\"n\" + str(7));");
    }

    @Test
    @Tag("unit")
    void oracleDecidesAssignability() {
        when(typeOracle.isAssignable("vector", "string")).thenReturn(true);

        assertThat(strategy.canConvert("vector", "string")).isTrue();
        assertThat(strategy.convertValue("[1]", "vector", "string")).isEqualTo("[1]");
        verify(typeOracle, times(2)).isAssignable("vector", "string");
    }

    @Test
    @Tag("unit")
    void unchangedTextIsNotARecovery() {
        assertThat(strategy.convertValue("3", "number", "number")).isEqualTo("3");
        assertThat(strategy.recover(mismatch("number", "number", "3", 1, 5), "x = 3;")).isNull();
    }

    @Test
    @Tag("unit")
    void declinesWhenValueIsNotAtLocation() {
        assertThat(strategy.recover(mismatch("string", "number", "\"42\"", 1, 1), "x = \"42\";")).isNull();
        assertThat(strategy.recover(mismatch("vector", "number", "[1]", 1, 5), "x = [1];")).isNull();
    }

    @Test
    @Tag("unit")
    void operationErrorsGetSuggestionsButNoRewrite() {
        ParserError operation = new ParserError("Invalid operation", ErrorCode.INVALID_OPERATION, Severity.ERROR,
                ErrorContext.builder().operation("+").leftType("string").rightType("number").build());
        ParserError arguments = new ParserError("Invalid arguments", ErrorCode.INVALID_ARGUMENTS, Severity.ERROR,
                ErrorContext.builder().functionName("cube").paramIndex(0).found("string")
                        .expected(List.of("number")).build());

        assertThat(strategy.canHandle(operation)).isTrue();
        assertThat(strategy.recover(operation, "x = \"a\" + 1;")).isNull();
        assertThat(strategy.getRecoverySuggestion(operation))
                .isEqualTo("Convert operands to compatible types for + operation (string + number)");
        assertThat(strategy.recover(arguments, "cube(\"1\");")).isNull();
        assertThat(strategy.getRecoverySuggestion(arguments))
                .isEqualTo("Convert argument 1 of cube() from string to number");
        assertThat(strategy.canHandle(new ParserError("x", ErrorCode.MISSING_SEMICOLON))).isFalse();
    }
}
