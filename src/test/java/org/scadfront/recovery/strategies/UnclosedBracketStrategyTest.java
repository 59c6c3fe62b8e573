package org.scadfront.recovery.strategies;

import org.scadfront.diagnostics.ErrorCode;
import org.scadfront.diagnostics.ErrorContext;
import org.scadfront.diagnostics.ParserError;
import org.scadfront.diagnostics.ParserSyntaxError;
import org.scadfront.diagnostics.Severity;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class UnclosedBracketStrategyTest {

    private final UnclosedBracketStrategy strategy = new UnclosedBracketStrategy();

    private static ParserError error(ErrorCode code, int line, int column) {
        return new ParserError("Missing closing bracket", code, Severity.ERROR,
                ErrorContext.builder().position(line, column).build());
    }

    @Test
    @Tag("unit")
    void closesInnermostOpenBracketAtErrorColumn() {
        String fixed = strategy.recover(error(ErrorCode.UNCLOSED_BRACKET, 1, 17), "translate([1,2,3) cube(5);");

        assertThat(fixed).isEqualTo("translate([1,2,3]) cube(5);");
    }

    @Test
    @Tag("unit")
    void closesParenthesisAtEndOfLine() {
        String fixed = strategy.recover(error(ErrorCode.UNCLOSED_PAREN, 2, 13), "x = 1;\nsphere(r = 2;");

        assertThat(fixed).isEqualTo("x = 1;\nsphere(r = 2);");
    }

    @Test
    @Tag("unit")
    void declinesBalancedLine() {
        assertThat(strategy.recover(error(ErrorCode.UNCLOSED_BRACE, 1, 8), "cube(1);")).isNull();
        assertThat(strategy.recover(error(ErrorCode.UNCLOSED_BRACE, 3, 1), "cube(1);")).isNull();
    }

    @Test
    @Tag("unit")
    void recognizesCodesAndSyntaxMessages() {
        assertThat(strategy.canHandle(error(ErrorCode.UNCLOSED_PAREN, 1, 1))).isTrue();
        assertThat(strategy.canHandle(new ParserSyntaxError("missing ']'"))).isTrue();
        assertThat(strategy.canHandle(new ParserSyntaxError("unexpected ']'"))).isFalse();
        assertThat(strategy.canHandle(error(ErrorCode.MISSING_SEMICOLON, 1, 1))).isFalse();
    }

    @Test
    @Tag("unit")
    void suggestionNamesTheBracketKind() {
        assertThat(strategy.getRecoverySuggestion(error(ErrorCode.UNCLOSED_PAREN, 1, 1)))
                .isEqualTo("Insert missing closing parenthesis");
        assertThat(strategy.getRecoverySuggestion(error(ErrorCode.UNCLOSED_BRACE, 1, 1)))
                .isEqualTo("Insert missing closing brace");
        assertThat(strategy.getRecoverySuggestion(new ParserSyntaxError("missing ]")))
                .isEqualTo("Insert missing closing bracket");
    }
}
