package org.scadfront.recovery.strategies;

import org.scadfront.diagnostics.ErrorCode;
import org.scadfront.diagnostics.ErrorContext;
import org.scadfront.diagnostics.ParserError;
import org.scadfront.diagnostics.ParserReferenceError;
import org.scadfront.diagnostics.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class UnknownIdentifierStrategyTest {

    private UnknownIdentifierStrategy strategy;

    @BeforeEach
    void setUp() {
        strategy = new UnknownIdentifierStrategy();
        strategy.addIdentifier("height");
        strategy.addIdentifier("length");
        strategy.addIdentifier("width");
        strategy.addIdentifier("render", IdentifierKind.MODULE);
    }

    private static ParserError undefinedVariable(String name, int line, int column) {
        return new ParserError("Undefined variable '" + name + "'", ErrorCode.UNDEFINED_VARIABLE, Severity.ERROR,
                ErrorContext.builder().position(line, column).found(name).build());
    }

    @Test
    @Tag("unit")
    void ranksCandidatesByDistanceThenName() {
        assertThat(strategy.findSimilarIdentifiers("lenght")).containsExactly("height", "length");
        assertThat(strategy.findSimilarIdentifiers("rendr")).containsExactly("render");
        assertThat(strategy.findSimilarIdentifiers("sphere")).isEmpty();
    }

    @Test
    @Tag("unit")
    void variablesWinTiesAgainstOtherKinds() {
        strategy.addIdentifier("sizes", IdentifierKind.FUNCTION);
        strategy.addIdentifier("sized");

        assertThat(strategy.findSimilarIdentifiers("size")).containsExactly("sized", "sizes");
    }

    @Test
    @Tag("unit")
    void replacesIdentifierWithBestMatchAndRecordsSuggestions() {
        ParserError error = undefinedVariable("widht", 2, 6);

        String fixed = strategy.recover(error, "x = 1;\ncube(widht);");

        assertThat(fixed).isEqualTo("x = 1;\ncube(width);");
        assertThat(error.getContext().getSuggestions()).containsExactly("width");
        assertThat(strategy.getRecoverySuggestion(error)).isEqualTo("Did you mean 'width'?");
    }

    @Test
    @Tag("unit")
    void identifierIsReadFromMessageWhenNotInContext() {
        ParserError error = new ParserReferenceError("'rendr' is not defined",
                ErrorContext.builder().position(1, 1).build());

        assertThat(strategy.canHandle(error)).isTrue();
        assertThat(strategy.recover(error, "rendr();")).isEqualTo("render();");
    }

    @Test
    @Tag("unit")
    void declinesWhenTextAtPositionDiffers() {
        assertThat(strategy.recover(undefinedVariable("widht", 1, 1), "cube(widht);")).isNull();
        assertThat(strategy.recover(undefinedVariable("zzzzzz", 1, 6), "cube(zzzzzz);")).isNull();
    }

    @Test
    @Tag("unit")
    void innerScopeNamesAreVisibleOnlyInThatScope() {
        strategy.setCurrentScope(List.of("box"));
        strategy.addIdentifier("depth");

        assertThat(strategy.findSimilarIdentifiers("dept")).containsExactly("depth");
        assertThat(strategy.findSimilarIdentifiers("lenght")).containsExactly("height", "length");

        strategy.setCurrentScope(List.of());
        assertThat(strategy.findSimilarIdentifiers("dept")).isEmpty();
    }

    @Test
    @Tag("unit")
    void sameNameKeepsEveryKind() {
        strategy.addIdentifier("gear", IdentifierKind.MODULE);
        strategy.addIdentifier("gear", IdentifierKind.VARIABLE);
        strategy.addIdentifier("gears", IdentifierKind.FUNCTION);

        assertThat(strategy.isKnown("gear", IdentifierKind.MODULE)).isTrue();
        assertThat(strategy.isKnown("gear", IdentifierKind.VARIABLE)).isTrue();
        assertThat(strategy.isKnown("gear", IdentifierKind.FUNCTION)).isFalse();
        // The name is offered once, ranked as a variable.
        assertThat(strategy.findSimilarIdentifiers("gea")).containsExactly("gear", "gears");
    }

    @Test
    @Tag("unit")
    void clearForgetsEverything() {
        strategy.setCurrentScope(List.of("box"));
        strategy.clearIdentifiers();

        assertThat(strategy.getCurrentScope()).isEmpty();
        assertThat(strategy.findSimilarIdentifiers("lenght")).isEmpty();
        assertThat(strategy.getRecoverySuggestion(undefinedVariable("x", 1, 1)))
                .isEqualTo("Check for typos or missing variable/function declarations");
    }

    @Test
    @Tag("unit")
    void recognizesReferenceCodes() {
        assertThat(strategy.canHandle(new ParserError("x", ErrorCode.UNDEFINED_MODULE))).isTrue();
        assertThat(strategy.canHandle(new ParserError("x", ErrorCode.UNDEFINED_FUNCTION))).isTrue();
        assertThat(strategy.canHandle(new ParserReferenceError("Something else"))).isFalse();
        assertThat(strategy.canHandle(new ParserError("x", ErrorCode.SYNTAX_ERROR))).isFalse();
    }
}
