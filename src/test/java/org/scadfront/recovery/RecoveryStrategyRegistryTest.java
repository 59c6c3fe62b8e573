package org.scadfront.recovery;

import org.scadfront.diagnostics.ErrorCode;
import org.scadfront.diagnostics.ErrorContext;
import org.scadfront.diagnostics.ParserError;
import org.scadfront.diagnostics.Severity;
import org.scadfront.recovery.strategies.MissingSemicolonStrategy;
import org.scadfront.recovery.strategies.UnclosedBracketStrategy;
import org.scadfront.recovery.strategies.UnknownIdentifierStrategy;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class RecoveryStrategyRegistryTest {

    private static ParserError missingSemicolon() {
        return new ParserError("Missing semicolon", ErrorCode.MISSING_SEMICOLON, Severity.ERROR,
                ErrorContext.builder().position(1, 9).build());
    }

    @Test
    @Tag("unit")
    void registersDefaultStrategiesInOrder() {
        RecoveryStrategyRegistry registry = new RecoveryStrategyRegistry();

        assertThat(registry.getStrategies()).hasExactlyElementsOfTypes(
                MissingSemicolonStrategy.class, UnclosedBracketStrategy.class, UnknownIdentifierStrategy.class);
        assertThat(registry.getStrategy(UnknownIdentifierStrategy.class)).isPresent();
    }

    @Test
    @Tag("unit")
    void recoversThroughMatchingStrategy() {
        RecoveryStrategyRegistry registry = new RecoveryStrategyRegistry();

        assertThat(registry.attemptRecovery(missingSemicolon(), "cube(10)\nsphere(5);"))
                .isEqualTo("cube(10);\nsphere(5);");
        assertThat(registry.canRecover(missingSemicolon())).isTrue();
        assertThat(registry.findStrategy(missingSemicolon())).containsInstanceOf(MissingSemicolonStrategy.class);
    }

    @Test
    @Tag("unit")
    void failingStrategyIsSkipped() {
        RecoveryStrategy failing = mock(RecoveryStrategy.class);
        when(failing.canHandle(any())).thenReturn(true);
        when(failing.recover(any(), anyString())).thenThrow(new IllegalStateException("boom"));
        when(failing.getRecoverySuggestion(any())).thenThrow(new IllegalStateException("boom"));

        RecoveryStrategyRegistry registry = new RecoveryStrategyRegistry();
        registry.clear();
        registry.register(failing);
        registry.register(new MissingSemicolonStrategy());

        assertThat(registry.attemptRecovery(missingSemicolon(), "cube(10)\nsphere(5);"))
                .isEqualTo("cube(10);\nsphere(5);");
        assertThat(registry.getRecoverySuggestions(missingSemicolon())).containsExactly("Insert missing semicolon");
        verify(failing).recover(any(), anyString());
    }

    @Test
    @Tag("unit")
    void suggestionsComeFromEveryHandlingStrategyInOrder() {
        RecoveryStrategy first = mock(RecoveryStrategy.class);
        RecoveryStrategy unrelated = mock(RecoveryStrategy.class);
        RecoveryStrategy second = mock(RecoveryStrategy.class);
        when(first.canHandle(any())).thenReturn(true);
        when(first.getRecoverySuggestion(any())).thenReturn("Insert ';' after the call");
        when(unrelated.canHandle(any())).thenReturn(false);
        when(second.canHandle(any())).thenReturn(true);
        when(second.getRecoverySuggestion(any())).thenReturn("Join with the next line");

        RecoveryStrategyRegistry registry = new RecoveryStrategyRegistry();
        registry.clear();
        registry.registerMultiple(List.of(first, unrelated, second));

        assertThat(registry.getRecoverySuggestions(missingSemicolon()))
                .containsExactly("Insert ';' after the call", "Join with the next line");
        verify(unrelated, never()).getRecoverySuggestion(any());
    }

    @Test
    @Tag("unit")
    void resultEqualToInputIsNotARecovery() {
        RecoveryStrategy echoing = mock(RecoveryStrategy.class);
        when(echoing.canHandle(any())).thenReturn(true);
        when(echoing.recover(any(), anyString())).thenAnswer(invocation -> invocation.getArgument(1));

        RecoveryStrategyRegistry registry = new RecoveryStrategyRegistry();
        registry.clear();
        registry.register(echoing);

        assertThat(registry.attemptRecovery(missingSemicolon(), "cube(1);")).isNull();
    }

    @Test
    @Tag("unit")
    void registrationIsIdempotentPerInstance() {
        RecoveryStrategyRegistry registry = new RecoveryStrategyRegistry();
        MissingSemicolonStrategy extra = new MissingSemicolonStrategy();

        registry.register(extra);
        registry.register(extra);
        assertThat(registry.getStrategyCount()).isEqualTo(4);

        registry.unregister(extra);
        assertThat(registry.getStrategyCount()).isEqualTo(3);
    }

    @Test
    @Tag("unit")
    void copySharesInstancesButNotTheList() {
        RecoveryStrategyRegistry registry = new RecoveryStrategyRegistry();
        RecoveryStrategyRegistry copy = registry.copy();

        copy.clear();

        assertThat(registry.getStrategyCount()).isEqualTo(3);
        assertThat(registry.copy().getStrategies()).containsExactlyElementsOf(registry.getStrategies());
    }

    @Test
    @Tag("unit")
    void unknownErrorHasNoRecovery() {
        RecoveryStrategyRegistry registry = new RecoveryStrategyRegistry();
        ParserError internal = new ParserError("bug", ErrorCode.INTERNAL_ERROR);

        assertThat(registry.canRecover(internal)).isFalse();
        assertThat(registry.attemptRecovery(internal, "x")).isNull();
        assertThat(registry.getRecoverySuggestions(internal)).isEmpty();
    }
}
