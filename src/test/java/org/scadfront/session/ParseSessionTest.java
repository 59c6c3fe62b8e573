package org.scadfront.session;

import com.typesafe.config.ConfigFactory;
import org.scadfront.cst.FixtureCstParser;
import org.scadfront.diagnostics.ErrorCode;
import org.scadfront.diagnostics.ErrorContext;
import org.scadfront.diagnostics.ErrorHandlerOptions;
import org.scadfront.diagnostics.ParserError;
import org.scadfront.diagnostics.ParserReferenceError;
import org.scadfront.diagnostics.logging.LoggerOptions;
import org.scadfront.frontend.ast.ModuleInstantiationNode;
import org.scadfront.recovery.strategies.UnknownIdentifierStrategy;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ParseSessionTest {

    private static ParseSession lenientSession(boolean attemptRecovery) {
        return new ParseSession(ErrorHandlerOptions.builder()
                .throwErrors(false)
                .attemptRecovery(attemptRecovery)
                .loggerOptions(LoggerOptions.builder().enabled(false).build())
                .build());
    }

    private static ParseResult parse(ParseSession session, String source) {
        return session.parse(FixtureCstParser.parse(source), source);
    }

    @Test
    @Tag("unit")
    void reportsDiagnosticsAlongsideStatements() {
        ParseResult result = parse(lenientSession(false), "cube(10)\nsphere(5);");

        assertThat(result.hasErrors()).isTrue();
        assertThat(result.errors()).extracting(ParserError::getCode).containsExactly(ErrorCode.MISSING_SEMICOLON);
        assertThat(result.statements()).hasSize(2);
        assertThat(result.statements()).allMatch(statement -> statement instanceof ModuleInstantiationNode);
    }

    @Test
    @Tag("unit")
    void defaultSessionThrowsFirstCriticalError() {
        ParseSession session = new ParseSession();

        assertThatThrownBy(() -> parse(session, "cube(10)\nsphere(5);"))
                .isInstanceOfSatisfying(ParserError.class,
                        error -> assertThat(error.getCode()).isEqualTo(ErrorCode.MISSING_SEMICOLON));
    }

    @Test
    @Tag("unit")
    void recoveredSourceParsesCleanly() {
        ParseSession session = lenientSession(true);
        ParseResult broken = parse(session, "cube(10)\nsphere(5);");

        String fixed = session.recover(broken.errors().get(0), "cube(10)\nsphere(5);");

        assertThat(fixed).isEqualTo("cube(10);\nsphere(5);");
        ParseResult clean = parse(session, fixed);
        assertThat(clean.hasErrors()).isFalse();
        assertThat(clean.errors()).isEmpty();
        assertThat(clean.statements()).hasSize(2);
    }

    @Test
    @Tag("unit")
    void recoveryDisabledReturnsNullButStillSuggests() {
        ParseSession session = lenientSession(false);
        ParseResult broken = parse(session, "cube(10)\nsphere(5);");

        assertThat(session.recover(broken.errors().get(0), "cube(10)\nsphere(5);")).isNull();
        assertThat(session.getRecoverySuggestions(broken.errors().get(0))).containsExactly("Insert missing semicolon");
    }

    @Test
    @Tag("unit")
    void declaredNamesDriveIdentifierCorrection() {
        ParseSession session = lenientSession(true);
        String source = "height = 5;\ncube(heigth);";
        parse(session, source);

        UnknownIdentifierStrategy strategy = session.getErrorHandler().getRecoveryRegistry()
                .getStrategy(UnknownIdentifierStrategy.class).orElseThrow();
        assertThat(strategy.findSimilarIdentifiers("heigth")).containsExactly("height");

        ParserError undefined = new ParserReferenceError("'heigth' is not defined",
                ErrorContext.builder().position(2, 6).build());
        assertThat(session.recover(undefined, source)).isEqualTo("height = 5;\ncube(height);");
    }

    @Test
    @Tag("unit")
    void reparseReplacesNamesFromEarlierSource() {
        ParseSession session = lenientSession(true);
        parse(session, "lenght = 5;\ncube(lenght);");
        String edited = "length = 5;\ncube(lenght);";
        parse(session, edited);

        UnknownIdentifierStrategy strategy = session.getErrorHandler().getRecoveryRegistry()
                .getStrategy(UnknownIdentifierStrategy.class).orElseThrow();
        assertThat(strategy.findSimilarIdentifiers("lenght")).containsExactly("length");

        ParserError undefined = new ParserReferenceError("'lenght' is not defined",
                ErrorContext.builder().position(2, 6).build());
        assertThat(session.recover(undefined, edited)).isEqualTo("length = 5;\ncube(length);");
    }

    @Test
    @Tag("unit")
    void eachParseStartsWithNoErrors() {
        ParseSession session = lenientSession(false);
        parse(session, "cube(10)\nsphere(5);");

        ParseResult second = parse(session, "cube(10);");

        assertThat(second.errors()).isEmpty();
        assertThat(session.getErrorHandler().hasErrors()).isFalse();
    }

    @Test
    @Tag("unit")
    void configuredFromErrorHandlerBlock() {
        ParseSession session = ParseSession.fromConfig(ConfigFactory.parseResources("test-config.conf"));

        assertThat(session.getErrorHandler().getOptions().throwErrors()).isFalse();
        assertThat(session.getErrorHandler().getOptions().attemptRecovery()).isTrue();

        ParseResult result = parse(session, "cube(10)\nsphere(5);");
        assertThat(result.errors()).hasSize(1);
    }

    @Test
    @Tag("unit")
    void defaultsComeFromReferenceConfig() {
        ErrorHandlerOptions options = ParseSession.fromDefaults().getErrorHandler().getOptions();

        assertThat(options.throwErrors()).isEqualTo(ErrorHandlerOptions.defaults().throwErrors());
        assertThat(options.attemptRecovery()).isEqualTo(ErrorHandlerOptions.defaults().attemptRecovery());
        assertThat(options.minSeverity()).isEqualTo(ErrorHandlerOptions.defaults().minSeverity());
    }
}
