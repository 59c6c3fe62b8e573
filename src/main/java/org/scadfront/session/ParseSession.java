package org.scadfront.session;

import com.typesafe.config.Config;
import org.scadfront.config.ConfigLoader;
import org.scadfront.cst.CstNode;
import org.scadfront.diagnostics.CstErrorScanner;
import org.scadfront.diagnostics.ErrorHandler;
import org.scadfront.diagnostics.ErrorHandlerOptions;
import org.scadfront.diagnostics.ParserError;
import org.scadfront.frontend.ast.StatementNode;
import org.scadfront.frontend.semantics.IdentifierCollector;
import org.scadfront.frontend.visitor.AstBuilder;
import org.scadfront.recovery.strategies.UnknownIdentifierStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Front door for turning a parsed CST into an AST with diagnostics.
 *
 * <p>A session owns one {@link ErrorHandler} (with its logger and recovery registry) and one
 * {@link AstBuilder}. Sessions share nothing; use one per document. Not thread-safe.</p>
 */
public class ParseSession {

    private static final Logger log = LoggerFactory.getLogger(ParseSession.class);

    private final ErrorHandler errorHandler;
    private final AstBuilder astBuilder;
    private final CstErrorScanner errorScanner = new CstErrorScanner();

    public ParseSession() {
        this(ErrorHandlerOptions.defaults());
    }

    public ParseSession(ErrorHandlerOptions options) {
        this(new ErrorHandler(options), new AstBuilder());
    }

    public ParseSession(ErrorHandler errorHandler, AstBuilder astBuilder) {
        this.errorHandler = Objects.requireNonNull(errorHandler, "errorHandler");
        this.astBuilder = Objects.requireNonNull(astBuilder, "astBuilder");
    }

    /**
     * Creates a session from {@code reference.conf} and system properties.
     */
    public static ParseSession fromDefaults() {
        return new ParseSession(ConfigLoader.errorHandlerOptions(ConfigLoader.defaults()));
    }

    /**
     * Creates a session from host settings layered over the defaults. Only the
     * {@code scadfront.error-handler} block is read.
     *
     * @param overrides Settings supplied by the host.
     */
    public static ParseSession fromConfig(Config overrides) {
        return new ParseSession(ConfigLoader.errorHandlerOptions(ConfigLoader.withOverrides(overrides)));
    }

    /**
     * Reports the tree's error markers, builds the AST and registers the declared names with the
     * unknown-identifier strategy. Errors and names from earlier calls are discarded first.
     *
     * @param root   The CST root, usually a {@code source_file} node.
     * @param source The text the tree was parsed from.
     * @return The statements and the collected diagnostics.
     * @throws ParserError the first critical diagnostic, when the handler is set to throw.
     */
    public ParseResult parse(CstNode root, String source) {
        errorHandler.clearErrors();
        for (ParserError error : errorScanner.scan(root, source)) {
            errorHandler.report(error);
        }
        List<StatementNode> statements = astBuilder.buildProgram(root);
        errorHandler.getRecoveryRegistry()
                .getStrategy(UnknownIdentifierStrategy.class)
                .ifPresent(strategy -> {
                    strategy.clearIdentifiers();
                    new IdentifierCollector(strategy).collect(statements);
                });
        log.debug("Built {} statements with {} diagnostics", statements.size(), errorHandler.getErrors().size());
        return new ParseResult(statements, errorHandler.getErrors());
    }

    /**
     * @return A corrected source to re-parse, or null if recovery is disabled or no strategy applies.
     */
    public String recover(ParserError error, String source) {
        return errorHandler.attemptRecovery(error, source);
    }

    public List<String> getRecoverySuggestions(ParserError error) {
        return errorHandler.getRecoverySuggestions(error);
    }

    public ErrorHandler getErrorHandler() {
        return errorHandler;
    }
}
