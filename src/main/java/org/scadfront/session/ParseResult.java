package org.scadfront.session;

import org.scadfront.diagnostics.ParserError;
import org.scadfront.diagnostics.Severity;
import org.scadfront.frontend.ast.StatementNode;

import java.util.List;

/**
 * Outcome of one {@link ParseSession#parse} call.
 *
 * @param statements The top-level statements that could be built, in source order.
 * @param errors     The diagnostics collected while parsing, in report order.
 */
public record ParseResult(List<StatementNode> statements, List<ParserError> errors) {

    public ParseResult {
        statements = List.copyOf(statements);
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return errors.stream().anyMatch(error -> error.getSeverity().isAtLeast(Severity.ERROR));
    }
}
