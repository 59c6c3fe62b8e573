package org.scadfront.recovery;

import org.scadfront.diagnostics.ParserError;

/**
 * A pluggable rule that proposes an automatic source correction for one shape of error.
 */
public interface RecoveryStrategy {

    /**
     * @return Informational priority; higher means more specific. The registry tries strategies in
     *         registration order regardless.
     */
    int priority();

    /**
     * @param error The reported error.
     * @return True if this strategy recognizes the error.
     */
    boolean canHandle(ParserError error);

    /**
     * Proposes corrected source text.
     *
     * @param error The reported error; strategies may record findings on its context.
     * @param code  The full source text.
     * @return The corrected source, or null if this strategy has nothing to offer.
     */
    String recover(ParserError error, String code);

    /**
     * @param error The reported error.
     * @return A short human-readable fix description.
     */
    String getRecoverySuggestion(ParserError error);
}
