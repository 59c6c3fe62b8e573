package org.scadfront.recovery;

import org.scadfront.diagnostics.ParserError;
import org.scadfront.recovery.strategies.MissingSemicolonStrategy;
import org.scadfront.recovery.strategies.UnclosedBracketStrategy;
import org.scadfront.recovery.strategies.UnknownIdentifierStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Ordered chain of recovery strategies. Each error handler owns its own registry.
 *
 * <p>A new registry holds the missing-semicolon, unclosed-bracket and unknown-identifier strategies.
 * The type-mismatch strategy needs a type oracle and must be registered by the caller.</p>
 */
public class RecoveryStrategyRegistry {

    private static final Logger log = LoggerFactory.getLogger(RecoveryStrategyRegistry.class);

    private final List<RecoveryStrategy> strategies = new ArrayList<>();

    public RecoveryStrategyRegistry() {
        register(new MissingSemicolonStrategy());
        register(new UnclosedBracketStrategy());
        register(new UnknownIdentifierStrategy());
    }

    private RecoveryStrategyRegistry(List<RecoveryStrategy> source) {
        registerMultiple(source);
    }

    /**
     * Appends a strategy. Registering the same instance twice has no effect.
     * @param strategy The strategy.
     */
    public void register(RecoveryStrategy strategy) {
        for (RecoveryStrategy existing : strategies) {
            if (existing == strategy) {
                return;
            }
        }
        strategies.add(strategy);
    }

    public void registerMultiple(List<? extends RecoveryStrategy> toRegister) {
        for (RecoveryStrategy strategy : toRegister) {
            register(strategy);
        }
    }

    /**
     * Removes a strategy instance if present.
     * @param strategy The strategy.
     */
    public void unregister(RecoveryStrategy strategy) {
        strategies.removeIf(existing -> existing == strategy);
    }

    public void clear() {
        strategies.clear();
    }

    /**
     * @return The strategies in registration order, as an unmodifiable snapshot.
     */
    public List<RecoveryStrategy> getStrategies() {
        return Collections.unmodifiableList(new ArrayList<>(strategies));
    }

    public int getStrategyCount() {
        return strategies.size();
    }

    /**
     * Tries each strategy that can handle the error, in registration order. A strategy that throws is
     * logged and skipped. The first result that is non-null and differs from the input wins.
     *
     * @param error The error.
     * @param code  The source text.
     * @return The corrected source, or null if no strategy produced a change.
     */
    public String attemptRecovery(ParserError error, String code) {
        for (RecoveryStrategy strategy : strategies) {
            if (!strategy.canHandle(error)) {
                continue;
            }
            try {
                String recovered = strategy.recover(error, code);
                if (recovered != null && !recovered.equals(code)) {
                    return recovered;
                }
            } catch (RuntimeException e) {
                log.warn("Recovery strategy {} failed for [{}]: {}",
                        strategy.getClass().getSimpleName(), error.getCode().code(), e.getMessage());
                log.debug("Recovery strategy failure", e);
            }
        }
        return null;
    }

    /**
     * Collects the suggestion of every strategy that can handle the error.
     * @param error The error.
     * @return The non-empty suggestions in registration order.
     */
    public List<String> getRecoverySuggestions(ParserError error) {
        List<String> suggestions = new ArrayList<>();
        for (RecoveryStrategy strategy : strategies) {
            if (!strategy.canHandle(error)) {
                continue;
            }
            try {
                String suggestion = strategy.getRecoverySuggestion(error);
                if (suggestion != null && !suggestion.isEmpty()) {
                    suggestions.add(suggestion);
                }
            } catch (RuntimeException e) {
                log.warn("Strategy {} failed to provide a suggestion: {}",
                        strategy.getClass().getSimpleName(), e.getMessage());
            }
        }
        return suggestions;
    }

    /**
     * @return The first strategy that can handle the error.
     */
    public Optional<RecoveryStrategy> findStrategy(ParserError error) {
        for (RecoveryStrategy strategy : strategies) {
            if (strategy.canHandle(error)) {
                return Optional.of(strategy);
            }
        }
        return Optional.empty();
    }

    public boolean canRecover(ParserError error) {
        return findStrategy(error).isPresent();
    }

    /**
     * @param type The strategy class.
     * @return The first registered strategy of that class.
     */
    public <T extends RecoveryStrategy> Optional<T> getStrategy(Class<T> type) {
        for (RecoveryStrategy strategy : strategies) {
            if (type.isInstance(strategy)) {
                return Optional.of(type.cast(strategy));
            }
        }
        return Optional.empty();
    }

    /**
     * @return A registry holding the same strategy instances, without the defaults being re-added.
     */
    public RecoveryStrategyRegistry copy() {
        return new RecoveryStrategyRegistry(strategies);
    }
}
