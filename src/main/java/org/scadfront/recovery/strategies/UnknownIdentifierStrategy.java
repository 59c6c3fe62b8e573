package org.scadfront.recovery.strategies;

import org.scadfront.diagnostics.ErrorCode;
import org.scadfront.diagnostics.ErrorLocation;
import org.scadfront.diagnostics.ParserError;
import org.scadfront.recovery.AbstractRecoveryStrategy;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces a misspelled identifier with the closest known name.
 *
 * <p>Known names are registered by the caller's symbol resolver, keyed by the scope that is current
 * when they are added. A scope is identified by its path joined with {@code ::}; the global scope is
 * the empty path. Lookups consider the current scope and then the global scope.</p>
 */
public class UnknownIdentifierStrategy extends AbstractRecoveryStrategy {

    static final int MAX_SUGGESTIONS = 3;
    static final int MAX_EDIT_DISTANCE = 2;

    private static final String GLOBAL_SCOPE = "";
    private static final String SCOPE_SEPARATOR = "::";

    private static final List<Pattern> IDENTIFIER_PATTERNS = List.of(
            Pattern.compile("undefined (?:variable|function|module) ['\"]([^'\"]+)['\"]", Pattern.CASE_INSENSITIVE),
            Pattern.compile("['\"]([^'\"]+)['\"] is not defined", Pattern.CASE_INSENSITIVE),
            Pattern.compile("unknown identifier ['\"]([^'\"]+)['\"]", Pattern.CASE_INSENSITIVE));

    private static final Pattern REFERENCE_MESSAGE =
            Pattern.compile("is not defined|undefined (?:variable|function|module)", Pattern.CASE_INSENSITIVE);

    // scope key -> name -> every kind registered under that name
    private final Map<String, Map<String, Set<IdentifierKind>>> scopedIdentifiers = new HashMap<>();
    private List<String> currentScope = List.of();

    private record Candidate(String name, IdentifierKind kind, int distance) {
    }

    private static final Comparator<Candidate> RANKING = Comparator
            .comparingInt(Candidate::distance)
            .thenComparing(candidate -> candidate.kind() != IdentifierKind.VARIABLE)
            .thenComparing(Candidate::name);

    @Override
    public int priority() {
        return 30;
    }

    /**
     * Sets the scope that subsequent {@link #addIdentifier} calls and lookups use.
     * @param scope The scope path, outermost first; empty for the global scope.
     */
    public void setCurrentScope(List<String> scope) {
        this.currentScope = List.copyOf(scope);
    }

    public List<String> getCurrentScope() {
        return currentScope;
    }

    /**
     * Registers a known name in the current scope. A name may be registered once per kind, so a module
     * and a variable can share it.
     * @param name The identifier.
     * @param kind What it names.
     */
    public void addIdentifier(String name, IdentifierKind kind) {
        scopedIdentifiers.computeIfAbsent(scopeKey(currentScope), key -> new LinkedHashMap<>())
                .computeIfAbsent(name, key -> EnumSet.noneOf(IdentifierKind.class))
                .add(kind);
    }

    /**
     * @return True if the name is registered with that kind in the current or the global scope.
     */
    public boolean isKnown(String name, IdentifierKind kind) {
        for (String scope : visibleScopes()) {
            Set<IdentifierKind> kinds = scopedIdentifiers.getOrDefault(scope, Map.of()).get(name);
            if (kinds != null && kinds.contains(kind)) {
                return true;
            }
        }
        return false;
    }

    public void addIdentifier(String name) {
        addIdentifier(name, IdentifierKind.VARIABLE);
    }

    /**
     * Forgets all known names in every scope and resets the current scope to global.
     */
    public void clearIdentifiers() {
        scopedIdentifiers.clear();
        currentScope = List.of();
    }

    @Override
    public boolean canHandle(ParserError error) {
        ErrorCode code = error.getCode();
        if (code == ErrorCode.UNDEFINED_VARIABLE || code == ErrorCode.UNDEFINED_FUNCTION
                || code == ErrorCode.UNDEFINED_MODULE) {
            return true;
        }
        return code == ErrorCode.REFERENCE_ERROR
                && error.getMessage() != null
                && REFERENCE_MESSAGE.matcher(error.getMessage()).find();
    }

    @Override
    public String recover(ParserError error, String code) {
        ErrorLocation position = getErrorPosition(error);
        if (position == null || getLine(code, position.line()) == null) {
            return null;
        }
        String identifier = extractIdentifier(error);
        if (identifier == null) {
            return null;
        }
        List<String> suggestions = findSimilarIdentifiers(identifier);
        if (suggestions.isEmpty()) {
            return null;
        }
        error.getContext().setSuggestions(suggestions);
        return replaceIdentifier(code, position, identifier, suggestions.get(0));
    }

    /**
     * Ranks known names by edit distance to the given name.
     * @param name The unknown identifier.
     * @return Up to three names within edit distance 2, closest first, variables before other kinds
     *         at equal distance, then alphabetical.
     */
    public List<String> findSimilarIdentifiers(String name) {
        Map<String, Candidate> best = new HashMap<>();
        for (String scope : visibleScopes()) {
            Map<String, Set<IdentifierKind>> identifiers = scopedIdentifiers.getOrDefault(scope, Map.of());
            for (Map.Entry<String, Set<IdentifierKind>> entry : identifiers.entrySet()) {
                int distance = LevenshteinDistance.between(name, entry.getKey());
                if (distance > MAX_EDIT_DISTANCE) {
                    continue;
                }
                Candidate candidate = new Candidate(entry.getKey(), rankingKind(entry.getValue()), distance);
                // Inner scopes shadow outer ones.
                best.putIfAbsent(candidate.name(), candidate);
            }
        }

        List<Candidate> ranked = new ArrayList<>(best.values());
        ranked.sort(RANKING);
        List<String> names = new ArrayList<>();
        for (int i = 0; i < ranked.size() && i < MAX_SUGGESTIONS; i++) {
            names.add(ranked.get(i).name());
        }
        return names;
    }

    @Override
    public String getRecoverySuggestion(ParserError error) {
        List<String> suggestions = error.getContext().getSuggestions();
        if (suggestions == null || suggestions.isEmpty()) {
            return "Check for typos or missing variable/function declarations";
        }
        StringBuilder sb = new StringBuilder("Did you mean ");
        for (int i = 0; i < suggestions.size(); i++) {
            if (i > 0) {
                sb.append(" or ");
            }
            sb.append('\'').append(suggestions.get(i)).append('\'');
        }
        return sb.append('?').toString();
    }

    private static String extractIdentifier(ParserError error) {
        String found = error.getContext().getFound();
        if (found != null && !found.isEmpty()) {
            return found;
        }
        String message = error.getMessage();
        if (message == null) {
            return null;
        }
        for (Pattern pattern : IDENTIFIER_PATTERNS) {
            Matcher matcher = pattern.matcher(message);
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        return null;
    }

    private String replaceIdentifier(String code, ErrorLocation position, String oldName, String newName) {
        int lineStart = getLineStartOffset(code, position.line());
        if (lineStart < 0) {
            return null;
        }
        int offset = lineStart + position.column() - 1;
        if (offset < 0 || offset + oldName.length() > code.length()) {
            return null;
        }
        if (!code.startsWith(oldName, offset)) {
            return null;
        }
        return code.substring(0, offset) + newName + code.substring(offset + oldName.length());
    }

    private Set<String> visibleScopes() {
        Set<String> scopes = new LinkedHashSet<>();
        scopes.add(scopeKey(currentScope));
        scopes.add(GLOBAL_SCOPE);
        return scopes;
    }

    // EnumSet iterates in declaration order, so VARIABLE wins when present.
    private static IdentifierKind rankingKind(Set<IdentifierKind> kinds) {
        return kinds.iterator().next();
    }

    private static String scopeKey(List<String> scope) {
        return String.join(SCOPE_SEPARATOR, scope);
    }
}
