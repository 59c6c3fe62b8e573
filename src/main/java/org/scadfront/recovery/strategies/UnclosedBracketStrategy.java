package org.scadfront.recovery.strategies;

import org.scadfront.diagnostics.ErrorCode;
import org.scadfront.diagnostics.ErrorLocation;
import org.scadfront.diagnostics.ParserError;
import org.scadfront.recovery.AbstractRecoveryStrategy;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Inserts the closer of the innermost bracket left open on the error line, at the error column.
 */
public class UnclosedBracketStrategy extends AbstractRecoveryStrategy {

    private enum Bracket {
        PAREN('(', ')', ErrorCode.UNCLOSED_PAREN, "parenthesis"),
        BRACKET('[', ']', ErrorCode.UNCLOSED_BRACKET, "bracket"),
        BRACE('{', '}', ErrorCode.UNCLOSED_BRACE, "brace");

        final char open;
        final char close;
        final ErrorCode code;
        final String noun;

        Bracket(char open, char close, ErrorCode code, String noun) {
            this.open = open;
            this.close = close;
            this.code = code;
            this.noun = noun;
        }

        static Bracket opening(char c) {
            for (Bracket bracket : values()) {
                if (bracket.open == c) {
                    return bracket;
                }
            }
            return null;
        }

        static boolean isClosing(char c) {
            for (Bracket bracket : values()) {
                if (bracket.close == c) {
                    return true;
                }
            }
            return false;
        }
    }

    @Override
    public int priority() {
        return 40;
    }

    @Override
    public boolean canHandle(ParserError error) {
        ErrorCode code = error.getCode();
        if (code == ErrorCode.UNCLOSED_PAREN || code == ErrorCode.UNCLOSED_BRACKET || code == ErrorCode.UNCLOSED_BRACE) {
            return true;
        }
        String message = error.getMessage();
        return code == ErrorCode.SYNTAX_ERROR && message != null && message.contains("missing")
                && (message.contains(")") || message.contains("]") || message.contains("}"));
    }

    @Override
    public String recover(ParserError error, String code) {
        ErrorLocation position = getErrorPosition(error);
        if (position == null) {
            return null;
        }
        String line = getLine(code, position.line());
        if (line == null || line.isEmpty()) {
            return null;
        }
        Bracket unclosed = innermostUnclosed(line, position.column() - 1);
        if (unclosed == null) {
            return null;
        }
        return insertAtPosition(code, position.line(), position.column(), String.valueOf(unclosed.close));
    }

    /**
     * Scans the line up to and including the given index.
     */
    private static Bracket innermostUnclosed(String line, int lastIndex) {
        Deque<Bracket> stack = new ArrayDeque<>();
        int end = Math.min(lastIndex, line.length() - 1);
        for (int i = 0; i <= end; i++) {
            char c = line.charAt(i);
            Bracket opening = Bracket.opening(c);
            if (opening != null) {
                stack.push(opening);
            } else if (Bracket.isClosing(c) && !stack.isEmpty() && stack.peek().close == c) {
                stack.pop();
            }
        }
        return stack.peek();
    }

    @Override
    public String getRecoverySuggestion(ParserError error) {
        ErrorCode code = error.getCode();
        String message = error.getMessage() != null ? error.getMessage() : "";
        for (Bracket bracket : Bracket.values()) {
            if (code == bracket.code || (code == ErrorCode.SYNTAX_ERROR && message.indexOf(bracket.close) >= 0)) {
                return "Insert missing closing " + bracket.noun;
            }
        }
        return "Insert missing closing bracket/brace/parenthesis";
    }
}
