package org.scadfront.recovery.strategies;

import org.scadfront.diagnostics.ErrorCode;
import org.scadfront.diagnostics.ErrorLocation;
import org.scadfront.diagnostics.ParserError;
import org.scadfront.recovery.AbstractRecoveryStrategy;

import java.util.Locale;

/**
 * Appends a missing {@code ;} to the end of the offending line, ahead of any trailing comment.
 */
public class MissingSemicolonStrategy extends AbstractRecoveryStrategy {

    @Override
    public int priority() {
        return 50;
    }

    @Override
    public boolean canHandle(ParserError error) {
        if (error.getCode() == ErrorCode.MISSING_SEMICOLON) {
            return true;
        }
        return error.getCode() == ErrorCode.SYNTAX_ERROR
                && error.getMessage() != null
                && error.getMessage().toLowerCase(Locale.ROOT).contains("missing semicolon");
    }

    @Override
    public String recover(ParserError error, String code) {
        ErrorLocation position = getErrorPosition(error);
        if (position == null) {
            return null;
        }
        String line = getLine(code, position.line());
        if (line == null) {
            return null;
        }

        int last = lastCodeIndex(line);
        // Nothing to terminate, or already terminated.
        if (last < 0 || line.charAt(last) == ';') {
            return null;
        }
        String fixed = line.substring(0, last + 1) + ";" + line.substring(last + 1);
        return replaceLine(code, position.line(), fixed);
    }

    @Override
    public String getRecoverySuggestion(ParserError error) {
        return "Insert missing semicolon";
    }

    /**
     * Finds the last character that is code rather than whitespace or comment. Block comments closed on
     * the same line are skipped; an unclosed one, like a line comment, runs to the end of the line.
     *
     * @return The index, or -1 if the line holds no code.
     */
    private static int lastCodeIndex(String line) {
        int last = -1;
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                last = Math.min(i, line.length() - 1);
            } else if (c == '/' && i + 1 < line.length() && line.charAt(i + 1) == '/') {
                break;
            } else if (c == '/' && i + 1 < line.length() && line.charAt(i + 1) == '*') {
                int close = line.indexOf("*/", i + 2);
                if (close < 0) {
                    break;
                }
                i = close + 1;
            } else if (!Character.isWhitespace(c)) {
                if (c == '"' || c == '\'') {
                    quote = c;
                }
                last = i;
            }
        }
        return last;
    }
}
