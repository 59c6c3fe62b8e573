package org.scadfront.recovery;

import org.scadfront.diagnostics.ErrorContext;
import org.scadfront.diagnostics.ErrorLocation;
import org.scadfront.diagnostics.ParserError;

/**
 * Base class with line-oriented text helpers. Line and column arguments are 1-based; lines are
 * separated by {@code \n}.
 */
public abstract class AbstractRecoveryStrategy implements RecoveryStrategy {

    /**
     * @param error The error.
     * @return The error's line and column, or null if either is unknown.
     */
    protected ErrorLocation getErrorPosition(ParserError error) {
        ErrorContext context = error.getContext();
        return context.hasPosition() ? new ErrorLocation(context.getLine(), context.getColumn()) : null;
    }

    /**
     * @return The line's text without its terminator, or null if the line does not exist.
     */
    protected String getLine(String code, int lineNumber) {
        String[] lines = splitLines(code);
        return lineNumber > 0 && lineNumber <= lines.length ? lines[lineNumber - 1] : null;
    }

    /**
     * @return The code with the given line replaced; unchanged if the line does not exist.
     */
    protected String replaceLine(String code, int lineNumber, String newLine) {
        String[] lines = splitLines(code);
        if (lineNumber > 0 && lineNumber <= lines.length) {
            lines[lineNumber - 1] = newLine;
        }
        return String.join("\n", lines);
    }

    /**
     * Inserts text before the given column. Columns past the end of the line append.
     * @return The code with the text inserted; unchanged if the line does not exist.
     */
    protected String insertAtPosition(String code, int line, int column, String text) {
        String[] lines = splitLines(code);
        if (line < 1 || line > lines.length) {
            return code;
        }
        String content = lines[line - 1];
        int index = Math.max(0, Math.min(column - 1, content.length()));
        lines[line - 1] = content.substring(0, index) + text + content.substring(index);
        return String.join("\n", lines);
    }

    /**
     * @return The offset of the first character of the line, or -1 if the line does not exist.
     */
    protected int getLineStartOffset(String code, int lineNumber) {
        String[] lines = splitLines(code);
        if (lineNumber < 1 || lineNumber > lines.length) {
            return -1;
        }
        int offset = 0;
        for (int i = 0; i < lineNumber - 1; i++) {
            offset += lines[i].length() + 1;
        }
        return offset;
    }

    protected static String[] splitLines(String code) {
        return code.split("\n", -1);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(priority=" + priority() + ")";
    }
}
