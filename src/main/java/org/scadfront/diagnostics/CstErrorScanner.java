package org.scadfront.diagnostics;

import org.scadfront.cst.CstNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the error markers a grammar runtime leaves in a CST into diagnostics: {@code ERROR} nodes
 * for unparseable input and zero-width {@code MISSING} tokens the parser inserted to continue.
 *
 * <p>Errors are created, not reported; the caller decides what to do with them.</p>
 */
public class CstErrorScanner {

    static final int SNIPPET_CONTEXT_LINES = 2;
    private static final int MAX_FOUND_LENGTH = 40;

    /**
     * Scans a tree depth-first in source order. The content of an {@code ERROR} node is not
     * scanned further.
     *
     * @param root   The tree root.
     * @param source The source text the tree was parsed from, used for snippets.
     * @return One error per marker, in source order.
     */
    public List<ParserError> scan(CstNode root, String source) {
        List<ParserError> errors = new ArrayList<>();
        if (root != null) {
            scan(root, source != null ? source : "", errors);
        }
        return errors;
    }

    private void scan(CstNode node, String source, List<ParserError> errors) {
        if (node.isError()) {
            errors.add(errorNode(node, source));
            return;
        }
        if (node.isMissing()) {
            errors.add(missingNode(node, source));
            return;
        }
        for (CstNode child : node.children()) {
            scan(child, source, errors);
        }
    }

    private ParserError errorNode(CstNode node, String source) {
        int line = node.startPoint().row() + 1;
        int column = node.startPoint().column() + 1;
        String found = abbreviate(node.text());
        ErrorContext context = ErrorContext.builder()
                .position(line, column)
                .length(Math.max(0, node.endByte() - node.startByte()))
                .source(snippet(source, node.startPoint().row()))
                .nodeType(node.type())
                .found(found)
                .build();
        String message = found.isEmpty()
                ? "Syntax error at line " + line + ", column " + column
                : "Syntax error at line " + line + ", column " + column + ": unexpected '" + found + "'";
        return new ParserSyntaxError(message, context);
    }

    private ParserError missingNode(CstNode node, String source) {
        String token = node.type();
        ErrorCode code = switch (token) {
            case ";" -> ErrorCode.MISSING_SEMICOLON;
            case ")" -> ErrorCode.UNCLOSED_PAREN;
            case "]" -> ErrorCode.UNCLOSED_BRACKET;
            case "}" -> ErrorCode.UNCLOSED_BRACE;
            default -> ErrorCode.UNEXPECTED_TOKEN;
        };
        String message = switch (code) {
            case MISSING_SEMICOLON -> "Missing semicolon";
            case UNCLOSED_PAREN, UNCLOSED_BRACKET, UNCLOSED_BRACE -> "Missing closing '" + token + "'";
            default -> "Missing '" + token + "'";
        };
        ErrorContext context = ErrorContext.builder()
                .position(node.startPoint().row() + 1, node.startPoint().column() + 1)
                .length(0)
                .source(snippet(source, node.startPoint().row()))
                .nodeType(token)
                .expected(List.of(token))
                .suggestion("Insert '" + token + "'")
                .build();
        return new ParserError(message, code, Severity.ERROR, context);
    }

    /**
     * @return The lines from two before to two after the given 0-based row.
     */
    static String snippet(String source, int row) {
        String[] lines = source.split("\n", -1);
        if (row < 0 || row >= lines.length) {
            return "";
        }
        int from = Math.max(0, row - SNIPPET_CONTEXT_LINES);
        int to = Math.min(lines.length - 1, row + SNIPPET_CONTEXT_LINES);
        StringBuilder sb = new StringBuilder();
        for (int i = from; i <= to; i++) {
            if (i > from) {
                sb.append('\n');
            }
            sb.append(lines[i]);
        }
        return sb.toString();
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.strip();
        return trimmed.length() <= MAX_FOUND_LENGTH ? trimmed : trimmed.substring(0, MAX_FOUND_LENGTH) + "...";
    }
}
